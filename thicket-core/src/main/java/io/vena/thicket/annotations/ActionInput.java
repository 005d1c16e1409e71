package io.vena.thicket.annotations;

import io.vena.thicket.ValueType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares the constraints on one input of an {@link EntityAction} method.
 *
 * <p>
 * Annotation members can't be null, so unset bounds use sentinels:
 * a negative length, a NaN number, or an empty string.
 */
@Retention(RUNTIME)
@Target(METHOD)
@Repeatable(ActionInputs.class)
public @interface ActionInput {
	String name();
	ValueType type() default ValueType.ANY;
	boolean required() default false;
	int minLength() default -1;
	int maxLength() default -1;
	double minimum() default Double.NaN;
	double maximum() default Double.NaN;
	String pattern() default "";
	String[] enumValues() default {};
	String description() default "";
}
