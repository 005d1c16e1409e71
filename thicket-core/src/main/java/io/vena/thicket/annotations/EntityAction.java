package io.vena.thicket.annotations;

import io.vena.thicket.ActionProfile;
import io.vena.thicket.EntityType;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a method to be registered as an action
 * for an object passed to {@link EntityType.Builder#actionsFrom}.
 *
 * <p>
 * The method must have parameters <code>(Entity, Map&lt;String, Object&gt;)</code>,
 * must not be static or private, and may return anything, including <code>void</code>.
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface EntityAction {
	/**
	 * The action name. Defaults to the method name.
	 */
	String name() default "";

	/**
	 * "*" admits any caller.
	 */
	String[] roles() default { "*" };

	ActionProfile profile() default ActionProfile.COMMAND;

	String description() default "";
}
