package io.vena.thicket;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Evaluates the rules of {@link Constraints} directly.
 *
 * <p>
 * Patterns are compiled once and shared across calls.
 */
public final class DefaultSchemaEvaluator implements SchemaEvaluator {
	private final Map<String, Pattern> compiledPatterns = new ConcurrentHashMap<>();

	@Override
	public Evaluation evaluate(@Nullable Object value, Constraints c) {
		if (value == null) {
			return c.isRequired() ? Evaluation.fail("required") : Evaluation.pass();
		}
		if (!c.type().matches(value)) {
			return Evaluation.fail("expected " + c.type().name().toLowerCase() + " but got " + value.getClass().getSimpleName());
		}
		Integer length = lengthOf(value);
		if (length != null) {
			if (c.minLength() != null && length < c.minLength()) {
				return Evaluation.fail("length " + length + " is less than " + c.minLength());
			}
			if (c.maxLength() != null && length > c.maxLength()) {
				return Evaluation.fail("length " + length + " is greater than " + c.maxLength());
			}
		}
		if (value instanceof Number) {
			BigDecimal number = decimal((Number) value);
			if (c.minimum() != null && number.compareTo(decimal(c.minimum())) < 0) {
				return Evaluation.fail(value + " is less than " + c.minimum());
			}
			if (c.maximum() != null && number.compareTo(decimal(c.maximum())) > 0) {
				return Evaluation.fail(value + " is greater than " + c.maximum());
			}
			if (c.exclusiveMinimum() != null && number.compareTo(decimal(c.exclusiveMinimum())) <= 0) {
				return Evaluation.fail(value + " is not greater than " + c.exclusiveMinimum());
			}
			if (c.exclusiveMaximum() != null && number.compareTo(decimal(c.exclusiveMaximum())) >= 0) {
				return Evaluation.fail(value + " is not less than " + c.exclusiveMaximum());
			}
		}
		if (c.pattern() != null && value instanceof CharSequence) {
			Pattern pattern = compiledPatterns.computeIfAbsent(c.pattern(), Pattern::compile);
			if (!pattern.matcher((CharSequence) value).matches()) {
				return Evaluation.fail("does not match " + c.pattern());
			}
		}
		if (c.enumValues() != null && !c.enumValues().contains(value)) {
			return Evaluation.fail("not one of " + c.enumValues());
		}
		return Evaluation.pass();
	}

	private static @Nullable Integer lengthOf(Object value) {
		if (value instanceof CharSequence) {
			return ((CharSequence) value).length();
		} else if (value instanceof Collection) {
			return ((Collection<?>) value).size();
		} else if (value instanceof Map) {
			return ((Map<?, ?>) value).size();
		} else {
			return null;
		}
	}

	private static BigDecimal decimal(Number n) {
		if (n instanceof BigDecimal) {
			return (BigDecimal) n;
		} else if (n instanceof Double || n instanceof Float) {
			return BigDecimal.valueOf(n.doubleValue());
		} else {
			return new BigDecimal(n.toString());
		}
	}
}
