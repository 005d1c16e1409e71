package io.vena.thicket;

import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Checks values against {@link Constraints}.
 *
 * <p>
 * The runtime treats this as a pass/fail oracle: it never inspects the rules itself.
 * Implementations should not throw for a rejected value; they return a failed {@link Evaluation}.
 * Anything they do throw is wrapped by the runtime into a
 * {@link io.vena.thicket.exceptions.ValidationException}.
 */
public interface SchemaEvaluator {
	Evaluation evaluate(@Nullable Object value, Constraints constraints);

	/**
	 * A missing value fails only if the field is required;
	 * otherwise it is checked against the field's constraints.
	 */
	default Evaluation evaluateField(FieldSpec field, @Nullable Object value) {
		if (value == null) {
			return field.required() ? Evaluation.fail("required") : Evaluation.pass();
		}
		return evaluate(value, field.constraints());
	}

	default boolean evaluateAll(Map<String, Object> valuesByField, FieldTable fieldTable) {
		for (FieldSpec field: fieldTable) {
			if (!evaluateField(field, valuesByField.get(field.name())).ok()) {
				return false;
			}
		}
		return true;
	}
}
