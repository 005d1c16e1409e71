package io.vena.thicket.exceptions;

import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A field value or action parameter was rejected by the schema evaluator,
 * or a required value was missing.
 *
 * <p>
 * For field failures, {@link #actionName()} is null.
 * For action parameter failures, {@link #fieldName()} holds the parameter name.
 */
public class ValidationException extends EntityException {
	private final String fieldName;
	private final @Nullable String actionName;
	private final @Nullable Object rejectedValue;
	private final @Nullable Object constraints;
	private final boolean required;

	public ValidationException(String message, String fieldName, @Nullable String actionName, @Nullable Object rejectedValue, @Nullable Object constraints, boolean required) {
		super(message);
		this.fieldName = fieldName;
		this.actionName = actionName;
		this.rejectedValue = rejectedValue;
		this.constraints = constraints;
		this.required = required;
	}

	public ValidationException(String message, String fieldName, @Nullable Object rejectedValue, Throwable cause) {
		super(message, cause);
		this.fieldName = fieldName;
		this.actionName = null;
		this.rejectedValue = rejectedValue;
		this.constraints = null;
		this.required = false;
	}

	public static ValidationException forField(String fieldName, @Nullable Object rejectedValue, Object constraints, @Nullable String detail) {
		return new ValidationException(
			"Field \"" + fieldName + "\" rejected value " + rejectedValue + (detail == null ? "" : ": " + detail),
			fieldName, null, rejectedValue, constraints, false);
	}

	public static ValidationException requiredField(String fieldName, Object constraints) {
		return new ValidationException("Field \"" + fieldName + "\" is required", fieldName, null, null, constraints, true);
	}

	public static ValidationException forParameter(String actionName, String paramName, @Nullable Object value, @Nullable Object constraints, @Nullable String detail) {
		return new ValidationException(
			"Action \"" + actionName + "\" parameter \"" + paramName + "\" rejected value " + value + (detail == null ? "" : ": " + detail),
			paramName, actionName, value, constraints, false);
	}

	public static ValidationException requiredParameter(String actionName, String paramName, Object constraints) {
		return new ValidationException(
			"Action \"" + actionName + "\" parameter \"" + paramName + "\" is required",
			paramName, actionName, null, constraints, true);
	}

	public String fieldName() { return fieldName; }
	public @Nullable String actionName() { return actionName; }
	public @Nullable Object rejectedValue() { return rejectedValue; }
	public @Nullable Object constraints() { return constraints; }
	public boolean required() { return required; }

	@Override
	public Map<String, Object> details() {
		return detailMap(
			"field", fieldName,
			"action", actionName,
			"value", rejectedValue,
			"constraints", constraints,
			"required", required);
	}
}
