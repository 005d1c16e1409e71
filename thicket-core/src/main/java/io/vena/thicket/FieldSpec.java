package io.vena.thicket;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableMap;

/**
 * Declaration of one entity field.
 *
 * <p>
 * A field is required iff it has no default,
 * unless {@link Constraints#required()} says otherwise.
 */
@Value
public class FieldSpec {
	String name;
	Constraints constraints;
	@Nullable Object defaultValue;
	boolean required;

	public static FieldSpec of(String name, Constraints constraints) {
		return new FieldSpec(name, constraints, null, requiredFor(constraints, null));
	}

	public static FieldSpec of(String name, Constraints constraints, @Nullable Object defaultValue) {
		return new FieldSpec(name, constraints, defaultValue, requiredFor(constraints, defaultValue));
	}

	public static FieldSpec optional(String name, Constraints constraints) {
		return new FieldSpec(name, constraints, null, false);
	}

	private static boolean requiredFor(Constraints constraints, @Nullable Object defaultValue) {
		if (constraints.required() != null) {
			return constraints.required();
		} else {
			return defaultValue == null;
		}
	}

	public Map<String, Object> describe() {
		Map<String, Object> result = new LinkedHashMap<>(constraints.toPlainMapping());
		result.put("required", required);
		if (defaultValue != null) {
			result.put("default", defaultValue);
		}
		return unmodifiableMap(result);
	}
}
