package io.vena.thicket;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableMap;

/**
 * The rule set that a {@link SchemaEvaluator} checks a single value against.
 *
 * <p>
 * Every rule is optional; a null rule is not checked.
 * Length rules apply to strings and collections;
 * range rules apply to numbers and are inclusive unless the exclusive variants are used.
 * {@link #pattern} must match the whole string.
 *
 * <p>
 * {@link #required} is tri-state: null means "decide from context"
 * (for a field, a field with no default is required;
 * for an action input, absent means optional).
 */
@Value
@Builder(toBuilder = true)
public class Constraints {
	@Default ValueType type = ValueType.ANY;
	@Nullable Integer minLength;
	@Nullable Integer maxLength;
	@Nullable Number minimum;
	@Nullable Number maximum;
	@Nullable Number exclusiveMinimum;
	@Nullable Number exclusiveMaximum;
	@Nullable String pattern;
	@Nullable List<Object> enumValues;
	@Nullable Boolean required;
	@Nullable String description;

	private static final Constraints NONE = Constraints.builder().build();

	public static Constraints none() {
		return NONE;
	}

	public static Constraints length(int min, int max) {
		return Constraints.builder().type(ValueType.STRING).minLength(min).maxLength(max).build();
	}

	public static Constraints range(Number min, Number max) {
		return Constraints.builder().type(ValueType.NUMBER).minimum(min).maximum(max).build();
	}

	public boolean isRequired() {
		return Boolean.TRUE.equals(required);
	}

	/**
	 * Only the rules that are set, in a stable order, for schema export.
	 */
	public Map<String, Object> toPlainMapping() {
		Map<String, Object> result = new LinkedHashMap<>();
		if (type != ValueType.ANY) {
			result.put("type", type.name().toLowerCase());
		}
		putIfSet(result, "minLength", minLength);
		putIfSet(result, "maxLength", maxLength);
		putIfSet(result, "minimum", minimum);
		putIfSet(result, "maximum", maximum);
		putIfSet(result, "exclusiveMinimum", exclusiveMinimum);
		putIfSet(result, "exclusiveMaximum", exclusiveMaximum);
		putIfSet(result, "pattern", pattern);
		putIfSet(result, "enum", enumValues);
		putIfSet(result, "required", required);
		putIfSet(result, "description", description);
		return unmodifiableMap(result);
	}

	private static void putIfSet(Map<String, Object> map, String key, @Nullable Object value) {
		if (value != null) {
			map.put(key, value);
		}
	}
}
