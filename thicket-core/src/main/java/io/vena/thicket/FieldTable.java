package io.vena.thicket;

import io.vena.thicket.exceptions.DefinitionException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.EqualsAndHashCode;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPMap;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * The ordered, immutable set of fields declared by an {@link EntityType}.
 * Iteration follows declaration order.
 */
@EqualsAndHashCode
public final class FieldTable implements Iterable<FieldSpec> {
	private final OrderedPMap<String, FieldSpec> fields;

	private FieldTable(OrderedPMap<String, FieldSpec> fields) {
		this.fields = fields;
	}

	private static final FieldTable EMPTY = new FieldTable(OrderedPMap.empty());

	public static FieldTable empty() {
		return EMPTY;
	}

	/**
	 * @throws DefinitionException for a malformed or duplicate field name
	 */
	public static FieldTable of(String entityType, Collection<FieldSpec> specs) {
		LinkedHashMap<String, FieldSpec> map = new LinkedHashMap<>();
		for (FieldSpec spec: specs) {
			validateName(entityType, spec.name());
			if (map.put(spec.name(), spec) != null) {
				throw new DefinitionException(entityType, spec.name(), "duplicate field name");
			}
			validatePattern(entityType, spec);
		}
		return new FieldTable(OrderedPMap.from(map));
	}

	static void validateName(String entityType, String name) {
		if (name == null || name.isBlank()) {
			throw new DefinitionException(entityType, String.valueOf(name), "field name must not be blank");
		}
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (c == '.' || c == '[' || c == ']') {
				throw new DefinitionException(entityType, name, "field name must not contain '" + c + "'");
			}
		}
	}

	private static void validatePattern(String entityType, FieldSpec spec) {
		String pattern = spec.constraints().pattern();
		if (pattern != null) {
			try {
				Pattern.compile(pattern);
			} catch (PatternSyntaxException e) {
				throw new DefinitionException(entityType, spec.name(), "invalid pattern", e);
			}
		}
	}

	public @Nullable FieldSpec get(String name) {
		return fields.get(name);
	}

	public boolean contains(String name) {
		return fields.containsKey(name);
	}

	public int size() {
		return fields.size();
	}

	public List<String> names() {
		return unmodifiableList(new ArrayList<>(fields.keySet()));
	}

	@Override
	public Iterator<FieldSpec> iterator() {
		return fields.values().iterator();
	}

	/**
	 * @return <code>{ name: { type?, required, default?, constraints... } }</code> in declaration order
	 */
	public Map<String, Object> describe() {
		Map<String, Object> result = new LinkedHashMap<>();
		fields.forEach((name, spec) -> result.put(name, spec.describe()));
		return unmodifiableMap(result);
	}

	@Override
	public String toString() {
		return "FieldTable" + fields.keySet();
	}
}
