package io.vena.thicket;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static io.vena.thicket.util.PlainValues.deepCopy;
import static io.vena.thicket.util.PlainValues.deepCopyMap;

/**
 * A {@link FieldStore} backed by nested {@link LinkedHashMap}s.
 *
 * <p>
 * {@link #set} creates intermediate maps as needed.
 * A path that runs into a non-map value on the way
 * throws {@link IllegalArgumentException}.
 */
public final class NestedFieldStore implements FieldStore {
	private final Map<String, Object> root = new LinkedHashMap<>();

	@Override
	public @Nullable Object get(String path, @Nullable Object defaultValue) {
		FieldPath fieldPath = FieldPath.parse(path);
		Map<String, Object> parent = parentOf(fieldPath, false);
		if (parent == null) {
			return defaultValue;
		}
		String last = fieldPath.segment(fieldPath.length() - 1);
		if (parent.containsKey(last)) {
			return parent.get(last);
		} else {
			return defaultValue;
		}
	}

	@Override
	public boolean contains(String path) {
		FieldPath fieldPath = FieldPath.parse(path);
		Map<String, Object> parent = parentOf(fieldPath, false);
		return parent != null && parent.containsKey(fieldPath.segment(fieldPath.length() - 1));
	}

	@Override
	public void set(String path, @Nullable Object value) {
		FieldPath fieldPath = FieldPath.parse(path);
		Map<String, Object> parent = parentOf(fieldPath, true);
		assert parent != null;
		parent.put(fieldPath.segment(fieldPath.length() - 1), deepCopy(value));
	}

	@Override
	public void delete(String path) {
		FieldPath fieldPath = FieldPath.parse(path);
		Map<String, Object> parent = parentOf(fieldPath, false);
		if (parent != null) {
			parent.remove(fieldPath.segment(fieldPath.length() - 1));
		}
	}

	@Override
	public Map<String, Object> toPlainMapping() {
		return deepCopyMap(root);
	}

	@Override
	public void loadFromPlainMapping(Map<String, ?> data) {
		root.clear();
		data.forEach((k, v) -> root.put(k, deepCopy(v)));
	}

	/**
	 * @return the map holding the last segment of <code>path</code>,
	 * or null if it doesn't exist and <code>create</code> is false.
	 */
	@SuppressWarnings("unchecked")
	private @Nullable Map<String, Object> parentOf(FieldPath path, boolean create) {
		Map<String, Object> current = root;
		for (int i = 0; i < path.length() - 1; i++) {
			String segment = path.segment(i);
			Object next = current.get(segment);
			if (next == null) {
				if (!create) {
					return null;
				}
				Map<String, Object> created = new LinkedHashMap<>();
				current.put(segment, created);
				current = created;
			} else if (next instanceof Map) {
				current = (Map<String, Object>) next;
			} else {
				throw new IllegalArgumentException("Segment \"" + segment + "\" of \"" + path + "\" is not a map");
			}
		}
		return current;
	}

	@Override
	public String toString() {
		return "NestedFieldStore" + root;
	}
}
