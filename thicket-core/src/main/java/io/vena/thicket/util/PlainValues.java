package io.vena.thicket.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deep copies of the nested maps and lists that entity data is made of.
 *
 * <p>
 * Only {@link Map}, {@link List} and {@link Set} are copied;
 * every other value is assumed to be immutable and is shared.
 * Copied maps keep their iteration order.
 */
public abstract class PlainValues {
	@SuppressWarnings("unchecked")
	public static <T> T deepCopy(T value) {
		if (value instanceof Map) {
			return (T) deepCopyMap((Map<?, ?>) value);
		} else if (value instanceof List) {
			List<Object> result = new ArrayList<>(((List<?>) value).size());
			for (Object element: (List<?>) value) {
				result.add(deepCopy(element));
			}
			return (T) result;
		} else if (value instanceof Set) {
			Set<Object> result = new LinkedHashSet<>();
			for (Object element: (Collection<?>) value) {
				result.add(deepCopy(element));
			}
			return (T) result;
		} else {
			return value;
		}
	}

	public static Map<String, Object> deepCopyMap(Map<?, ?> map) {
		Map<String, Object> result = new LinkedHashMap<>();
		map.forEach((k, v) -> result.put(String.valueOf(k), deepCopy(v)));
		return result;
	}
}
