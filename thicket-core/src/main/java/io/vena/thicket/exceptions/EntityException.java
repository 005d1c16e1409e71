package io.vena.thicket.exceptions;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * Base of every error raised by the entity runtime.
 *
 * <p>
 * Each subclass carries enough structured detail to be rendered
 * without re-deriving the context in which it was thrown;
 * {@link #details()} exposes that detail as a plain ordered map.
 */
public abstract class EntityException extends RuntimeException {
	protected EntityException(String message) { super(message); }
	protected EntityException(String message, Throwable cause) { super(message, cause); }

	public abstract Map<String, Object> details();

	protected static Map<String, Object> detailMap(Object... keysAndValues) {
		Map<String, Object> result = new LinkedHashMap<>();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			result.put((String) keysAndValues[i], keysAndValues[i + 1]);
		}
		return unmodifiableMap(result);
	}
}
