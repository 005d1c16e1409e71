package io.vena.thicket;

import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Generic nested key/value storage used by delegated fields and undeclared paths.
 *
 * <p>
 * Implementations need not be thread-safe; each {@link Entity} owns its store
 * and serializes access to it.
 */
public interface FieldStore extends ReadableFieldStore {
	void set(String path, @Nullable Object value);

	/**
	 * Deleting a path that isn't there has no effect.
	 */
	void delete(String path);

	/**
	 * Replaces the entire contents of this store with a deep copy of <code>data</code>.
	 */
	void loadFromPlainMapping(Map<String, ?> data);
}
