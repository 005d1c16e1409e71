package io.vena.thicket;

import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only view of entity data, addressed by dotted paths.
 *
 * <p>
 * This is what {@link Entity#data()} hands out: it has no write methods,
 * so there is nothing to guard at runtime.
 */
public interface ReadableFieldStore {
	@Nullable Object get(String path, @Nullable Object defaultValue);

	default @Nullable Object get(String path) {
		return get(path, null);
	}

	boolean contains(String path);

	/**
	 * @return a deep copy of the stored data, in insertion order
	 */
	Map<String, Object> toPlainMapping();
}
