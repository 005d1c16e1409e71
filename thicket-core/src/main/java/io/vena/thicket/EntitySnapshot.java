package io.vena.thicket;

import io.vena.thicket.exceptions.SnapshotException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

import static io.vena.thicket.util.PlainValues.deepCopyMap;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * The state of one entity as a plain mapping:
 *
 * <pre>
 * {
 *   metadata: { id, type, state, version, createdAt, updatedAt, tags, metadata },
 *   data: { ... },
 *   schema: { ... },   // optional
 *   actions: { ... }   // optional
 * }
 * </pre>
 *
 * Timestamps are ISO-8601 strings and the state is the {@link LifecycleState} name.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class EntitySnapshot {
	private final String id;
	private final String type;
	private final LifecycleState state;
	private final long version;
	private final Instant createdAt;
	private final Instant updatedAt;
	private final List<String> tags;
	@Getter(AccessLevel.NONE) private final Map<String, Object> metadata;
	@Getter(AccessLevel.NONE) private final Map<String, Object> data;
	@Getter(AccessLevel.NONE) private final @Nullable Map<String, Object> schema;
	@Getter(AccessLevel.NONE) private final @Nullable Map<String, Object> actions;

	static EntitySnapshot of(Map<String, Object> metadata, Map<String, Object> data, @Nullable Map<String, Object> schema, @Nullable Map<String, Object> actions) {
		Map<String, Object> mapping = new LinkedHashMap<>();
		mapping.put("metadata", metadata);
		mapping.put("data", data);
		if (schema != null) {
			mapping.put("schema", schema);
		}
		if (actions != null) {
			mapping.put("actions", actions);
		}
		return fromPlainMapping(mapping);
	}

	/**
	 * @throws SnapshotException if anything required is missing or malformed
	 */
	public static EntitySnapshot fromPlainMapping(Map<String, ?> mapping) {
		Map<String, Object> metadata = requireMap(mapping, "metadata", "snapshot");
		Map<String, Object> data = requireMap(mapping, "data", "snapshot");
		return new EntitySnapshot(
			requireString(metadata, "id"),
			requireString(metadata, "type"),
			parseState(metadata.get("state")),
			requireLong(metadata, "version"),
			requireInstant(metadata, "createdAt"),
			requireInstant(metadata, "updatedAt"),
			stringList(metadata.get("tags")),
			metadata.get("metadata") == null ? Map.of() : unmodifiableMap(requireMap(metadata, "metadata", "metadata")),
			unmodifiableMap(data),
			optionalMap(mapping, "schema"),
			optionalMap(mapping, "actions"));
	}

	public Map<String, Object> metadata() {
		return deepCopyMap(metadata);
	}

	public Map<String, Object> data() {
		return deepCopyMap(data);
	}

	public @Nullable Map<String, Object> schema() {
		return schema == null ? null : deepCopyMap(schema);
	}

	public @Nullable Map<String, Object> actions() {
		return actions == null ? null : deepCopyMap(actions);
	}

	public Map<String, Object> toPlainMapping() {
		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put("id", id);
		meta.put("type", type);
		meta.put("state", state.name());
		meta.put("version", version);
		meta.put("createdAt", createdAt.toString());
		meta.put("updatedAt", updatedAt.toString());
		meta.put("tags", new ArrayList<>(tags));
		meta.put("metadata", deepCopyMap(metadata));
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("metadata", meta);
		result.put("data", deepCopyMap(data));
		if (schema != null) {
			result.put("schema", deepCopyMap(schema));
		}
		if (actions != null) {
			result.put("actions", deepCopyMap(actions));
		}
		return result;
	}

	static Map<String, Object> requireMap(Map<String, ?> container, String key, String what) {
		Object value = container.get(key);
		if (value instanceof Map) {
			return deepCopyMap((Map<?, ?>) value);
		} else {
			throw new SnapshotException("Malformed " + what + ": \"" + key + "\" must be a mapping but was " + value);
		}
	}

	static @Nullable Map<String, Object> optionalMap(Map<String, ?> container, String key) {
		if (container.get(key) == null) {
			return null;
		} else {
			return unmodifiableMap(requireMap(container, key, "snapshot"));
		}
	}

	static String requireString(Map<String, ?> container, String key) {
		Object value = container.get(key);
		if (value instanceof String && !((String) value).isEmpty()) {
			return (String) value;
		} else {
			throw new SnapshotException("Malformed metadata: \"" + key + "\" must be a non-empty string but was " + value);
		}
	}

	static long requireLong(Map<String, ?> container, String key) {
		Object value = container.get(key);
		if (value instanceof Number) {
			return ((Number) value).longValue();
		} else {
			throw new SnapshotException("Malformed metadata: \"" + key + "\" must be a number but was " + value);
		}
	}

	static Instant requireInstant(Map<String, ?> container, String key) {
		Object value = container.get(key);
		if (!(value instanceof String)) {
			throw new SnapshotException("Malformed metadata: \"" + key + "\" must be an ISO-8601 timestamp but was " + value);
		}
		try {
			return Instant.parse((String) value);
		} catch (DateTimeParseException e) {
			throw new SnapshotException("Malformed metadata: \"" + key + "\" is not an ISO-8601 timestamp: " + value, e);
		}
	}

	private static LifecycleState parseState(@Nullable Object value) {
		if (value == null) {
			throw new SnapshotException("Malformed metadata: \"state\" is missing");
		}
		try {
			return LifecycleState.valueOf(value.toString());
		} catch (IllegalArgumentException e) {
			throw new SnapshotException("Malformed metadata: unknown state \"" + value + "\"", e);
		}
	}

	private static List<String> stringList(@Nullable Object value) {
		if (value == null) {
			return List.of();
		} else if (value instanceof List) {
			List<String> result = new ArrayList<>();
			for (Object element: (List<?>) value) {
				result.add(String.valueOf(element));
			}
			return unmodifiableList(result);
		} else {
			throw new SnapshotException("Malformed metadata: \"tags\" must be a list but was " + value);
		}
	}

	@Override
	public String toString() {
		return "EntitySnapshot(" + type + "#" + id + " v" + version + ")";
	}
}
