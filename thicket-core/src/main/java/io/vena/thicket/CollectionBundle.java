package io.vena.thicket;

import io.vena.thicket.exceptions.SnapshotException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import static io.vena.thicket.EntitySnapshot.requireInstant;
import static io.vena.thicket.EntitySnapshot.requireLong;
import static io.vena.thicket.EntitySnapshot.requireMap;
import static io.vena.thicket.EntitySnapshot.requireString;
import static io.vena.thicket.util.PlainValues.deepCopyMap;
import static java.util.Collections.unmodifiableMap;

/**
 * The data of many entities of one type, with the type's schema and actions:
 *
 * <pre>
 * {
 *   metadata: { type, entityCount, exportedAt },
 *   schema: { ... },
 *   actions: { ... },
 *   data: { id: { ... }, ... }
 * }
 * </pre>
 *
 * Only data travels; lifecycle state and versions do not.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class CollectionBundle {
	private final String type;
	private final Instant exportedAt;
	@Getter(AccessLevel.NONE) private final Map<String, Object> schema;
	@Getter(AccessLevel.NONE) private final Map<String, Object> actions;
	@Getter(AccessLevel.NONE) private final Map<String, Map<String, Object>> data;

	public static CollectionBundle of(EntityType type, Collection<Entity> entities) {
		return of(type, entities, Clock.systemUTC());
	}

	/**
	 * @throws IllegalArgumentException if any entity is of a different type
	 */
	public static CollectionBundle of(EntityType type, Collection<Entity> entities, Clock clock) {
		Map<String, Map<String, Object>> data = new LinkedHashMap<>();
		for (Entity entity: entities) {
			if (entity.type() != type) {
				throw new IllegalArgumentException("Entity " + entity + " is not of type " + type.name());
			}
			data.put(entity.id(), entity.toPlainData());
		}
		return new CollectionBundle(type.name(), clock.instant(), type.fields().describe(), type.actions().describe(), unmodifiableMap(data));
	}

	/**
	 * @throws SnapshotException if anything required is missing or malformed
	 */
	public static CollectionBundle fromPlainMapping(Map<String, ?> mapping) {
		Map<String, Object> metadata = requireMap(mapping, "metadata", "bundle");
		Map<String, Object> rawData = requireMap(mapping, "data", "bundle");
		Map<String, Map<String, Object>> data = new LinkedHashMap<>();
		rawData.forEach((id, payload) -> {
			if (payload instanceof Map) {
				data.put(id, deepCopyMap((Map<?, ?>) payload));
			} else {
				throw new SnapshotException("Malformed bundle: data for \"" + id + "\" must be a mapping but was " + payload);
			}
		});
		long declaredCount = requireLong(metadata, "entityCount");
		if (declaredCount != data.size()) {
			throw new SnapshotException("Malformed bundle: entityCount is " + declaredCount + " but data has " + data.size() + " entries");
		}
		return new CollectionBundle(
			requireString(metadata, "type"),
			requireInstant(metadata, "exportedAt"),
			mapping.get("schema") == null ? Map.of() : unmodifiableMap(requireMap(mapping, "schema", "bundle")),
			mapping.get("actions") == null ? Map.of() : unmodifiableMap(requireMap(mapping, "actions", "bundle")),
			unmodifiableMap(data));
	}

	public Map<String, Object> schema() {
		return deepCopyMap(schema);
	}

	public Map<String, Object> actions() {
		return deepCopyMap(actions);
	}

	/**
	 * @return a copy of each entity's data, keyed by id
	 */
	public Map<String, Map<String, Object>> data() {
		Map<String, Map<String, Object>> result = new LinkedHashMap<>();
		data.forEach((id, payload) -> result.put(id, deepCopyMap(payload)));
		return result;
	}

	public int entityCount() {
		return data.size();
	}

	public Map<String, Object> toPlainMapping() {
		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put("type", type);
		meta.put("entityCount", data.size());
		meta.put("exportedAt", exportedAt.toString());
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("metadata", meta);
		result.put("schema", deepCopyMap(schema));
		result.put("actions", deepCopyMap(actions));
		result.put("data", deepCopyMap(data));
		return result;
	}

	@Override
	public String toString() {
		return "CollectionBundle(" + type + ", " + data.size() + " entities)";
	}
}
