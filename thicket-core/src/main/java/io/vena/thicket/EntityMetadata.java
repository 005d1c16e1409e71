package io.vena.thicket;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static io.vena.thicket.util.PlainValues.deepCopy;
import static io.vena.thicket.util.PlainValues.deepCopyMap;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * Lifecycle bookkeeping for one entity.
 *
 * <p>
 * Only {@link LifecycleStateMachine} changes this; everything else sees it through
 * the read accessors, which return copies.
 */
public final class EntityMetadata {
	private LifecycleState state;
	private long version;
	private final Instant createdAt;
	private Instant updatedAt;
	private final List<String> tags;
	private final Map<String, Object> metadata;

	EntityMetadata(LifecycleState state, long version, Instant createdAt, Instant updatedAt, List<String> tags, Map<String, ?> metadata) {
		if (version < 1) {
			throw new IllegalArgumentException("Version must be positive: " + version);
		}
		if (updatedAt.isBefore(createdAt)) {
			throw new IllegalArgumentException("updatedAt " + updatedAt + " is before createdAt " + createdAt);
		}
		this.state = state;
		this.version = version;
		this.createdAt = createdAt;
		this.updatedAt = updatedAt;
		this.tags = new ArrayList<>(tags);
		this.metadata = deepCopyMap(metadata);
	}

	static EntityMetadata initial(Instant now) {
		return new EntityMetadata(LifecycleState.DRAFT, 1, now, now, List.of(), Map.of());
	}

	public LifecycleState state() { return state; }
	public long version() { return version; }
	public Instant createdAt() { return createdAt; }
	public Instant updatedAt() { return updatedAt; }

	public List<String> tags() {
		return unmodifiableList(new ArrayList<>(tags));
	}

	public Map<String, Object> metadata() {
		return unmodifiableMap(deepCopyMap(metadata));
	}

	public @Nullable Object metadata(String key) {
		return deepCopy(metadata.get(key));
	}

	void state(LifecycleState state) {
		this.state = state;
	}

	/**
	 * Bumps the version and refreshes {@link #updatedAt()} without letting it go backward.
	 */
	void touch(Instant now) {
		version++;
		if (now.isAfter(updatedAt)) {
			updatedAt = now;
		}
	}

	boolean addTag(String tag) {
		if (tags.contains(tag)) {
			return false;
		}
		return tags.add(tag);
	}

	boolean removeTag(String tag) {
		return tags.remove(tag);
	}

	void putMetadata(String key, @Nullable Object value) {
		metadata.put(key, deepCopy(value));
	}

	void removeMetadata(String key) {
		metadata.remove(key);
	}

	/**
	 * Plain ordered form, with timestamps as ISO-8601 strings.
	 */
	Map<String, Object> toPlainMapping(EntityIdentity identity) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("id", identity.id());
		result.put("type", identity.entityType());
		result.put("state", state.name());
		result.put("version", version);
		result.put("createdAt", createdAt.toString());
		result.put("updatedAt", updatedAt.toString());
		result.put("tags", new ArrayList<>(tags));
		result.put("metadata", deepCopyMap(metadata));
		return result;
	}

	@Override
	public String toString() {
		return "EntityMetadata(" + state + " v" + version + ")";
	}
}
