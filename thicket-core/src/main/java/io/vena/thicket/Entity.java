package io.vena.thicket;

import io.vena.thicket.exceptions.StateException;
import io.vena.thicket.exceptions.ValidationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;

import static io.vena.thicket.util.PlainValues.deepCopy;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * One live instance of an {@link EntityType}.
 *
 * <p>
 * Data is addressed by dotted paths. If the first segment names a declared field,
 * the access goes through that field's {@link Accessor}, so writes are validated;
 * any further segments navigate inside the field's map value,
 * and a write there re-validates the whole field value.
 * Paths that don't start with a declared field go straight to the {@link FieldStore}
 * without validation.
 *
 * <p>
 * Every accepted mutation increments {@link #version()} and discards cached
 * query results for this entity; none of them change {@link #state()}.
 * {@link #update} applies its entries one at a time and is not atomic:
 * if one is rejected, the earlier ones remain.
 *
 * <p>
 * Two entities are equal iff their ids are equal.
 *
 * <p>
 * Created by {@link EntityRuntime}; there is no public constructor.
 */
public final class Entity {
	private final EntityRuntime runtime;
	private final EntityType type;
	private final EntityIdentity identity;
	private final LifecycleStateMachine stateMachine;
	private final AccessorSet accessors;
	private final EntityStorage storage;
	private final @Nullable Lock lock;
	private final List<CommandRecord> commandHistory = new ArrayList<>();
	private final Map<String, Object> extensions = new LinkedHashMap<>();
	private final AtomicLong reads = new AtomicLong();
	private final AtomicLong writes = new AtomicLong();
	private final AtomicLong validations = new AtomicLong();
	private final int hash;

	Entity(EntityRuntime runtime, EntityType type, EntityIdentity identity, EntityMetadata metadata, AccessorSet accessors, FieldStore store) {
		this.runtime = runtime;
		this.type = type;
		this.identity = identity;
		this.stateMachine = new LifecycleStateMachine(identity, runtime.clock(), metadata);
		this.accessors = accessors;
		this.storage = new EntityStorage(accessors.slotCount(), store);
		this.lock = runtime.settings().threadSafe() ? new ReentrantLock() : null;
		this.hash = identity.id().hashCode();
	}

	// Identity and metadata

	public String id() { return identity.id(); }
	public String entityType() { return identity.entityType(); }
	public EntityIdentity identity() { return identity; }
	public EntityType type() { return type; }
	public EntityRuntime runtime() { return runtime; }

	public LifecycleState state() { return stateMachine.state(); }
	public long version() { return stateMachine.version(); }
	public Instant createdAt() { return stateMachine.metadata().createdAt(); }
	public Instant updatedAt() { return stateMachine.metadata().updatedAt(); }
	public List<String> tags() { return stateMachine.metadata().tags(); }
	public Map<String, Object> metadata() { return stateMachine.metadata().metadata(); }

	public List<CommandRecord> commandHistory() {
		return locked(() -> unmodifiableList(new ArrayList<>(commandHistory)));
	}

	public EntityStats stats() {
		return new EntityStats(reads.get(), writes.get(), validations.get());
	}

	/**
	 * @return where the named declared field is stored, or null if there's no such field
	 */
	public @Nullable AccessorStrategy storageFor(String fieldName) {
		return accessors.strategyFor(fieldName);
	}

	public Entity addTag(String tag) {
		locked(() -> {
			if (stateMachine.metadata().addTag(tag)) {
				mutated();
			}
		});
		return this;
	}

	public Entity removeTag(String tag) {
		locked(() -> {
			if (stateMachine.metadata().removeTag(tag)) {
				mutated();
			}
		});
		return this;
	}

	public Entity putMetadata(String key, @Nullable Object value) {
		locked(() -> {
			stateMachine.metadata().putMetadata(key, value);
			mutated();
		});
		return this;
	}

	public Entity removeMetadata(String key) {
		locked(() -> {
			stateMachine.metadata().removeMetadata(key);
			mutated();
		});
		return this;
	}

	// Extensions

	/**
	 * Attaches a helper object to this entity under <code>name</code>,
	 * replacing any extension already registered under that name.
	 * Extensions are not entity data: they don't affect the version,
	 * and they're left out of copies and snapshots.
	 */
	public Entity registerExtension(String name, Object extension) {
		requireNonNull(extension, "extension");
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Extension name must not be blank");
		}
		locked(() -> {
			extensions.put(name, extension);
		});
		return this;
	}

	public @Nullable Object getExtension(String name) {
		return locked(() -> extensions.get(name));
	}

	public boolean hasExtension(String name) {
		return locked(() -> extensions.containsKey(name));
	}

	/**
	 * @return registered extension names in registration order
	 */
	public List<String> listExtensions() {
		return locked(() -> unmodifiableList(new ArrayList<>(extensions.keySet())));
	}

	/**
	 * @return true if an extension was registered under <code>name</code>
	 */
	public boolean removeExtension(String name) {
		return locked(() -> extensions.remove(name) != null);
	}

	public boolean hasExtensionType(Class<?> extensionType) {
		return locked(() -> extensions.values().stream().anyMatch(extensionType::isInstance));
	}

	// Data

	public @Nullable Object get(String path) {
		return get(path, null);
	}

	/**
	 * @return a copy of the value at <code>path</code>, or <code>defaultValue</code> if there is none
	 */
	public @Nullable Object get(String path, @Nullable Object defaultValue) {
		reads.incrementAndGet();
		FieldPath fieldPath = parse(path);
		Accessor accessor = accessors.get(fieldPath.head());
		if (accessor == null) {
			return deepCopy(wrapPathErrors(path, () -> storage.store.get(path, defaultValue)));
		}
		Object value = accessor.get(storage);
		if (fieldPath.isSingleSegment()) {
			return value == null ? defaultValue : deepCopy(value);
		}
		for (String segment: fieldPath.tail()) {
			if (value instanceof Map) {
				Map<?, ?> map = (Map<?, ?>) value;
				if (!map.containsKey(segment)) {
					return defaultValue;
				}
				value = map.get(segment);
			} else if (value == null) {
				return defaultValue;
			} else {
				throw pathError(path, "segment \"" + segment + "\" is inside a non-map value");
			}
		}
		return deepCopy(value);
	}

	public boolean contains(String path) {
		FieldPath fieldPath = parse(path);
		Accessor accessor = accessors.get(fieldPath.head());
		if (accessor == null) {
			return wrapPathErrors(path, () -> storage.store.contains(path));
		} else if (fieldPath.isSingleSegment()) {
			return accessor.isSet(storage) || accessor.field().defaultValue() != null;
		} else {
			Object marker = new Object();
			return get(path, marker) != marker;
		}
	}

	/**
	 * @throws ValidationException if the value is rejected; nothing changes in that case
	 */
	public Entity set(String path, @Nullable Object value) {
		FieldPath fieldPath = parse(path);
		locked(() -> {
			Accessor accessor = accessors.get(fieldPath.head());
			if (accessor == null) {
				wrapPathErrors(path, () -> {
					storage.store.set(path, value);
					return null;
				});
			} else if (fieldPath.isSingleSegment()) {
				accessor.set(storage, value);
			} else {
				accessor.set(storage, withNested(accessor, fieldPath, value, false));
			}
			writes.incrementAndGet();
			mutated();
		});
		return this;
	}

	/**
	 * Deleting a declared field reverts it to its default.
	 */
	public Entity delete(String path) {
		FieldPath fieldPath = parse(path);
		locked(() -> {
			Accessor accessor = accessors.get(fieldPath.head());
			if (accessor == null) {
				wrapPathErrors(path, () -> {
					storage.store.delete(path);
					return null;
				});
			} else if (fieldPath.isSingleSegment()) {
				accessor.clear(storage);
			} else {
				accessor.set(storage, withNested(accessor, fieldPath, null, true));
			}
			writes.incrementAndGet();
			mutated();
		});
		return this;
	}

	/**
	 * Applies {@link #set} for each entry in iteration order. Not atomic.
	 */
	public Entity update(Map<String, ?> values) {
		values.forEach(this::set);
		return this;
	}

	/**
	 * A read-only view of this entity's data.
	 */
	public ReadableFieldStore data() {
		return new ReadableFieldStore() {
			@Override
			public @Nullable Object get(String path, @Nullable Object defaultValue) {
				return Entity.this.get(path, defaultValue);
			}

			@Override
			public boolean contains(String path) {
				return Entity.this.contains(path);
			}

			@Override
			public Map<String, Object> toPlainMapping() {
				return toPlainData();
			}
		};
	}

	/**
	 * @return a deep copy of all data: declared fields first, in declaration order, then undeclared paths
	 */
	public Map<String, Object> toPlainData() {
		return locked(() -> {
			Map<String, Object> result = new LinkedHashMap<>();
			for (Accessor accessor: accessors.all()) {
				result.put(accessor.name(), deepCopy(accessor.get(storage)));
			}
			storage.store.toPlainMapping().forEach((k, v) -> {
				if (!result.containsKey(k)) {
					result.put(k, v);
				}
			});
			return result;
		});
	}

	// Validation

	public boolean validate() {
		try {
			validateOrRaise();
			return true;
		} catch (ValidationException e) {
			return false;
		}
	}

	/**
	 * @throws ValidationException for the first failing field in declaration order
	 */
	public void validateOrRaise() {
		validations.incrementAndGet();
		SchemaEvaluator evaluator = runtime.evaluator();
		for (Accessor accessor: accessors.all()) {
			Accessor.check(evaluator, accessor.field(), accessor.get(storage));
		}
	}

	// Lifecycle

	public boolean canTransitionTo(LifecycleState target) {
		return stateMachine.canTransitionTo(target);
	}

	/**
	 * @throws StateException if the transition isn't allowed, or the target is
	 * {@link LifecycleState#VALIDATED} and validation fails
	 */
	public Entity transitionTo(LifecycleState target) {
		locked(() -> {
			stateMachine.transitionTo(target, this::validate);
			runtime.invalidateDerived(identity.id());
		});
		return this;
	}

	public Entity toValidated() {
		return transitionTo(LifecycleState.VALIDATED);
	}

	public Entity commit() {
		return transitionTo(LifecycleState.COMMITTED);
	}

	public Entity archive() {
		return transitionTo(LifecycleState.ARCHIVED);
	}

	/**
	 * Moves an archived entity back to {@link LifecycleState#DRAFT}.
	 *
	 * @throws StateException if this entity isn't archived
	 */
	public Entity restore() {
		locked(() -> {
			LifecycleState current = stateMachine.state();
			if (current != LifecycleState.ARCHIVED) {
				throw new StateException(current, LifecycleState.DRAFT, "can only restore from ARCHIVED");
			}
			stateMachine.transitionTo(LifecycleState.DRAFT, this::validate);
			runtime.invalidateDerived(identity.id());
		});
		return this;
	}

	// Actions

	public @Nullable Object executeAction(String actionName, Map<String, Object> params) {
		return executeAction(runtime.settings().defaultCaller(), actionName, params);
	}

	public @Nullable Object executeAction(Caller caller, String actionName, Map<String, Object> params) {
		return runtime.dispatcher().execute(this, actionName, caller, params);
	}

	public List<String> listActions() {
		return type.actions().names();
	}

	public Map<String, Object> exportActions() {
		return type.actions().describe();
	}

	// Duplication and export

	/**
	 * A deep copy of this entity's data, tags and metadata,
	 * with a new identity, at version 1 in {@link LifecycleState#DRAFT}.
	 */
	public Entity copy() {
		return runtime.copyOf(this);
	}

	public EntitySnapshot toSnapshot() {
		return toSnapshot(false, false);
	}

	public EntitySnapshot toSnapshot(boolean includeSchema, boolean includeActions) {
		return locked(() -> EntitySnapshot.of(
			stateMachine.metadata().toPlainMapping(identity),
			toPlainData(),
			includeSchema ? runtime.schemaOf(type) : null,
			includeActions ? exportActions() : null));
	}

	// Package-private hooks for the runtime and dispatcher

	EntityMetadata metadataRecord() {
		return stateMachine.metadata();
	}

	/**
	 * Writes without validation and without touching the version.
	 * Used while loading data that is already known to be acceptable.
	 */
	void load(Map<String, ?> data) {
		locked(() -> {
			data.forEach((key, value) -> {
				Accessor accessor = accessors.get(key);
				if (accessor == null) {
					wrapPathErrors(key, () -> {
						storage.store.set(key, value);
						return null;
					});
				} else {
					accessor.write(storage, value);
				}
			});
		});
	}

	/**
	 * Writes with validation, but without touching the version.
	 */
	void initialize(Map<String, ?> values) {
		locked(() -> values.forEach((path, value) -> {
			FieldPath fieldPath = parse(path);
			Accessor accessor = accessors.get(fieldPath.head());
			if (accessor == null) {
				wrapPathErrors(path, () -> {
					storage.store.set(path, value);
					return null;
				});
			} else if (fieldPath.isSingleSegment()) {
				accessor.set(storage, value);
			} else {
				accessor.set(storage, withNested(accessor, fieldPath, value, false));
			}
		}));
	}

	CommandRecord recordCommand(String actionName, Caller caller) {
		return locked(() -> {
			stateMachine.recordMutation();
			CommandRecord record = new CommandRecord(actionName, caller.principal(), caller.roles(), stateMachine.version(), runtime.clock().instant());
			commandHistory.add(record);
			runtime.invalidateDerived(identity.id());
			return record;
		});
	}

	<T> T locked(Supplier<T> action) {
		if (lock == null) {
			return action.get();
		}
		lock.lock();
		try {
			return action.get();
		} finally {
			lock.unlock();
		}
	}

	private void locked(Runnable action) {
		locked(() -> {
			action.run();
			return null;
		});
	}

	private void mutated() {
		stateMachine.recordMutation();
		runtime.invalidateDerived(identity.id());
	}

	/**
	 * @return a copy of the accessor's current map value with the nested entry set or removed
	 */
	@SuppressWarnings("unchecked")
	private Map<String, Object> withNested(Accessor accessor, FieldPath path, @Nullable Object value, boolean remove) {
		Object current = deepCopy(accessor.get(storage));
		Map<String, Object> root;
		if (current == null) {
			root = new LinkedHashMap<>();
		} else if (current instanceof Map) {
			root = (Map<String, Object>) current;
		} else {
			throw pathError(path.toString(), "field \"" + accessor.name() + "\" does not hold a map");
		}
		Map<String, Object> parent = root;
		List<String> segments = path.segments();
		for (int i = 1; i < segments.size() - 1; i++) {
			Object next = parent.get(segments.get(i));
			if (next == null) {
				if (remove) {
					return root;
				}
				Map<String, Object> created = new LinkedHashMap<>();
				parent.put(segments.get(i), created);
				parent = created;
			} else if (next instanceof Map) {
				parent = (Map<String, Object>) next;
			} else {
				throw pathError(path.toString(), "segment \"" + segments.get(i) + "\" is not a map");
			}
		}
		String last = segments.get(segments.size() - 1);
		if (remove) {
			parent.remove(last);
		} else {
			parent.put(last, deepCopy(value));
		}
		return root;
	}

	private static FieldPath parse(String path) {
		try {
			return FieldPath.parse(path);
		} catch (IllegalArgumentException e) {
			throw new ValidationException("Invalid path \"" + path + "\": " + e.getMessage(), String.valueOf(path), null, e);
		}
	}

	private static <T> T wrapPathErrors(String path, Supplier<T> action) {
		try {
			return action.get();
		} catch (IllegalArgumentException e) {
			throw new ValidationException("Invalid path \"" + path + "\": " + e.getMessage(), path, null, e);
		}
	}

	private static ValidationException pathError(String path, String detail) {
		return new ValidationException("Invalid path \"" + path + "\": " + detail, path, null, null, null, false);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof Entity) {
			return identity.id().equals(((Entity) obj).identity.id());
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return hash;
	}

	@Override
	public String toString() {
		return identity.toString();
	}
}
