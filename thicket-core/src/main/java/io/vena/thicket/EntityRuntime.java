package io.vena.thicket;

import io.vena.thicket.exceptions.SnapshotException;
import io.vena.thicket.exceptions.ValidationException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared services for a family of entities: settings, storage resolution,
 * validation, action dispatch, and the entity, schema and query-result caches.
 *
 * <p>
 * Runtimes are independent of each other. Entities keep a reference to the runtime
 * that created them and use its settings for their whole life.
 */
public final class EntityRuntime {
	@Getter private final RuntimeSettings settings;
	@Getter private final SchemaEvaluator evaluator;
	@Getter private final Clock clock;
	private final Supplier<FieldStore> storeFactory;
	@Getter private final StrategyResolver strategyResolver;
	private final LruCache<String, Entity> entityCache;
	private final LruCache<EntityType, Map<String, Object>> schemaCache;
	private final LruCache<QueryKey, Object> queryCache;
	@Getter private final ActionDispatcher dispatcher;

	public EntityRuntime() {
		this(RuntimeSettings.defaults());
	}

	public EntityRuntime(RuntimeSettings settings) {
		this(settings, new DefaultSchemaEvaluator(), NestedFieldStore::new, Clock.systemUTC());
	}

	public EntityRuntime(RuntimeSettings settings, SchemaEvaluator evaluator, Supplier<FieldStore> storeFactory, Clock clock) {
		settings.validate();
		this.settings = settings;
		this.evaluator = evaluator;
		this.clock = clock;
		this.storeFactory = storeFactory;
		this.strategyResolver = new StrategyResolver(settings, new AccessorSynthesizer(settings.validation() ? evaluator : null));
		this.entityCache = new LruCache<>("entities", settings.entityCacheSize(), settings.threadSafe());
		this.schemaCache = new LruCache<>("schemas", settings.schemaCacheSize(), settings.threadSafe());
		this.queryCache = new LruCache<>("queries", settings.queryCacheSize(), settings.threadSafe());
		this.dispatcher = new ActionDispatcher(evaluator, queryCache, settings.queryResultCaching(), settings.taskExecutor());
		LOGGER.debug("Created runtime with {}", settings);
	}

	/**
	 * A type builder that honours {@link RuntimeSettings#actionDiscovery()}.
	 */
	public EntityType.Builder typeBuilder(String name) {
		return new EntityType.Builder(name, settings.actionDiscovery());
	}

	public Entity create(EntityType type) {
		return create(type, Map.of());
	}

	/**
	 * Creates an entity at version 1 in {@link LifecycleState#DRAFT}.
	 * Supplied values are validated if validation is enabled;
	 * missing required fields are not an error until validation is requested.
	 *
	 * @param values keyed by dotted path
	 * @throws ValidationException if any supplied value is rejected
	 */
	public Entity create(EntityType type, Map<String, ?> values) {
		Entity entity = newEntity(type, EntityIdentity.generate(type.name()), EntityMetadata.initial(clock.instant()));
		entity.initialize(values);
		LOGGER.debug("Created {}", entity);
		return register(entity);
	}

	/**
	 * @return the cached entity with the given id, or null if it isn't cached
	 */
	public @Nullable Entity lookup(String id) {
		return entityCache.get(id);
	}

	/**
	 * The plain description of the type's fields, cached per type unless
	 * {@link RuntimeSettings#schemaCaching()} is off.
	 */
	public Map<String, Object> schemaOf(EntityType type) {
		if (!settings.schemaCaching()) {
			return type.fields().describe();
		}
		Map<String, Object> cached = schemaCache.get(type);
		if (cached == null) {
			cached = type.fields().describe();
			schemaCache.put(type, cached);
		}
		return cached;
	}

	public Entity fromSnapshot(EntityType type, EntitySnapshot snapshot) {
		return fromSnapshot(type, snapshot, null);
	}

	/**
	 * Restores an entity's data, state, version, timestamps, tags and metadata exactly.
	 * Data is not re-validated.
	 *
	 * @param idOverride replaces the snapshot's id if not null
	 * @throws SnapshotException if the snapshot is of a different type
	 */
	public Entity fromSnapshot(EntityType type, EntitySnapshot snapshot, @Nullable String idOverride) {
		if (!type.name().equals(snapshot.type())) {
			throw new SnapshotException("Snapshot of type \"" + snapshot.type() + "\" can't be loaded as \"" + type.name() + "\"");
		}
		EntityMetadata metadata;
		try {
			metadata = new EntityMetadata(snapshot.state(), snapshot.version(), snapshot.createdAt(), snapshot.updatedAt(), snapshot.tags(), snapshot.metadata());
		} catch (IllegalArgumentException e) {
			throw new SnapshotException("Malformed snapshot metadata: " + e.getMessage(), e);
		}
		String id = idOverride == null ? snapshot.id() : idOverride;
		Entity entity = newEntity(type, EntityIdentity.of(id, type.name()), metadata);
		entity.load(snapshot.data());
		LOGGER.debug("Restored {} from snapshot at version {}", entity, entity.version());
		return register(entity);
	}

	/**
	 * Creates one entity per bundle entry, with the entry's key as its id,
	 * at version 1 in {@link LifecycleState#DRAFT}.
	 *
	 * @throws SnapshotException if the bundle is of a different type
	 */
	public List<Entity> importBundle(EntityType type, CollectionBundle bundle) {
		if (!type.name().equals(bundle.type())) {
			throw new SnapshotException("Bundle of type \"" + bundle.type() + "\" can't be imported as \"" + type.name() + "\"");
		}
		List<Entity> result = new ArrayList<>(bundle.entityCount());
		bundle.data().forEach((id, data) -> {
			Entity entity = newEntity(type, EntityIdentity.of(id, type.name()), EntityMetadata.initial(clock.instant()));
			entity.load(data);
			result.add(register(entity));
		});
		LOGGER.debug("Imported {} entities of type \"{}\"", result.size(), type.name());
		return result;
	}

	public CollectionBundle exportBundle(EntityType type, List<Entity> entities) {
		return CollectionBundle.of(type, entities, clock);
	}

	/**
	 * Empties the entity, schema and query-result caches.
	 */
	public void clearCaches() {
		entityCache.clear();
		schemaCache.clear();
		queryCache.clear();
		LOGGER.debug("Cleared caches");
	}

	public Map<String, CacheStats> cacheStats() {
		Map<String, CacheStats> result = new LinkedHashMap<>();
		result.put("entities", entityCache.stats());
		result.put("schemas", schemaCache.stats());
		result.put("queries", queryCache.stats());
		return result;
	}

	Entity copyOf(Entity original) {
		EntityMetadata source = original.metadataRecord();
		EntityMetadata metadata = EntityMetadata.initial(clock.instant());
		source.tags().forEach(metadata::addTag);
		source.metadata().forEach(metadata::putMetadata);
		Entity copy = newEntity(original.type(), EntityIdentity.generate(original.entityType()), metadata);
		copy.load(original.toPlainData());
		LOGGER.debug("Copied {} to {}", original, copy);
		return register(copy);
	}

	/**
	 * Discards cached query results for one entity.
	 */
	void invalidateDerived(String entityId) {
		queryCache.invalidateIf(key -> key.entityId().equals(entityId));
	}

	private Entity newEntity(EntityType type, EntityIdentity identity, EntityMetadata metadata) {
		AccessorSet accessors = strategyResolver.resolveForInstance(type);
		return new Entity(this, type, identity, metadata, accessors, storeFactory.get());
	}

	/**
	 * Caches the entity under its id. Query results left by an earlier entity
	 * with the same id are discarded.
	 */
	private Entity register(Entity entity) {
		invalidateDerived(entity.id());
		entityCache.put(entity.id(), entity);
		return entity;
	}

	@Override
	public String toString() {
		return "EntityRuntime(" + settings.storagePolicy() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EntityRuntime.class);
}
