package io.vena.thicket;

import java.util.IdentityHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides, once per {@link EntityType}, which concrete {@link StoragePolicy} its instances use,
 * and caches the resulting {@link AccessorSet}.
 *
 * <p>
 * A type's own policy wins over the runtime default.
 * For {@link StoragePolicy#AUTO}, a type with more than
 * {@link RuntimeSettings#autoFieldThreshold()} fields is delegated.
 * If {@link RuntimeSettings#crossTypeInstanceBudget()} is on, a type first instantiated
 * after more than {@link RuntimeSettings#autoInstanceThreshold()} AUTO instances
 * (of any type, in this runtime) is delegated too.
 * Otherwise it is direct.
 *
 * <p>
 * Once resolved, a type's policy never changes.
 */
public final class StrategyResolver {
	private final RuntimeSettings settings;
	private final AccessorSynthesizer synthesizer;
	private final Map<EntityType, AccessorSet> resolved = new IdentityHashMap<>();
	private long autoInstanceCount = 0;

	public StrategyResolver(RuntimeSettings settings, AccessorSynthesizer synthesizer) {
		this.settings = settings;
		this.synthesizer = synthesizer;
	}

	/**
	 * Resolves the type if this is its first instance, and counts the instance.
	 */
	public synchronized AccessorSet resolveForInstance(EntityType type) {
		AccessorSet result = resolved.get(type);
		if (result == null) {
			StoragePolicy concrete = concretePolicy(type);
			result = synthesizer.synthesize(type.fields(), concrete);
			resolved.put(type, result);
			LOGGER.debug("Entity type \"{}\" resolved to {}", type.name(), concrete);
		}
		if (declaredPolicy(type) == StoragePolicy.AUTO) {
			autoInstanceCount++;
		}
		return result;
	}

	/**
	 * @return the policy the type resolved to, or null if it has not been instantiated yet
	 */
	public synchronized @Nullable StoragePolicy resolvedPolicy(EntityType type) {
		AccessorSet accessors = resolved.get(type);
		return accessors == null ? null : accessors.policy();
	}

	public synchronized long autoInstanceCount() {
		return autoInstanceCount;
	}

	private StoragePolicy declaredPolicy(EntityType type) {
		StoragePolicy own = type.storagePolicy();
		return own == null ? settings.storagePolicy() : own;
	}

	private StoragePolicy concretePolicy(EntityType type) {
		StoragePolicy declared = declaredPolicy(type);
		if (declared != StoragePolicy.AUTO) {
			return declared;
		}
		int fieldCount = type.fields().size();
		if (fieldCount > settings.autoFieldThreshold()) {
			LOGGER.info("Entity type \"{}\" has {} fields, over the AUTO threshold of {}; using DELEGATED storage",
				type.name(), fieldCount, settings.autoFieldThreshold());
			return StoragePolicy.DELEGATED;
		}
		if (settings.crossTypeInstanceBudget() && autoInstanceCount > settings.autoInstanceThreshold()) {
			LOGGER.info("{} AUTO instances already created, over the threshold of {}; using DELEGATED storage for entity type \"{}\"",
				autoInstanceCount, settings.autoInstanceThreshold(), type.name());
			return StoragePolicy.DELEGATED;
		}
		return StoragePolicy.DIRECT;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StrategyResolver.class);
}
