package io.vena.thicket;

import io.vena.thicket.AccessorStrategy.Delegated;
import io.vena.thicket.AccessorStrategy.Direct;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link FieldTable} into an {@link AccessorSet} for a concrete {@link StoragePolicy}.
 *
 * <p>
 * {@link StoragePolicy#AUTO} is not concrete: it must first be resolved by a {@link StrategyResolver}.
 */
public final class AccessorSynthesizer {
	/**
	 * Under {@link StoragePolicy#MIXED}, fields with these names (compared case-insensitively) are direct.
	 */
	public static final Set<String> HOT_FIELD_NAMES = Set.of("id", "name", "username", "email", "status", "active");

	private final @Nullable SchemaEvaluator evaluator;

	/**
	 * @param evaluator used by every synthesized accessor on write; null disables validation
	 */
	public AccessorSynthesizer(@Nullable SchemaEvaluator evaluator) {
		this.evaluator = evaluator;
	}

	public AccessorSet synthesize(FieldTable fieldTable, StoragePolicy policy) {
		if (policy == StoragePolicy.AUTO) {
			throw new IllegalArgumentException("AUTO must be resolved before synthesis");
		}
		Map<String, Accessor> accessors = new LinkedHashMap<>();
		int slotCount = 0;
		for (FieldSpec field: fieldTable) {
			AccessorStrategy strategy;
			if (isDirect(policy, field.name())) {
				strategy = new Direct(slotCount++);
			} else {
				strategy = new Delegated(field.name());
			}
			accessors.put(field.name(), new Accessor(field, strategy, evaluator));
		}
		LOGGER.debug("Synthesized {} accessors under {} ({} direct)", accessors.size(), policy, slotCount);
		return new AccessorSet(policy, accessors, slotCount);
	}

	private static boolean isDirect(StoragePolicy policy, String fieldName) {
		switch (policy) {
			case DIRECT: return true;
			case MIXED: return HOT_FIELD_NAMES.contains(fieldName.toLowerCase(Locale.ROOT));
			default: return false;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AccessorSynthesizer.class);
}
