package io.vena.thicket;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPMap;

import static java.util.Collections.unmodifiableList;

/**
 * The accessors for every field of one type, in declaration order,
 * along with the concrete policy they were synthesized under.
 */
public final class AccessorSet {
	@Getter private final StoragePolicy policy;
	private final OrderedPMap<String, Accessor> accessors;
	@Getter private final int slotCount;

	AccessorSet(StoragePolicy policy, Map<String, Accessor> accessors, int slotCount) {
		this.policy = policy;
		this.accessors = OrderedPMap.from(accessors);
		this.slotCount = slotCount;
	}

	public @Nullable Accessor get(String fieldName) {
		return accessors.get(fieldName);
	}

	public Collection<Accessor> all() {
		return accessors.values();
	}

	public @Nullable AccessorStrategy strategyFor(String fieldName) {
		Accessor accessor = accessors.get(fieldName);
		return accessor == null ? null : accessor.strategy();
	}

	public List<String> directFieldNames() {
		List<String> result = new ArrayList<>();
		accessors.forEach((name, accessor) -> {
			if (accessor.strategy() instanceof AccessorStrategy.Direct) {
				result.add(name);
			}
		});
		return unmodifiableList(result);
	}

	@Override
	public String toString() {
		return "AccessorSet(" + policy + ", " + accessors.values() + ")";
	}
}
