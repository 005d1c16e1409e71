package io.vena.thicket;

import lombok.Value;

@Value
public class CacheStats {
	int size;
	int maxSize;
	long hits;
	long misses;

	/**
	 * @return hits over lookups, or zero before the first lookup
	 */
	public double hitRate() {
		long lookups = hits + misses;
		return lookups == 0 ? 0.0 : (double) hits / lookups;
	}
}
