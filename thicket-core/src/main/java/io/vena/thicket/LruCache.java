package io.vena.thicket;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A bounded map that evicts the least recently used entry when full.
 *
 * <p>
 * Both {@link #get} and {@link #put} count as a use.
 * Null values are not stored, so a null from {@link #get} always means a miss.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class LruCache<K, V> {
	private final String name;
	private final int maxSize;
	private final @Nullable Lock lock;
	private final LinkedHashMap<K, V> entries;
	private long hits = 0;
	private long misses = 0;

	/**
	 * @param threadSafe if false, the caller is responsible for serializing access
	 */
	public LruCache(String name, int maxSize, boolean threadSafe) {
		if (maxSize < 1) {
			throw new IllegalArgumentException("Cache \"" + name + "\" size must be positive: " + maxSize);
		}
		this.name = name;
		this.maxSize = maxSize;
		this.lock = threadSafe ? new ReentrantLock() : null;
		this.entries = new LinkedHashMap<>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
				if (size() > LruCache.this.maxSize) {
					LOGGER.debug("Cache \"{}\" evicting {}", LruCache.this.name, eldest.getKey());
					return true;
				} else {
					return false;
				}
			}
		};
	}

	public @Nullable V get(K key) {
		return locked(() -> {
			V value = entries.get(key);
			if (value == null) {
				misses++;
			} else {
				hits++;
			}
			return value;
		});
	}

	/**
	 * Like {@link #get} but neither updates recency nor counts toward the stats.
	 */
	public boolean containsKey(K key) {
		return locked(() -> entries.containsKey(key));
	}

	public void put(K key, @Nullable V value) {
		if (value == null) {
			invalidate(key);
			return;
		}
		locked(() -> entries.put(key, value));
	}

	public void invalidate(K key) {
		locked(() -> entries.remove(key));
	}

	/**
	 * @return the number of entries removed
	 */
	public int invalidateIf(Predicate<? super K> keyPredicate) {
		return locked(() -> {
			int before = entries.size();
			entries.keySet().removeIf(keyPredicate);
			return before - entries.size();
		});
	}

	public void clear() {
		locked(() -> {
			entries.clear();
			hits = 0;
			misses = 0;
			return null;
		});
	}

	public int size() {
		return locked(entries::size);
	}

	public int maxSize() {
		return maxSize;
	}

	public CacheStats stats() {
		return locked(() -> new CacheStats(entries.size(), maxSize, hits, misses));
	}

	private <T> T locked(Supplier<T> action) {
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

	@Override
	public String toString() {
		return "LruCache(" + name + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LruCache.class);
}
