package io.vena.thicket;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for one {@link EntityRuntime}.
 * There is no global instance; every runtime gets its own.
 */
@Value
@Builder(toBuilder = true)
public class RuntimeSettings {
	@Default StoragePolicy storagePolicy = StoragePolicy.DIRECT;

	/**
	 * Under {@link StoragePolicy#AUTO}, types with more fields than this are delegated.
	 */
	@Default int autoFieldThreshold = 10;

	/**
	 * Under {@link StoragePolicy#AUTO}, once this many AUTO instances exist in the runtime,
	 * types instantiated for the first time are delegated.
	 * Only consulted if {@link #crossTypeInstanceBudget} is set.
	 */
	@Default int autoInstanceThreshold = 1000;
	@Default boolean crossTypeInstanceBudget = false;

	/**
	 * If false, field writes and construction skip the schema evaluator entirely.
	 * Explicit validation and the transition to VALIDATED still evaluate.
	 */
	@Default boolean validation = true;
	@Default boolean actionDiscovery = true;
	@Default boolean schemaCaching = true;
	@Default boolean queryResultCaching = true;

	@Default int entityCacheSize = 1024;
	@Default int schemaCacheSize = 100;
	@Default int queryCacheSize = 1000;

	@Default boolean threadSafe = true;
	@Default Caller defaultCaller = Caller.anonymous();

	/**
	 * Where {@link ActionProfile#TASK} actions run.
	 * If null, they run inline.
	 */
	@Default @Nullable Executor taskExecutor = null;

	public static final String STORAGE_POLICY_VARIABLE = "THICKET_STORAGE_POLICY";
	public static final String VALIDATION_VARIABLE = "THICKET_VALIDATION";
	public static final String THREAD_SAFE_VARIABLE = "THICKET_THREAD_SAFE";

	private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes");
	private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no");

	public static RuntimeSettings defaults() {
		return RuntimeSettings.builder().build();
	}

	/**
	 * Applies any recognized variables from <code>environment</code> on top of these settings.
	 * Unrecognized values are logged and ignored.
	 */
	public RuntimeSettings withEnvironment(Map<String, String> environment) {
		RuntimeSettingsBuilder builder = this.toBuilder();
		String policy = environment.get(STORAGE_POLICY_VARIABLE);
		if (policy != null && !policy.isBlank()) {
			try {
				builder.storagePolicy(StoragePolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
			} catch (IllegalArgumentException e) {
				LOGGER.warn("Ignoring unrecognized {}=\"{}\"", STORAGE_POLICY_VARIABLE, policy);
			}
		}
		Boolean validation = flag(environment, VALIDATION_VARIABLE);
		if (validation != null) {
			builder.validation(validation);
		}
		Boolean threadSafe = flag(environment, THREAD_SAFE_VARIABLE);
		if (threadSafe != null) {
			builder.threadSafe(threadSafe);
		}
		return builder.build();
	}

	public static RuntimeSettings fromEnvironment(Map<String, String> environment) {
		return defaults().withEnvironment(environment);
	}

	private static @Nullable Boolean flag(Map<String, String> environment, String variable) {
		String value = environment.get(variable);
		if (value == null || value.isBlank()) {
			return null;
		}
		String word = value.trim().toLowerCase(Locale.ROOT);
		if (TRUE_WORDS.contains(word)) {
			return true;
		} else if (FALSE_WORDS.contains(word)) {
			return false;
		} else {
			LOGGER.warn("Ignoring unrecognized {}=\"{}\"", variable, value);
			return null;
		}
	}

	public void validate() {
		requirePositive("autoFieldThreshold", autoFieldThreshold);
		requirePositive("autoInstanceThreshold", autoInstanceThreshold);
		requirePositive("entityCacheSize", entityCacheSize);
		requirePositive("schemaCacheSize", schemaCacheSize);
		requirePositive("queryCacheSize", queryCacheSize);
		if (defaultCaller == null) {
			throw new IllegalArgumentException("defaultCaller must not be null");
		}
	}

	private static void requirePositive(String name, int value) {
		if (value < 1) {
			throw new IllegalArgumentException(name + " must be positive: " + value);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RuntimeSettings.class);
}
