package io.vena.thicket;

import java.util.Map;
import org.junit.jupiter.api.Test;

import static io.vena.thicket.RuntimeSettings.STORAGE_POLICY_VARIABLE;
import static io.vena.thicket.RuntimeSettings.THREAD_SAFE_VARIABLE;
import static io.vena.thicket.RuntimeSettings.VALIDATION_VARIABLE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuntimeSettingsTest {
	@Test
	void defaults() {
		RuntimeSettings settings = RuntimeSettings.defaults();
		assertEquals(StoragePolicy.DIRECT, settings.storagePolicy());
		assertEquals(10, settings.autoFieldThreshold());
		assertEquals(1000, settings.autoInstanceThreshold());
		assertFalse(settings.crossTypeInstanceBudget());
		assertTrue(settings.validation());
		assertTrue(settings.actionDiscovery());
		assertTrue(settings.schemaCaching());
		assertTrue(settings.queryResultCaching());
		assertEquals(1024, settings.entityCacheSize());
		assertEquals(100, settings.schemaCacheSize());
		assertEquals(1000, settings.queryCacheSize());
		assertTrue(settings.threadSafe());
		assertEquals(Caller.anonymous(), settings.defaultCaller());
		assertNull(settings.taskExecutor());
		settings.validate();
	}

	@Test
	void fromEnvironment_readsRecognizedVariables() {
		RuntimeSettings settings = RuntimeSettings.fromEnvironment(Map.of(
			STORAGE_POLICY_VARIABLE, "mixed",
			VALIDATION_VARIABLE, "no",
			THREAD_SAFE_VARIABLE, "0"));
		assertEquals(StoragePolicy.MIXED, settings.storagePolicy());
		assertFalse(settings.validation());
		assertFalse(settings.threadSafe());
	}

	@Test
	void fromEnvironment_ignoresUnrecognizedValues() {
		RuntimeSettings settings = RuntimeSettings.fromEnvironment(Map.of(
			STORAGE_POLICY_VARIABLE, "turbo",
			VALIDATION_VARIABLE, "maybe"));
		assertEquals(RuntimeSettings.defaults(), settings);
	}

	@Test
	void withEnvironment_keepsOtherSettings() {
		RuntimeSettings settings = RuntimeSettings.builder()
			.entityCacheSize(7)
			.build()
			.withEnvironment(Map.of(VALIDATION_VARIABLE, "TRUE"));
		assertEquals(7, settings.entityCacheSize());
		assertTrue(settings.validation());
	}

	@Test
	void validate_rejectsNonPositiveSizes() {
		assertThrows(IllegalArgumentException.class, () -> RuntimeSettings.builder().entityCacheSize(0).build().validate());
		assertThrows(IllegalArgumentException.class, () -> RuntimeSettings.builder().autoFieldThreshold(-1).build().validate());
		assertThrows(IllegalArgumentException.class, () -> new EntityRuntime(RuntimeSettings.builder().queryCacheSize(0).build()));
	}
}
