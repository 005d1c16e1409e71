package io.vena.thicket;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NestedFieldStoreTest {
	final NestedFieldStore store = new NestedFieldStore();

	@Test
	void set_createsIntermediateMaps() {
		store.set("a.b.c", 1);
		assertEquals(1, store.get("a.b.c"));
		assertEquals(Map.of("c", 1), store.get("a.b"));
		assertTrue(store.contains("a.b"));
	}

	@Test
	void get_missingReturnsDefault() {
		assertNull(store.get("nope"));
		assertEquals("fallback", store.get("a.b", "fallback"));
		assertFalse(store.contains("a.b"));
	}

	@Test
	void storedNull_isDistinctFromMissing() {
		store.set("x", null);
		assertTrue(store.contains("x"));
		assertNull(store.get("x", "fallback"));
	}

	@Test
	void delete_missingPathIsNoOp() {
		store.delete("a.b.c");
		store.set("a.b", 1);
		store.delete("a.c");
		assertEquals(Map.of("a", Map.of("b", 1)), store.toPlainMapping());
		store.delete("a.b");
		assertEquals(Map.of("a", Map.of()), store.toPlainMapping());
	}

	@Test
	void pathThroughNonMap_throws() {
		store.set("a", "scalar");
		assertThrows(IllegalArgumentException.class, () -> store.set("a.b", 1));
		assertThrows(IllegalArgumentException.class, () -> store.get("a.b"));
	}

	@Test
	void emptySegment_throws() {
		assertThrows(IllegalArgumentException.class, () -> store.set("a..b", 1));
		assertThrows(IllegalArgumentException.class, () -> store.get(""));
		assertThrows(IllegalArgumentException.class, () -> store.get("a."));
	}

	@Test
	void toPlainMapping_isDeepCopy() {
		List<String> list = new ArrayList<>(List.of("x"));
		store.set("list", list);
		list.add("mutated after set");
		Map<String, Object> plain = store.toPlainMapping();
		@SuppressWarnings("unchecked")
		List<String> copied = (List<String>) plain.get("list");
		copied.add("mutated copy");
		assertEquals(List.of("x"), store.get("list"));
	}

	@Test
	void loadFromPlainMapping_replacesContents() {
		store.set("old", 1);
		store.loadFromPlainMapping(Map.of("new", Map.of("nested", 2)));
		assertFalse(store.contains("old"));
		assertEquals(2, store.get("new.nested"));
		store.set("new.other", 3);
		assertEquals(3, store.get("new.other"));
	}
}
