package io.vena.thicket;

import java.util.Arrays;

/**
 * The backing of one entity instance:
 * a slot array for direct fields, and a {@link FieldStore} for delegated
 * fields and undeclared paths.
 */
final class EntityStorage {
	/**
	 * Marks a slot that has never been written, so the field default applies.
	 */
	static final Object UNSET = new Object() {
		@Override public String toString() { return "UNSET"; }
	};

	final Object[] slots;
	final FieldStore store;

	EntityStorage(int slotCount, FieldStore store) {
		this.slots = new Object[slotCount];
		Arrays.fill(slots, UNSET);
		this.store = store;
	}
}
