package io.vena.thicket;

/**
 * The resolved storage location of one declared field.
 */
public interface AccessorStrategy {
	StoragePolicy policy();

	record Direct(int slotIndex) implements AccessorStrategy {
		@Override
		public StoragePolicy policy() {
			return StoragePolicy.DIRECT;
		}
	}

	record Delegated(String path) implements AccessorStrategy {
		@Override
		public StoragePolicy policy() {
			return StoragePolicy.DELEGATED;
		}
	}
}
