package io.vena.thicket;

/**
 * Where an entity's declared field values live.
 *
 * @see AccessorSynthesizer
 * @see StrategyResolver
 */
public enum StoragePolicy {
	/**
	 * Every field in its own slot of the instance's slot array.
	 */
	DIRECT,

	/**
	 * Every field in the instance's {@link FieldStore}, under the field name.
	 */
	DELEGATED,

	/**
	 * Frequently accessed fields direct; all others delegated.
	 */
	MIXED,

	/**
	 * Chosen per type at its first instantiation.
	 */
	AUTO,
}
