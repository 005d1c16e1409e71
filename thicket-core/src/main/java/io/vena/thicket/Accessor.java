package io.vena.thicket;

import io.vena.thicket.AccessorStrategy.Delegated;
import io.vena.thicket.AccessorStrategy.Direct;
import io.vena.thicket.exceptions.ValidationException;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import static io.vena.thicket.EntityStorage.UNSET;
import static io.vena.thicket.util.PlainValues.deepCopy;

/**
 * Reads and writes one declared field according to its {@link AccessorStrategy}.
 *
 * <p>
 * An accessor is shared by every instance of a type; the per-instance state
 * is the {@link EntityStorage} passed to each call.
 */
public final class Accessor {
	@Getter private final FieldSpec field;
	@Getter private final AccessorStrategy strategy;
	private final @Nullable SchemaEvaluator evaluator;

	/**
	 * @param evaluator null to skip validation entirely
	 */
	Accessor(FieldSpec field, AccessorStrategy strategy, @Nullable SchemaEvaluator evaluator) {
		this.field = field;
		this.strategy = strategy;
		this.evaluator = evaluator;
	}

	public String name() {
		return field.name();
	}

	@Nullable Object get(EntityStorage storage) {
		if (strategy instanceof Direct) {
			Object value = storage.slots[((Direct) strategy).slotIndex()];
			return value == UNSET ? field.defaultValue() : value;
		} else {
			return storage.store.get(((Delegated) strategy).path(), field.defaultValue());
		}
	}

	boolean isSet(EntityStorage storage) {
		if (strategy instanceof Direct) {
			return storage.slots[((Direct) strategy).slotIndex()] != UNSET;
		} else {
			return storage.store.contains(((Delegated) strategy).path());
		}
	}

	/**
	 * @throws ValidationException if the value is rejected; nothing is written in that case
	 */
	void set(EntityStorage storage, @Nullable Object value) {
		validate(value);
		write(storage, value);
	}

	/**
	 * Stores without validating.
	 */
	void write(EntityStorage storage, @Nullable Object value) {
		if (strategy instanceof Direct) {
			storage.slots[((Direct) strategy).slotIndex()] = deepCopy(value);
		} else {
			storage.store.set(((Delegated) strategy).path(), value);
		}
	}

	/**
	 * Reverts the field to its default.
	 */
	void clear(EntityStorage storage) {
		if (strategy instanceof Direct) {
			storage.slots[((Direct) strategy).slotIndex()] = UNSET;
		} else {
			storage.store.delete(((Delegated) strategy).path());
		}
	}

	void validate(@Nullable Object value) {
		if (evaluator != null) {
			check(evaluator, field, value);
		}
	}

	/**
	 * Validates regardless of whether this accessor was synthesized with validation.
	 */
	static void check(SchemaEvaluator evaluator, FieldSpec field, @Nullable Object value) {
		if (value == null && field.required()) {
			throw ValidationException.requiredField(field.name(), field.constraints());
		}
		Evaluation evaluation;
		try {
			evaluation = evaluator.evaluateField(field, value);
		} catch (RuntimeException e) {
			throw new ValidationException("Evaluator failed on field \"" + field.name() + "\": " + e.getMessage(), field.name(), value, e);
		}
		if (!evaluation.ok()) {
			throw ValidationException.forField(field.name(), value, field.constraints(), evaluation.detail());
		}
	}

	@Override
	public String toString() {
		return "Accessor(" + field.name() + ": " + strategy + ")";
	}
}
