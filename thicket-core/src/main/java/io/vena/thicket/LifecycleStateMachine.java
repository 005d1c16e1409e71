package io.vena.thicket;

import io.vena.thicket.exceptions.StateException;
import java.time.Clock;
import java.util.function.BooleanSupplier;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one entity's {@link EntityMetadata} and enforces the transitions of {@link LifecycleState}.
 *
 * <p>
 * Every accepted transition and every recorded mutation
 * increments the version by exactly one.
 * Not thread-safe; callers serialize access.
 */
public final class LifecycleStateMachine {
	private final EntityIdentity identity;
	private final Clock clock;
	@Getter private final EntityMetadata metadata;

	LifecycleStateMachine(EntityIdentity identity, Clock clock, EntityMetadata metadata) {
		this.identity = identity;
		this.clock = clock;
		this.metadata = metadata;
	}

	LifecycleStateMachine(EntityIdentity identity, Clock clock) {
		this(identity, clock, EntityMetadata.initial(clock.instant()));
	}

	public LifecycleState state() {
		return metadata.state();
	}

	public long version() {
		return metadata.version();
	}

	public boolean canTransitionTo(LifecycleState target) {
		return metadata.state().canTransitionTo(target);
	}

	/**
	 * @param validationPass consulted only when the target is {@link LifecycleState#VALIDATED}
	 * @throws StateException if the transition is not allowed, or validation fails;
	 * the state is unchanged in either case
	 */
	public void transitionTo(LifecycleState target, BooleanSupplier validationPass) {
		LifecycleState current = metadata.state();
		if (!current.canTransitionTo(target)) {
			throw new StateException(current, target, "transition not allowed");
		}
		if (target == LifecycleState.VALIDATED && !validationPass.getAsBoolean()) {
			throw new StateException(current, target, "validation failed");
		}
		metadata.state(target);
		metadata.touch(clock.instant());
		LOGGER.debug("{}: {} -> {} (version {})", identity, current, target, metadata.version());
	}

	/**
	 * Records a change that doesn't affect the lifecycle state.
	 */
	public void recordMutation() {
		metadata.touch(clock.instant());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleStateMachine.class);
}
