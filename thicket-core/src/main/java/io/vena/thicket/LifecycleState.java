package io.vena.thicket;

import java.util.EnumSet;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;

/**
 * The lifecycle an entity moves through.
 *
 * <pre>
 * DRAFT      -> VALIDATED, ARCHIVED
 * VALIDATED  -> COMMITTED, DRAFT, ARCHIVED
 * COMMITTED  -> ARCHIVED
 * ARCHIVED   -> DRAFT
 * </pre>
 */
public enum LifecycleState {
	DRAFT,
	VALIDATED,
	COMMITTED,
	ARCHIVED;

	private Set<LifecycleState> successors;

	static {
		DRAFT.successors = unmodifiableSet(EnumSet.of(VALIDATED, ARCHIVED));
		VALIDATED.successors = unmodifiableSet(EnumSet.of(COMMITTED, DRAFT, ARCHIVED));
		COMMITTED.successors = unmodifiableSet(EnumSet.of(ARCHIVED));
		ARCHIVED.successors = unmodifiableSet(EnumSet.of(DRAFT));
	}

	public Set<LifecycleState> successors() {
		return successors;
	}

	public boolean canTransitionTo(LifecycleState target) {
		return successors.contains(target);
	}
}
