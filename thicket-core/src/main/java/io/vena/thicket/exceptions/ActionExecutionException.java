package io.vena.thicket.exceptions;

import io.vena.thicket.ActionProfile;
import java.util.Map;

/**
 * An action body failed.
 *
 * <p>
 * The dispatcher never rolls back. When {@link #partiallyApplied()} is true,
 * the body mutated the entity before it failed, and those mutations remain in place;
 * compensating for them is up to the caller or the action itself.
 */
public class ActionExecutionException extends EntityException {
	private final String action;
	private final ActionProfile profile;
	private final long versionBefore;
	private final long versionAfter;

	public ActionExecutionException(String action, ActionProfile profile, long versionBefore, long versionAfter, Throwable cause) {
		super("Action \"" + action + "\" (" + profile + ") failed"
			+ (versionAfter != versionBefore ? " after partially applying changes (version " + versionBefore + " -> " + versionAfter + ")" : "")
			+ ": " + cause.getMessage(), cause);
		this.action = action;
		this.profile = profile;
		this.versionBefore = versionBefore;
		this.versionAfter = versionAfter;
	}

	public String action() { return action; }
	public ActionProfile profile() { return profile; }
	public long versionBefore() { return versionBefore; }
	public long versionAfter() { return versionAfter; }
	public boolean partiallyApplied() { return versionAfter != versionBefore; }

	@Override
	public Map<String, Object> details() {
		return detailMap(
			"action", action,
			"profile", profile,
			"versionBefore", versionBefore,
			"versionAfter", versionAfter,
			"partiallyApplied", partiallyApplied());
	}
}
