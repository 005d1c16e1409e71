package io.vena.thicket.exceptions;

import io.vena.thicket.LifecycleState;
import java.util.Map;

public class StateException extends EntityException {
	private final LifecycleState current;
	private final LifecycleState target;
	private final String reason;

	public StateException(LifecycleState current, LifecycleState target, String reason) {
		super("Cannot transition from " + current + " to " + target + ": " + reason);
		this.current = current;
		this.target = target;
		this.reason = reason;
	}

	public LifecycleState current() { return current; }
	public LifecycleState target() { return target; }
	public String reason() { return reason; }

	@Override
	public Map<String, Object> details() {
		return detailMap("current", current, "target", target, "reason", reason);
	}
}
