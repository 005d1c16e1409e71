package io.vena.thicket.exceptions;

import java.util.Map;
import java.util.Set;

public class AuthorizationException extends EntityException {
	private final String action;
	private final Set<String> callerRoles;
	private final Set<String> allowedRoles;

	public AuthorizationException(String action, Set<String> callerRoles, Set<String> allowedRoles) {
		super("Roles " + callerRoles + " may not execute \"" + action + "\"; requires one of " + allowedRoles);
		this.action = action;
		this.callerRoles = Set.copyOf(callerRoles);
		this.allowedRoles = Set.copyOf(allowedRoles);
	}

	public String action() { return action; }
	public Set<String> callerRoles() { return callerRoles; }
	public Set<String> allowedRoles() { return allowedRoles; }

	@Override
	public Map<String, Object> details() {
		return detailMap("action", action, "callerRoles", callerRoles, "allowedRoles", allowedRoles);
	}
}
