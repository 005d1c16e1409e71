package io.vena.thicket.exceptions;

import java.util.Map;

/**
 * Dispatch to a name that the entity type never registered.
 * This is a programmer error; retrying will not help.
 */
public class ActionNotFoundException extends EntityException {
	private final String action;
	private final String entityType;

	public ActionNotFoundException(String action, String entityType) {
		super("No action \"" + action + "\" on entity type \"" + entityType + "\"");
		this.action = action;
		this.entityType = entityType;
	}

	public String action() { return action; }
	public String entityType() { return entityType; }

	@Override
	public Map<String, Object> details() {
		return detailMap("action", action, "entityType", entityType);
	}
}
