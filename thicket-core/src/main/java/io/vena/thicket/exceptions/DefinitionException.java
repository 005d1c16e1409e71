package io.vena.thicket.exceptions;

import java.util.Map;

/**
 * An entity type declaration is malformed.
 * Only ever thrown while a type is being built, never from an instance.
 */
public class DefinitionException extends EntityException {
	private final String entityType;
	private final String member;

	public DefinitionException(String entityType, String member, String message) {
		super("Invalid definition of \"" + member + "\" in entity type \"" + entityType + "\": " + message);
		this.entityType = entityType;
		this.member = member;
	}

	public DefinitionException(String entityType, String member, String message, Throwable cause) {
		super("Invalid definition of \"" + member + "\" in entity type \"" + entityType + "\": " + message, cause);
		this.entityType = entityType;
		this.member = member;
	}

	public String entityType() { return entityType; }
	public String member() { return member; }

	@Override
	public Map<String, Object> details() {
		return detailMap("entityType", entityType, "member", member);
	}
}
