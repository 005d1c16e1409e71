package io.vena.thicket;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableMap;

/**
 * The declaration shared by every instance of one kind of entity:
 * its name, its fields, its actions, and optionally its own {@link StoragePolicy}.
 *
 * <p>
 * Immutable once built. Equality is identity, so two separately built
 * types with the same name are distinct.
 */
public final class EntityType {
	@Getter private final String name;
	@Getter private final FieldTable fields;
	@Getter private final ActionTable actions;
	@Getter private final @Nullable StoragePolicy storagePolicy;

	private EntityType(String name, FieldTable fields, ActionTable actions, @Nullable StoragePolicy storagePolicy) {
		this.name = name;
		this.fields = fields;
		this.actions = actions;
		this.storagePolicy = storagePolicy;
	}

	/**
	 * Builder with annotation discovery enabled.
	 * Use {@link EntityRuntime#typeBuilder} to follow the runtime's settings instead.
	 */
	public static Builder builder(String name) {
		return new Builder(name, true);
	}

	/**
	 * @return <code>{ type, fields, actions }</code>
	 */
	public Map<String, Object> describe() {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("type", name);
		result.put("fields", fields.describe());
		result.put("actions", actions.describe());
		return unmodifiableMap(result);
	}

	@Override
	public String toString() {
		return "EntityType(" + name + ")";
	}

	public static final class Builder {
		private final String name;
		private final boolean actionDiscovery;
		private final List<FieldSpec> fields = new ArrayList<>();
		private final List<ActionSpec> actions = new ArrayList<>();
		private @Nullable StoragePolicy storagePolicy = null;

		Builder(String name, boolean actionDiscovery) {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("Entity type name must not be blank");
			}
			this.name = name;
			this.actionDiscovery = actionDiscovery;
		}

		public Builder field(FieldSpec field) {
			fields.add(field);
			return this;
		}

		/**
		 * Required field with no default.
		 */
		public Builder field(String fieldName, Constraints constraints) {
			return field(FieldSpec.of(fieldName, constraints));
		}

		public Builder field(String fieldName, Constraints constraints, @Nullable Object defaultValue) {
			return field(FieldSpec.of(fieldName, constraints, defaultValue));
		}

		public Builder action(ActionSpec action) {
			actions.add(action);
			return this;
		}

		/**
		 * Registers every {@link io.vena.thicket.annotations.EntityAction} method of <code>receiverObject</code>.
		 */
		public Builder actionsFrom(Object receiverObject) {
			if (actionDiscovery) {
				actions.addAll(ActionRegistrar.actionsFrom(name, receiverObject));
			} else {
				LOGGER.warn("Action discovery is disabled; ignoring actions of {} for entity type \"{}\"",
					receiverObject.getClass().getSimpleName(), name);
			}
			return this;
		}

		/**
		 * Overrides the runtime's default policy for this type.
		 */
		public Builder storagePolicy(StoragePolicy storagePolicy) {
			this.storagePolicy = storagePolicy;
			return this;
		}

		/**
		 * @throws io.vena.thicket.exceptions.DefinitionException if any field or action is malformed
		 */
		public EntityType build() {
			EntityType result = new EntityType(name, FieldTable.of(name, fields), ActionTable.of(name, actions), storagePolicy);
			LOGGER.debug("Built {} with {} fields and {} actions", result, result.fields.size(), result.actions.size());
			return result;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EntityType.class);
}
