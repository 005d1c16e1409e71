package io.vena.thicket;

import io.vena.thicket.exceptions.DefinitionException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPMap;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * The ordered, immutable set of actions declared by an {@link EntityType}.
 */
public final class ActionTable implements Iterable<ActionSpec> {
	private final OrderedPMap<String, ActionSpec> actions;

	private ActionTable(OrderedPMap<String, ActionSpec> actions) {
		this.actions = actions;
	}

	/**
	 * @throws DefinitionException for a blank or duplicate name, or an empty role set
	 */
	public static ActionTable of(String entityType, Collection<ActionSpec> specs) {
		LinkedHashMap<String, ActionSpec> map = new LinkedHashMap<>();
		for (ActionSpec spec: specs) {
			if (spec.name().isBlank()) {
				throw new DefinitionException(entityType, spec.name(), "action name must not be blank");
			}
			if (spec.allowedRoles().isEmpty()) {
				throw new DefinitionException(entityType, spec.name(), "action must allow at least one role");
			}
			if (map.put(spec.name(), spec) != null) {
				throw new DefinitionException(entityType, spec.name(), "duplicate action name");
			}
		}
		return new ActionTable(OrderedPMap.from(map));
	}

	public @Nullable ActionSpec get(String name) {
		return actions.get(name);
	}

	public boolean contains(String name) {
		return actions.containsKey(name);
	}

	public int size() {
		return actions.size();
	}

	public List<String> names() {
		return unmodifiableList(new ArrayList<>(actions.keySet()));
	}

	@Override
	public Iterator<ActionSpec> iterator() {
		return actions.values().iterator();
	}

	public Map<String, Object> describe() {
		Map<String, Object> result = new LinkedHashMap<>();
		actions.forEach((name, spec) -> result.put(name, spec.describe()));
		return unmodifiableMap(result);
	}

	@Override
	public String toString() {
		return "ActionTable" + actions.keySet();
	}
}
