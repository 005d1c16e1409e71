package io.vena.thicket;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Value;

import static java.util.Collections.unmodifiableMap;
import static java.util.stream.Collectors.toList;

/**
 * Declaration of one action an {@link EntityType} exposes.
 *
 * <p>
 * {@link #allowedRoles} containing {@link #ANY_ROLE} admits every caller.
 * Inputs with no entry in {@link #inputConstraints} are accepted unchecked,
 * except by {@link ActionProfile#ENDPOINT} actions, which reject them.
 */
@Value
@Builder
public class ActionSpec {
	public static final String ANY_ROLE = "*";

	@NonNull String name;
	@Default Set<String> allowedRoles = Set.of(ANY_ROLE);
	@Default Map<String, Constraints> inputConstraints = Map.of();
	@Default ActionProfile profile = ActionProfile.COMMAND;
	@Default String description = "";
	@NonNull ActionBody body;

	public boolean admits(Caller caller) {
		if (allowedRoles.contains(ANY_ROLE)) {
			return true;
		}
		for (String role: caller.roles()) {
			if (allowedRoles.contains(role)) {
				return true;
			}
		}
		return false;
	}

	public Map<String, Object> describe() {
		Map<String, Object> inputs = new LinkedHashMap<>();
		inputConstraints.forEach((k, v) -> inputs.put(k, v.toPlainMapping()));
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("name", name);
		result.put("roles", allowedRoles.stream().sorted().collect(toList()));
		result.put("profile", profile.name());
		result.put("inputConstraints", unmodifiableMap(inputs));
		result.put("description", description);
		return unmodifiableMap(result);
	}
}
