package io.vena.thicket;

import java.util.LinkedHashSet;
import java.util.Set;
import lombok.NonNull;
import lombok.Value;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableSet;

/**
 * Who is dispatching an action, for authorization and attribution.
 */
@Value
public class Caller {
	@NonNull String principal;
	@NonNull Set<String> roles;

	private static final Caller ANONYMOUS = new Caller("anonymous", Set.of());

	public static Caller anonymous() {
		return ANONYMOUS;
	}

	public static Caller of(String principal, String... roles) {
		return new Caller(principal, unmodifiableSet(new LinkedHashSet<>(asList(roles))));
	}
}
