package io.vena.thicket;

import java.time.Instant;
import java.util.Set;
import lombok.Value;

/**
 * Attribution of one successful {@link ActionProfile#COMMAND}.
 */
@Value
public class CommandRecord {
	String action;
	String principal;
	Set<String> roles;
	long versionAfter;
	Instant at;
}
