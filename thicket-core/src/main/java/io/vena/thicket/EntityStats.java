package io.vena.thicket;

import lombok.Value;

/**
 * Per-entity access counters.
 */
@Value
public class EntityStats {
	long reads;
	long writes;
	long validations;
}
