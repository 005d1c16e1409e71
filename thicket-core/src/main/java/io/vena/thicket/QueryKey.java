package io.vena.thicket;

import java.util.Map;
import lombok.Value;

import static io.vena.thicket.util.PlainValues.deepCopyMap;
import static java.util.Collections.unmodifiableMap;

/**
 * Identifies a cached {@link ActionProfile#QUERY} result.
 */
@Value
public class QueryKey {
	String entityId;
	String action;
	Map<String, Object> params;

	public static QueryKey of(String entityId, String action, Map<String, ?> params) {
		return new QueryKey(entityId, action, unmodifiableMap(deepCopyMap(params)));
	}
}
