package io.vena.thicket;

import java.util.List;
import java.util.Map;

/**
 * The coarse value kinds a {@link Constraints} can demand.
 */
public enum ValueType {
	STRING,
	INTEGER,
	NUMBER,
	BOOLEAN,
	MAP,
	LIST,
	ANY;

	public boolean matches(Object value) {
		switch (this) {
			case STRING: return value instanceof CharSequence;
			case INTEGER: return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
			case NUMBER: return value instanceof Number;
			case BOOLEAN: return value instanceof Boolean;
			case MAP: return value instanceof Map;
			case LIST: return value instanceof List;
			default: return true;
		}
	}
}
