package io.vena.thicket.exceptions;

import java.util.Map;

public class SnapshotException extends EntityException {
	public SnapshotException(String message) { super(message); }
	public SnapshotException(String message, Throwable cause) { super(message, cause); }

	@Override
	public Map<String, Object> details() {
		return detailMap("message", getMessage());
	}
}
