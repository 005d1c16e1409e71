package io.vena.thicket;

/**
 * How the dispatcher treats an action beyond the common lookup, authorization and input checks.
 */
public enum ActionProfile {
	/**
	 * Reads only. Results may be cached until the entity next changes.
	 */
	QUERY,

	/**
	 * Mutates. The version is bumped after success and the caller is recorded.
	 */
	COMMAND,

	/**
	 * Deferred to the configured executor if there is one; otherwise runs inline.
	 */
	TASK,

	/**
	 * Multi-step. No rollback: a failure reports whether anything was already applied.
	 */
	WORKFLOW,

	/**
	 * Parameters map one-to-one onto declared inputs; anything undeclared is rejected.
	 */
	ENDPOINT,
}
