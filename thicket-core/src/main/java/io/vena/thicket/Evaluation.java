package io.vena.thicket;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of checking one value against one {@link Constraints}.
 */
public record Evaluation(boolean ok, @Nullable String detail) {
	private static final Evaluation OK = new Evaluation(true, null);

	public static Evaluation pass() {
		return OK;
	}

	public static Evaluation fail(String detail) {
		return new Evaluation(false, detail);
	}
}
