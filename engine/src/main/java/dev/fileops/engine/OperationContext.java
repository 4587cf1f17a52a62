package dev.fileops.engine;

import java.util.Objects;

/**
 * Per-call cancellation and progress hooks.
 * @param cancellation token checked between filesystem steps
 * @param progress progress callback
 */
public record OperationContext(CancellationToken cancellation, ProgressListener progress) {

	private static final OperationContext NONE = new OperationContext(CancellationToken.none(), ProgressListener.NONE);

	public OperationContext {
		Objects.requireNonNull(cancellation, "cancellation");
		Objects.requireNonNull(progress, "progress");
	}

	public static OperationContext none() {
		return NONE;
	}

}
