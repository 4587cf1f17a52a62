package dev.fileops.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked by the engine between discrete filesystem steps (per
 * file, never in the middle of one).
 */
public final class CancellationToken {

	private static final CancellationToken NONE = new CancellationToken();

	private final AtomicBoolean cancelled = new AtomicBoolean();

	/**
	 * @return a token that is never cancelled by anyone holding it
	 */
	public static CancellationToken none() {
		return NONE;
	}

	public static CancellationToken create() {
		return new CancellationToken();
	}

	public void cancel() {
		if (this == NONE) {
			throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
		}
		this.cancelled.set(true);
	}

	public boolean isCancelled() {
		return this.cancelled.get();
	}

	/**
	 * @throws OperationCancelledException when cancellation was requested
	 */
	public void throwIfCancelled() throws OperationCancelledException {
		if (isCancelled()) {
			throw new OperationCancelledException("Operation cancelled");
		}
	}

}
