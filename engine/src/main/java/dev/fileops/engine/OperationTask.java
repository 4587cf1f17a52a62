package dev.fileops.engine;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import dev.fileops.engine.model.OperationResult;

/**
 * Handle to an operation submitted to an {@link OperationDispatcher}.
 */
public final class OperationTask {

	private final CompletableFuture<OperationResult> result;

	private final CancellationToken cancellation;

	OperationTask(CompletableFuture<OperationResult> result, CancellationToken cancellation) {
		this.result = result;
		this.cancellation = cancellation;
	}

	/**
	 * Request cooperative cancellation. The operation stops at its next filesystem step and rolls
	 * back; the future still completes with a {@code CANCELLED} result.
	 */
	public void cancel() {
		this.cancellation.cancel();
	}

	public boolean isCancelled() {
		return this.cancellation.isCancelled();
	}

	public boolean isDone() {
		return this.result.isDone();
	}

	public CompletableFuture<OperationResult> result() {
		return this.result;
	}

	/**
	 * Block until the operation finishes.
	 * @return the operation result
	 * @throws InterruptedException when the waiting thread is interrupted
	 * @throws ExecutionException when the operation threw unexpectedly
	 */
	public OperationResult await() throws InterruptedException, ExecutionException {
		return this.result.get();
	}

}
