package dev.fileops.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.fileops.engine.model.OperationResult;

/**
 * Runs engine calls on a single background worker so long copies and deletes do not block the
 * caller. Submissions execute one at a time in submission order.
 */
public class OperationDispatcher implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(OperationDispatcher.class);

	private static final AtomicInteger threadCounter = new AtomicInteger();

	private final OperationEngine engine;

	private final ExecutorService worker;

	public OperationDispatcher(OperationEngine engine) {
		this.engine = engine;
		this.worker = Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "fileops-worker-" + threadCounter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	/**
	 * Submit an arbitrary engine call.
	 * @param call call receiving the task's context
	 * @param progress progress callback, invoked on the worker thread
	 * @return handle for waiting on and cancelling the call
	 */
	public OperationTask submit(Function<OperationContext, OperationResult> call, ProgressListener progress) {
		CancellationToken cancellation = CancellationToken.create();
		OperationContext context = new OperationContext(cancellation, progress);
		CompletableFuture<OperationResult> future = CompletableFuture.supplyAsync(() -> call.apply(context),
				this.worker);
		future.whenComplete((result, failure) -> {
			if (failure != null) {
				logger.error("Background operation failed unexpectedly", failure);
			}
		});
		return new OperationTask(future, cancellation);
	}

	public OperationTask copy(List<Path> paths, Path targetDirectory, ProgressListener progress) {
		return submit(context -> this.engine.copy(paths, targetDirectory, context), progress);
	}

	public OperationTask move(List<Path> paths, Path targetDirectory, ProgressListener progress) {
		return submit(context -> this.engine.move(paths, targetDirectory, context), progress);
	}

	public OperationTask delete(List<Path> paths, boolean permanent, boolean confirmed, ProgressListener progress) {
		return submit(context -> this.engine.delete(paths, permanent, confirmed, context), progress);
	}

	public OperationTask duplicate(Path path, ProgressListener progress) {
		return submit(context -> this.engine.duplicate(path, context), progress);
	}

	public OperationTask paste(Path targetDirectory, ProgressListener progress) {
		return submit(context -> this.engine.paste(targetDirectory, context), progress);
	}

	@Override
	public void close() {
		this.worker.shutdown();
		try {
			if (!this.worker.awaitTermination(30, TimeUnit.SECONDS)) {
				logger.warn("Worker did not finish within 30s, interrupting");
				this.worker.shutdownNow();
			}
		}
		catch (InterruptedException ex) {
			this.worker.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

}
