package dev.fileops.engine.event;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.fileops.engine.clipboard.ClipboardContents;
import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationError;
import dev.fileops.engine.model.OperationKind;

/**
 * Subscription registry that fans engine notifications out to listeners. A failing listener is
 * logged and does not prevent delivery to the others.
 */
public class OperationEvents {

	private static final Logger logger = LoggerFactory.getLogger(OperationEvents.class);

	private final List<OperationListener> listeners = new CopyOnWriteArrayList<>();

	/**
	 * Register a listener.
	 * @param listener listener to add
	 * @return handle that unsubscribes the listener when run
	 */
	public Runnable subscribe(OperationListener listener) {
		this.listeners.add(listener);
		return () -> unsubscribe(listener);
	}

	public boolean unsubscribe(OperationListener listener) {
		return this.listeners.remove(listener);
	}

	public void started(OperationKind kind, List<Path> sources) {
		dispatch(listener -> listener.operationStarted(kind, sources));
	}

	public void completed(OperationKind kind, List<Path> sources, Path target) {
		dispatch(listener -> listener.operationCompleted(kind, sources, target));
	}

	public void failed(OperationKind kind, List<Path> sources, OperationError error) {
		dispatch(listener -> listener.operationFailed(kind, sources, error));
	}

	public void undone(Operation operation) {
		dispatch(listener -> listener.operationUndone(operation));
	}

	public void redone(Operation operation) {
		dispatch(listener -> listener.operationRedone(operation));
	}

	public void clipboardChanged(ClipboardContents contents) {
		dispatch(listener -> listener.clipboardChanged(contents));
	}

	private void dispatch(Consumer<OperationListener> notification) {
		for (OperationListener listener : this.listeners) {
			try {
				notification.accept(listener);
			}
			catch (RuntimeException ex) {
				logger.warn("Operation listener {} failed", listener, ex);
			}
		}
	}

}
