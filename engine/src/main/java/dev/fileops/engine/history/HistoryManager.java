package dev.fileops.engine.history;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationKind;
import dev.fileops.engine.model.PathMapping;
import dev.fileops.engine.model.UndoPayload;

/**
 * Undo and redo stacks over recorded operations.
 * <p>
 * Every operation lives in exactly one of: the undo stack, the redo stack, or nowhere (evicted
 * or dropped). Recording always empties the redo stack; only the undo stack is bounded, oldest
 * entries are evicted first. This class only moves entries around; callers reverse the
 * filesystem effect using the entry's undo payload, and release whatever an entry holds on to
 * through {@link #onDiscard}.
 */
public class HistoryManager {

	private static final Logger logger = LoggerFactory.getLogger(HistoryManager.class);

	private final HistorySettings settings;

	private final Deque<Operation> undoStack = new ArrayDeque<>();

	private final Deque<Operation> redoStack = new ArrayDeque<>();

	private Consumer<Operation> discardListener = operation -> {
	};

	public HistoryManager(HistorySettings settings) {
		this.settings = settings;
	}

	/**
	 * Register the callback invoked for every entry that leaves history for good: evicted,
	 * dropped, cleared, or discarded from the redo stack by a new recording.
	 * @param listener callback, replacing any earlier one
	 */
	public synchronized void onDiscard(Consumer<Operation> listener) {
		this.discardListener = listener;
	}

	/**
	 * Record a successfully executed operation.
	 * @param operation operation to record
	 * @return {@code false} when the operation is not undoable and was ignored
	 */
	public synchronized boolean record(Operation operation) {
		if (!operation.undoable()) {
			logger.debug("Operation {} is not undoable, not recording", operation.kind().id());
			return false;
		}
		if (!this.redoStack.isEmpty()) {
			logger.debug("Clearing {} redo entries due to new operation", this.redoStack.size());
			discardAll(this.redoStack);
		}
		Operation previous = this.undoStack.peekLast();
		if (previous != null && this.settings.mergeEnabled() && withinWindow(previous, operation)) {
			Optional<PathMapping> net = netEffect(previous, operation);
			if (net.isPresent()) {
				this.undoStack.removeLast();
				PathMapping mapping = net.get();
				if (mapping.source().equals(mapping.destination())) {
					logger.debug("{} cancelled out the previous entry", operation.description());
				}
				else {
					this.undoStack.addLast(merged(previous, operation, mapping));
				}
				return true;
			}
		}
		this.undoStack.addLast(operation);
		while (this.undoStack.size() > this.settings.maxSize()) {
			Operation evicted = this.undoStack.removeFirst();
			logger.debug("Evicted oldest history entry: {}", evicted.description());
			this.discardListener.accept(evicted);
		}
		logger.debug("Recorded {}", operation.description());
		return true;
	}

	/**
	 * Move the most recent entry from the undo stack to the redo stack.
	 * @return the entry, or empty when there is nothing to undo
	 */
	public synchronized Optional<Operation> undo() {
		Operation operation = this.undoStack.pollLast();
		if (operation == null) {
			logger.debug("Nothing to undo");
			return Optional.empty();
		}
		this.redoStack.addLast(operation);
		return Optional.of(operation);
	}

	/**
	 * Move the most recently undone entry back onto the undo stack.
	 * @return the entry, or empty when there is nothing to redo
	 */
	public synchronized Optional<Operation> redo() {
		Operation operation = this.redoStack.pollLast();
		if (operation == null) {
			logger.debug("Nothing to redo");
			return Optional.empty();
		}
		this.undoStack.addLast(operation);
		return Optional.of(operation);
	}

	public synchronized Optional<Operation> peekUndo() {
		return Optional.ofNullable(this.undoStack.peekLast());
	}

	public synchronized Optional<Operation> peekRedo() {
		return Optional.ofNullable(this.redoStack.peekLast());
	}

	/**
	 * Remove the top undo entry without moving it, used when it no longer matches the filesystem.
	 * @param expected entry the caller peeked
	 * @return {@code true} when the top entry was the expected one and has been dropped
	 */
	public synchronized boolean dropUndo(Operation expected) {
		if (this.undoStack.peekLast() != expected) {
			return false;
		}
		this.undoStack.removeLast();
		logger.debug("Dropped undo entry: {}", expected.description());
		this.discardListener.accept(expected);
		return true;
	}

	/**
	 * Remove the top redo entry without moving it, used when it no longer matches the filesystem.
	 * @param expected entry the caller peeked
	 * @return {@code true} when the top entry was the expected one and has been dropped
	 */
	public synchronized boolean dropRedo(Operation expected) {
		if (this.redoStack.peekLast() != expected) {
			return false;
		}
		this.redoStack.removeLast();
		logger.debug("Dropped redo entry: {}", expected.description());
		this.discardListener.accept(expected);
		return true;
	}

	public synchronized boolean canUndo() {
		return !this.undoStack.isEmpty();
	}

	public synchronized boolean canRedo() {
		return !this.redoStack.isEmpty();
	}

	/**
	 * @return copy of the undo stack, oldest first
	 */
	public synchronized List<Operation> undoHistory() {
		return new ArrayList<>(this.undoStack);
	}

	/**
	 * @return copy of the redo stack, oldest first
	 */
	public synchronized List<Operation> redoHistory() {
		return new ArrayList<>(this.redoStack);
	}

	public synchronized void clear() {
		discardAll(this.undoStack);
		discardAll(this.redoStack);
		logger.debug("Cleared undo/redo history");
	}

	private void discardAll(Deque<Operation> stack) {
		while (!stack.isEmpty()) {
			this.discardListener.accept(stack.removeLast());
		}
	}

	private boolean withinWindow(Operation previous, Operation next) {
		long gap = next.monotonicNanos() - previous.monotonicNanos();
		return gap >= 0 && gap <= this.settings.mergeWindow().toNanos();
	}

	/**
	 * Net effect of two chained renames, or two chained single-item moves, of the same item.
	 * @return origin and final location, empty when the operations do not chain
	 */
	private static Optional<PathMapping> netEffect(Operation previous, Operation next) {
		if (previous.kind() != next.kind()) {
			return Optional.empty();
		}
		if (previous.undoPayload() instanceof UndoPayload.Renamed first
				&& next.undoPayload() instanceof UndoPayload.Renamed second
				&& first.renamedPath().equals(second.originalPath())) {
			return Optional.of(new PathMapping(first.originalPath(), second.renamedPath()));
		}
		if (previous.kind() == OperationKind.MOVE
				&& previous.undoPayload() instanceof UndoPayload.Transfers first
				&& next.undoPayload() instanceof UndoPayload.Transfers second
				&& first.entries().size() == 1 && second.entries().size() == 1
				&& first.entries().get(0).destination().equals(second.entries().get(0).source())) {
			return Optional.of(new PathMapping(first.entries().get(0).source(), second.entries().get(0).destination()));
		}
		return Optional.empty();
	}

	private static Operation merged(Operation previous, Operation next, PathMapping net) {
		UndoPayload payload = previous.kind() == OperationKind.RENAME
				? new UndoPayload.Renamed(net.source(), net.destination())
				: new UndoPayload.Transfers(List.of(net));
		return new Operation(previous.kind(), previous.sourcePaths(), next.targetPath(), next.timestamp(),
				next.monotonicNanos(), true, payload);
	}

}
