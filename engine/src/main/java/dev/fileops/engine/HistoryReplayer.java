package dev.fileops.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.fileops.engine.fs.FileSystemAccess;
import dev.fileops.engine.model.ErrorKind;
import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationError;
import dev.fileops.engine.model.OperationKind;
import dev.fileops.engine.model.PathMapping;
import dev.fileops.engine.model.UndoPayload;

/**
 * Reverses and re-applies recorded operations from their undo payload alone.
 * <p>
 * {@link #divergence} checks the recorded state against the filesystem before anything is
 * touched, so an entry that no longer applies fails without partial effects. When a step fails
 * anyway, {@link #apply} puts the steps already taken back.
 */
class HistoryReplayer {

	private static final Logger logger = LoggerFactory.getLogger(HistoryReplayer.class);

	enum Direction {
		UNDO, REDO
	}

	/**
	 * Outcome of {@link #apply}.
	 * @param errors empty when every step was applied
	 * @param stranded paths left in the half-applied state because putting them back failed too
	 */
	record Replay(List<OperationError> errors, List<Path> stranded) {

		static final Replay DONE = new Replay(List.of(), List.of());

		boolean succeeded() {
			return this.errors.isEmpty();
		}

	}

	private final FileSystemAccess fileSystem;

	private final TrashBin trash;

	HistoryReplayer(FileSystemAccess fileSystem, TrashBin trash) {
		this.fileSystem = fileSystem;
		this.trash = trash;
	}

	/**
	 * @return one error per recorded path that no longer matches the filesystem
	 */
	List<OperationError> divergence(Operation operation, Direction direction) {
		List<OperationError> problems = new ArrayList<>();
		UndoPayload payload = operation.undoPayload();
		if (payload instanceof UndoPayload.Transfers transfers) {
			for (PathMapping entry : transfers.entries()) {
				Path present = direction == Direction.UNDO ? entry.destination() : entry.source();
				requirePresent(present, problems);
				switch (operation.kind()) {
					case MOVE, DELETE -> requireAbsent(direction == Direction.UNDO ? entry.source() : entry.destination(),
							problems);
					default -> {
						if (direction == Direction.REDO) {
							requireAbsent(entry.destination(), problems);
						}
					}
				}
			}
		}
		else if (payload instanceof UndoPayload.Renamed renamed) {
			requirePresent(direction == Direction.UNDO ? renamed.renamedPath() : renamed.originalPath(), problems);
			requireAbsent(direction == Direction.UNDO ? renamed.originalPath() : renamed.renamedPath(), problems);
		}
		else if (payload instanceof UndoPayload.Created created) {
			if (direction == Direction.UNDO) {
				requirePresent(created.createdPath(), problems);
				requireUntouched(created, problems);
			}
			else {
				requireAbsent(created.createdPath(), problems);
				Path parent = created.createdPath().getParent();
				if (parent != null && !this.fileSystem.isDirectory(parent)) {
					problems.add(diverged(parent, "Parent directory no longer exists"));
				}
			}
		}
		else {
			problems.add(new OperationError(ErrorKind.HISTORY_DIVERGED, null,
					"Operation carries no undo payload: " + operation.description()));
		}
		return problems;
	}

	/**
	 * Apply the reverse (undo) or the original effect (redo) of an operation whose state was
	 * verified with {@link #divergence}. A failing step undoes the steps already taken, so the
	 * entry can stay where it is in history.
	 */
	Replay apply(Operation operation, Direction direction) {
		UndoPayload payload = operation.undoPayload();
		if (payload instanceof UndoPayload.Transfers transfers) {
			return applyTransfers(operation, transfers.entries(), direction);
		}
		try {
			if (payload instanceof UndoPayload.Renamed renamed) {
				if (direction == Direction.UNDO) {
					this.fileSystem.rename(renamed.renamedPath(), renamed.originalPath());
				}
				else {
					this.fileSystem.rename(renamed.originalPath(), renamed.renamedPath());
				}
			}
			else if (payload instanceof UndoPayload.Created created) {
				if (direction == Direction.UNDO) {
					this.fileSystem.deleteRecursively(created.createdPath());
				}
				else if (created.directory()) {
					this.fileSystem.createDirectory(created.createdPath());
				}
				else {
					this.fileSystem.createFile(created.createdPath());
				}
			}
			return Replay.DONE;
		}
		catch (IOException ex) {
			Path path = operation.sourcePaths().isEmpty() ? null : operation.sourcePaths().get(0);
			return new Replay(List.of(OperationError.from(path, ex)), List.of());
		}
	}

	private Replay applyTransfers(Operation operation, List<PathMapping> entries, Direction direction) {
		List<PathMapping> ordered = new ArrayList<>(entries);
		if (direction == Direction.UNDO) {
			Collections.reverse(ordered);
		}
		List<PathMapping> applied = new ArrayList<>();
		for (PathMapping entry : ordered) {
			try {
				step(operation, entry, direction);
				applied.add(entry);
			}
			catch (IOException ex) {
				logger.warn("Failed to {} {} of {}, putting back {} step(s)", direction.name().toLowerCase(),
						operation.kind().id(), entry.source(), applied.size(), ex);
				List<OperationError> errors = new ArrayList<>();
				errors.add(OperationError.from(direction == Direction.UNDO ? entry.destination() : entry.source(), ex));
				List<Path> stranded = putBack(operation, applied, direction, errors);
				return new Replay(errors, stranded);
			}
		}
		return Replay.DONE;
	}

	private List<Path> putBack(Operation operation, List<PathMapping> applied, Direction direction,
			List<OperationError> errors) {
		Direction back = direction == Direction.UNDO ? Direction.REDO : Direction.UNDO;
		List<Path> stranded = new ArrayList<>();
		for (int i = applied.size() - 1; i >= 0; i--) {
			PathMapping entry = applied.get(i);
			try {
				step(operation, entry, back);
			}
			catch (IOException ex) {
				logger.error("Could not put back {} of {}", operation.kind().id(), entry.source(), ex);
				errors.add(OperationError.from(entry.source(), ex));
				stranded.add(stranded(operation, entry, direction));
			}
		}
		return stranded;
	}

	private void step(Operation operation, PathMapping entry, Direction direction) throws IOException {
		if (direction == Direction.UNDO) {
			undoTransfer(operation, entry);
		}
		else {
			redoTransfer(operation, entry);
		}
	}

	private void undoTransfer(Operation operation, PathMapping entry) throws IOException {
		switch (operation.kind()) {
			case MOVE, DELETE -> {
				ensureParent(entry.source());
				this.fileSystem.move(entry.destination(), entry.source(), CancellationToken.none());
				if (operation.kind() == OperationKind.DELETE) {
					this.trash.release(entry.destination());
				}
			}
			default -> this.fileSystem.deleteRecursively(entry.destination());
		}
		logger.debug("Reversed {} of {}", operation.kind().id(), entry.source());
	}

	private void redoTransfer(Operation operation, PathMapping entry) throws IOException {
		ensureParent(entry.destination());
		switch (operation.kind()) {
			case MOVE, DELETE -> this.fileSystem.move(entry.source(), entry.destination(), CancellationToken.none());
			default -> this.fileSystem.copy(entry.source(), entry.destination(), CancellationToken.none());
		}
		logger.debug("Re-applied {} of {}", operation.kind().id(), entry.source());
	}

	/**
	 * Path affected by a step that was applied in {@code direction} and could not be put back.
	 */
	private static Path stranded(Operation operation, PathMapping entry, Direction direction) {
		if (direction == Direction.REDO) {
			return entry.destination();
		}
		return operation.kind() == OperationKind.MOVE || operation.kind() == OperationKind.DELETE ? entry.source()
				: entry.destination();
	}

	private void ensureParent(Path path) throws IOException {
		Path parent = path.getParent();
		if (parent != null && !this.fileSystem.exists(parent)) {
			this.fileSystem.createDirectories(parent);
		}
	}

	private void requirePresent(Path path, List<OperationError> problems) {
		if (!this.fileSystem.exists(path)) {
			problems.add(diverged(path, "Expected path no longer exists: " + path));
		}
	}

	private void requireAbsent(Path path, List<OperationError> problems) {
		if (this.fileSystem.exists(path)) {
			problems.add(diverged(path, "Path has been re-created since: " + path));
		}
	}

	private void requireUntouched(UndoPayload.Created created, List<OperationError> problems) {
		Path path = created.createdPath();
		try {
			if (created.directory() && this.fileSystem.isDirectory(path) && !this.fileSystem.list(path).isEmpty()) {
				problems.add(diverged(path, "Created directory is no longer empty: " + path));
			}
			else if (!created.directory() && this.fileSystem.size(path) > 0) {
				problems.add(diverged(path, "Created file has content now: " + path));
			}
		}
		catch (IOException ex) {
			problems.add(OperationError.from(path, ex));
		}
	}

	private static OperationError diverged(Path path, String message) {
		return new OperationError(ErrorKind.HISTORY_DIVERGED, path, message);
	}

}
