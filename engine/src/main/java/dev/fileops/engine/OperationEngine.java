package dev.fileops.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.fileops.engine.clipboard.ClipboardContents;
import dev.fileops.engine.clipboard.ClipboardMode;
import dev.fileops.engine.clipboard.ClipboardState;
import dev.fileops.engine.event.OperationEvents;
import dev.fileops.engine.event.OperationListener;
import dev.fileops.engine.fs.FileSystemAccess;
import dev.fileops.engine.history.HistoryManager;
import dev.fileops.engine.model.ErrorKind;
import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationError;
import dev.fileops.engine.model.OperationKind;
import dev.fileops.engine.model.OperationResult;
import dev.fileops.engine.model.PathMapping;
import dev.fileops.engine.model.UndoPayload;
import dev.fileops.engine.numbering.NumberingService;

/**
 * Single entry point for every filesystem mutation.
 * <p>
 * Each operation validates its inputs, executes against the {@link FileSystemAccess}, builds an
 * undo payload from what actually happened, records the operation in the {@link HistoryManager}
 * when it is undoable and returns an {@link OperationResult}. Expected failures never throw; they
 * are reported as typed {@link OperationError}s. Batch operations continue past per-item
 * failures and record only the items that succeeded.
 * <p>
 * Calls are serialized through one fair lock, so two mutations (or a mutation and an undo) never
 * interleave. Listeners receive a start notification before execution and exactly one completion
 * or failure notification afterwards.
 */
public class OperationEngine {

	private static final Logger logger = LoggerFactory.getLogger(OperationEngine.class);

	private final FileSystemAccess fileSystem;

	private final NumberingService numbering;

	private final HistoryManager history;

	private final ClipboardState clipboard;

	private final OperationEvents events;

	private final HistoryReplayer replayer;

	private final TrashBin trash;

	private final ReentrantLock lock = new ReentrantLock(true);

	private final AtomicInteger running = new AtomicInteger();

	/**
	 * Create an engine over the given collaborators.
	 * @param fileSystem filesystem primitives
	 * @param numbering collision-free name generator
	 * @param history undo/redo stacks
	 * @param clipboard selection buffer consumed by paste
	 * @param events notification channel
	 * @param trashDirectory recoverable location for non-permanent deletes
	 */
	public OperationEngine(FileSystemAccess fileSystem, NumberingService numbering, HistoryManager history,
			ClipboardState clipboard, OperationEvents events, Path trashDirectory) {
		this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
		this.numbering = Objects.requireNonNull(numbering, "numbering");
		this.history = Objects.requireNonNull(history, "history");
		this.clipboard = Objects.requireNonNull(clipboard, "clipboard");
		this.events = Objects.requireNonNull(events, "events");
		this.trash = new TrashBin(fileSystem, normalize(Objects.requireNonNull(trashDirectory, "trashDirectory")));
		this.replayer = new HistoryReplayer(fileSystem, this.trash);
		this.history.onDiscard(this.trash::purge);
	}

	/**
	 * Copy items into a directory. Name collisions at the target are resolved with numbered names.
	 * @param paths items to copy
	 * @param targetDirectory existing destination directory
	 * @return result listing the created paths
	 */
	public OperationResult copy(List<Path> paths, Path targetDirectory) {
		return copy(paths, targetDirectory, OperationContext.none());
	}

	public OperationResult copy(List<Path> paths, Path targetDirectory, OperationContext context) {
		return run(OperationKind.COPY, paths, () -> transfer(OperationKind.COPY, paths, targetDirectory, context));
	}

	/**
	 * Move items into a directory. Name collisions are resolved like {@link #copy}; items that
	 * already live in the target directory are skipped with a warning.
	 * @param paths items to move
	 * @param targetDirectory existing destination directory
	 * @return result listing the new locations
	 */
	public OperationResult move(List<Path> paths, Path targetDirectory) {
		return move(paths, targetDirectory, OperationContext.none());
	}

	public OperationResult move(List<Path> paths, Path targetDirectory, OperationContext context) {
		return run(OperationKind.MOVE, paths, () -> transfer(OperationKind.MOVE, paths, targetDirectory, context));
	}

	/**
	 * Move items to the trash directory. The delete is undoable.
	 * @param paths items to delete
	 * @return result listing the trash locations
	 */
	public OperationResult delete(List<Path> paths) {
		return delete(paths, false, false, OperationContext.none());
	}

	/**
	 * Delete items.
	 * @param paths items to delete
	 * @param permanent {@code true} to delete irreversibly instead of moving to the trash
	 * @param confirmed explicit caller confirmation, required for permanent deletes of a directory
	 * or of more than one item
	 * @param context cancellation and progress hooks
	 * @return result listing the trash locations, or the removed paths for permanent deletes
	 */
	public OperationResult delete(List<Path> paths, boolean permanent, boolean confirmed, OperationContext context) {
		return run(OperationKind.DELETE, paths, () -> remove(paths, permanent, confirmed, context));
	}

	/**
	 * Rename an item within its directory. An existing entry with the new name is reported as
	 * {@link ErrorKind#NAME_CONFLICT}, never overwritten or renumbered.
	 * @param path item to rename
	 * @param newName new file name, without any directory part
	 * @return result holding the renamed path
	 */
	public OperationResult rename(Path path, String newName) {
		return run(OperationKind.RENAME, List.of(path), () -> renameItem(path, newName));
	}

	/**
	 * Copy an item next to itself under the next numbered name.
	 * @param path item to duplicate
	 * @return result holding the duplicate's path
	 */
	public OperationResult duplicate(Path path) {
		return duplicate(path, OperationContext.none());
	}

	public OperationResult duplicate(Path path, OperationContext context) {
		return run(OperationKind.DUPLICATE, List.of(path), () -> duplicateItem(path, context));
	}

	public OperationResult createFile(Path parentDirectory, String name) {
		return run(OperationKind.CREATE_FILE, List.of(parentDirectory),
				() -> create(OperationKind.CREATE_FILE, parentDirectory, name));
	}

	public OperationResult createDirectory(Path parentDirectory, String name) {
		return run(OperationKind.CREATE_DIRECTORY, List.of(parentDirectory),
				() -> create(OperationKind.CREATE_DIRECTORY, parentDirectory, name));
	}

	/**
	 * Put items on the clipboard for a later copy-paste. Paths that do not exist are dropped; when
	 * none exists the clipboard is left untouched and {@link ErrorKind#NOT_FOUND} is reported.
	 * @param paths selected items
	 * @return result listing the paths now on the clipboard
	 */
	public OperationResult copyToClipboard(Collection<Path> paths) {
		return fillClipboard(paths, false);
	}

	/**
	 * Put items on the clipboard for a later cut-paste (move).
	 * @param paths selected items
	 * @return result listing the paths now on the clipboard
	 * @see #copyToClipboard(Collection)
	 */
	public OperationResult cutToClipboard(Collection<Path> paths) {
		return fillClipboard(paths, true);
	}

	public ClipboardContents clipboardContents() {
		return this.clipboard.contents();
	}

	public void clearClipboard() {
		this.lock.lock();
		try {
			this.clipboard.clear();
			this.events.clipboardChanged(ClipboardContents.EMPTY);
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * @param targetDirectory prospective paste destination
	 * @return {@code true} when the clipboard holds items and the target is an existing directory
	 */
	public boolean canPaste(Path targetDirectory) {
		return !this.clipboard.isEmpty() && this.fileSystem.isDirectory(normalize(targetDirectory));
	}

	/**
	 * Paste the clipboard into a directory: a copy for copy mode, a move for cut mode. After a cut
	 * the clipboard keeps only the items that could not be moved.
	 * @param targetDirectory destination directory
	 * @return result of the delegated copy or move, or {@link ErrorKind#EMPTY_CLIPBOARD}
	 */
	public OperationResult paste(Path targetDirectory) {
		return paste(targetDirectory, OperationContext.none());
	}

	public OperationResult paste(Path targetDirectory, OperationContext context) {
		this.lock.lock();
		try {
			ClipboardContents contents = this.clipboard.contents();
			if (contents.isEmpty()) {
				return OperationResult.failure(ErrorKind.EMPTY_CLIPBOARD, null, "Clipboard is empty");
			}
			List<Path> paths = new ArrayList<>(contents.paths());
			if (contents.mode() == ClipboardMode.COPY) {
				return copy(paths, targetDirectory, context);
			}
			OperationResult result = move(paths, targetDirectory, context);
			if (!result.hasError(ErrorKind.CANCELLED)) {
				Set<Path> remaining = new LinkedHashSet<>(paths);
				if (result.operation() != null) {
					remaining.removeAll(result.operation().sourcePaths());
				}
				if (result.success() || remaining.isEmpty()) {
					this.clipboard.clear();
				}
				else {
					this.clipboard.set(remaining, true);
				}
				this.events.clipboardChanged(this.clipboard.contents());
			}
			return result;
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * Reverse the most recent operation. An entry whose recorded state no longer matches the
	 * filesystem is dropped and reported as {@link ErrorKind#HISTORY_DIVERGED}. When a step fails
	 * midway, the steps already taken are put back and the entry stays on the undo stack; paths
	 * that could not be put back are listed in the result.
	 * @return result of the reversal, or {@link ErrorKind#NOTHING_TO_UNDO}
	 */
	public OperationResult undo() {
		this.lock.lock();
		this.running.incrementAndGet();
		try {
			Optional<Operation> top = this.history.peekUndo();
			if (top.isEmpty()) {
				return OperationResult.failure(ErrorKind.NOTHING_TO_UNDO, null, "Nothing to undo");
			}
			Operation operation = top.get();
			List<OperationError> problems = this.replayer.divergence(operation, HistoryReplayer.Direction.UNDO);
			if (!problems.isEmpty()) {
				this.history.dropUndo(operation);
				logger.warn("Cannot undo '{}', dropping it from history: {}", operation.description(),
						problems.get(0).message());
				return OperationResult.of(List.of(), problems, List.of(), operation);
			}
			HistoryReplayer.Replay replay = this.replayer.apply(operation, HistoryReplayer.Direction.UNDO);
			if (!replay.succeeded()) {
				logger.warn("Undo of '{}' failed, keeping it in history: {}", operation.description(),
						replay.errors().get(0).message());
				return failedReplay(replay, operation);
			}
			this.history.undo();
			this.events.undone(operation);
			logger.info("Undid: {}", operation.description());
			return OperationResult.of(affectedByUndo(operation), List.of(), List.of(), operation);
		}
		finally {
			this.running.decrementAndGet();
			this.lock.unlock();
		}
	}

	/**
	 * Re-apply the most recently undone operation.
	 * @return result of the re-application, or {@link ErrorKind#NOTHING_TO_REDO}
	 * @see #undo()
	 */
	public OperationResult redo() {
		this.lock.lock();
		this.running.incrementAndGet();
		try {
			Optional<Operation> top = this.history.peekRedo();
			if (top.isEmpty()) {
				return OperationResult.failure(ErrorKind.NOTHING_TO_REDO, null, "Nothing to redo");
			}
			Operation operation = top.get();
			List<OperationError> problems = this.replayer.divergence(operation, HistoryReplayer.Direction.REDO);
			if (!problems.isEmpty()) {
				this.history.dropRedo(operation);
				logger.warn("Cannot redo '{}', dropping it from history: {}", operation.description(),
						problems.get(0).message());
				return OperationResult.of(List.of(), problems, List.of(), operation);
			}
			HistoryReplayer.Replay replay = this.replayer.apply(operation, HistoryReplayer.Direction.REDO);
			if (!replay.succeeded()) {
				logger.warn("Redo of '{}' failed, keeping it in history: {}", operation.description(),
						replay.errors().get(0).message());
				return failedReplay(replay, operation);
			}
			this.history.redo();
			this.events.redone(operation);
			logger.info("Redid: {}", operation.description());
			return OperationResult.of(affectedByRedo(operation), List.of(), List.of(), operation);
		}
		finally {
			this.running.decrementAndGet();
			this.lock.unlock();
		}
	}

	public Optional<Operation> peekUndo() {
		return this.history.peekUndo();
	}

	public Optional<Operation> peekRedo() {
		return this.history.peekRedo();
	}

	public boolean canUndo() {
		return this.history.canUndo();
	}

	public boolean canRedo() {
		return this.history.canRedo();
	}

	public List<Operation> undoHistory() {
		return this.history.undoHistory();
	}

	public List<Operation> redoHistory() {
		return this.history.redoHistory();
	}

	public Runnable subscribe(OperationListener listener) {
		return this.events.subscribe(listener);
	}

	public boolean unsubscribe(OperationListener listener) {
		return this.events.unsubscribe(listener);
	}

	/**
	 * @return {@code true} while a mutation, undo or redo is executing
	 */
	public boolean isOperationInProgress() {
		return this.running.get() > 0;
	}

	public FileSystemAccess fileSystem() {
		return this.fileSystem;
	}

	public Path trashDirectory() {
		return this.trash.directory();
	}

	/**
	 * Remove trash slots that no history entry can restore any more, such as those left behind
	 * by a previous session.
	 * @return number of slots removed
	 */
	public int purgeTrash() {
		this.lock.lock();
		try {
			List<Operation> recorded = new ArrayList<>(this.history.undoHistory());
			recorded.addAll(this.history.redoHistory());
			return this.trash.purgeUnreferenced(recorded);
		}
		finally {
			this.lock.unlock();
		}
	}

	private OperationResult run(OperationKind kind, List<Path> sources, Supplier<OperationResult> body) {
		this.lock.lock();
		this.running.incrementAndGet();
		try {
			this.events.started(kind, sources);
			OperationResult result = body.get();
			Operation operation = result.operation();
			if (operation != null) {
				this.history.record(operation);
			}
			if (result.success()) {
				this.events.completed(kind, sources, operation != null ? operation.targetPath() : null);
				logger.info(result.summaryLine());
			}
			else {
				this.events.failed(kind, sources, result.errors().get(0));
				logger.warn("{} finished with {} error(s): {}", kind.id(), result.errors().size(), result.summaryLine());
			}
			return result;
		}
		finally {
			this.running.decrementAndGet();
			this.lock.unlock();
		}
	}

	private OperationResult transfer(OperationKind kind, List<Path> paths, Path targetDirectory,
			OperationContext context) {
		Path target = normalize(targetDirectory);
		OperationResult invalid = checkDirectory(target);
		if (invalid != null) {
			return invalid;
		}
		List<Path> sources = normalizeAll(paths);
		List<PathMapping> completed = new ArrayList<>();
		List<OperationError> errors = new ArrayList<>();
		List<String> warnings = new ArrayList<>();
		int processed = 0;
		for (Path source : sources) {
			if (context.cancellation().isCancelled()) {
				return cancelled(kind, completed, errors);
			}
			processed++;
			if (!this.fileSystem.exists(source)) {
				errors.add(new OperationError(ErrorKind.NOT_FOUND, source, "Source does not exist: " + source));
				continue;
			}
			if (source.getFileName() == null || target.startsWith(source)) {
				errors.add(new OperationError(ErrorKind.INVALID_TARGET, source,
						"Cannot %s %s into itself or its own subtree".formatted(kind.id(), source)));
				continue;
			}
			if (kind == OperationKind.MOVE && target.equals(source.getParent())) {
				warnings.add("%s is already in %s".formatted(source.getFileName(), target));
				continue;
			}
			Path destination = freeName(target.resolve(source.getFileName().toString()));
			try {
				if (kind == OperationKind.COPY) {
					this.fileSystem.copy(source, destination, context.cancellation());
				}
				else {
					this.fileSystem.move(source, destination, context.cancellation());
				}
				completed.add(new PathMapping(source, destination));
				logger.debug("{} {} -> {}", kind.verb(), source, destination);
			}
			catch (OperationCancelledException ex) {
				if (kind == OperationKind.COPY) {
					discard(destination, errors);
				}
				return cancelled(kind, completed, errors);
			}
			catch (IOException ex) {
				logger.warn("Failed to {} {} to {}", kind.id(), source, destination, ex);
				errors.add(OperationError.from(source, ex));
			}
			context.progress().onProgress(source, processed, sources.size());
		}
		Operation operation = completed.isEmpty() ? null
				: Operation.of(kind, sourcesOf(completed), target, new UndoPayload.Transfers(completed));
		return OperationResult.of(destinationsOf(completed), errors, warnings, operation);
	}

	private OperationResult remove(List<Path> paths, boolean permanent, boolean confirmed, OperationContext context) {
		List<Path> sources = normalizeAll(paths);
		if (permanent && !confirmed
				&& (sources.size() > 1 || sources.stream().anyMatch(this.fileSystem::isDirectory))) {
			return OperationResult.failure(ErrorKind.CONFIRMATION_REQUIRED, sources.isEmpty() ? null : sources.get(0),
					"Permanent deletion of %s requires explicit confirmation".formatted(
							sources.size() == 1 ? "a directory" : sources.size() + " items"));
		}
		List<PathMapping> trashed = new ArrayList<>();
		List<Path> deleted = new ArrayList<>();
		List<OperationError> errors = new ArrayList<>();
		int processed = 0;
		for (Path source : sources) {
			if (context.cancellation().isCancelled()) {
				return permanent ? partialPermanentDelete(deleted, errors) : cancelled(OperationKind.DELETE, trashed,
						errors);
			}
			processed++;
			if (!this.fileSystem.exists(source)) {
				errors.add(new OperationError(ErrorKind.NOT_FOUND, source, "Path does not exist: " + source));
				continue;
			}
			if (source.getFileName() == null || this.trash.directory().startsWith(source)) {
				errors.add(new OperationError(ErrorKind.INVALID_TARGET, source, "Refusing to delete " + source));
				continue;
			}
			try {
				if (permanent) {
					this.fileSystem.deleteRecursively(source);
					deleted.add(source);
				}
				else {
					Path destination = this.trash.allocate(source);
					try {
						this.fileSystem.move(source, destination, context.cancellation());
					}
					catch (IOException ex) {
						this.trash.release(destination);
						throw ex;
					}
					trashed.add(new PathMapping(source, destination));
				}
				logger.debug("Deleted {}{}", source, permanent ? " permanently" : "");
			}
			catch (OperationCancelledException ex) {
				return cancelled(OperationKind.DELETE, trashed, errors);
			}
			catch (IOException ex) {
				logger.warn("Failed to delete {}", source, ex);
				errors.add(OperationError.from(source, ex));
			}
			context.progress().onProgress(source, processed, sources.size());
		}
		if (permanent) {
			Operation operation = deleted.isEmpty() ? null : Operation.of(OperationKind.DELETE, deleted, null, null);
			return OperationResult.of(deleted, errors, List.of(), operation);
		}
		Operation operation = trashed.isEmpty() ? null
				: Operation.of(OperationKind.DELETE, sourcesOf(trashed), null, new UndoPayload.Transfers(trashed));
		return OperationResult.of(destinationsOf(trashed), errors, List.of(), operation);
	}

	private OperationResult renameItem(Path path, String newName) {
		Path source = normalize(path);
		OperationResult invalid = checkName(newName, source);
		if (invalid != null) {
			return invalid;
		}
		if (!this.fileSystem.exists(source)) {
			return OperationResult.failure(ErrorKind.NOT_FOUND, source, "Path does not exist: " + source);
		}
		Path parent = source.getParent();
		if (parent == null) {
			return OperationResult.failure(ErrorKind.INVALID_TARGET, source, "Cannot rename a filesystem root");
		}
		Path target = parent.resolve(newName);
		if (target.equals(source)) {
			return OperationResult.noOp("%s already has that name".formatted(source.getFileName()));
		}
		if (this.fileSystem.exists(target)) {
			return OperationResult.failure(ErrorKind.NAME_CONFLICT, target,
					"An entry named %s already exists".formatted(newName));
		}
		try {
			this.fileSystem.rename(source, target);
		}
		catch (IOException ex) {
			logger.warn("Failed to rename {} to {}", source, newName, ex);
			return OperationResult.failure(OperationError.from(source, ex));
		}
		Operation operation = Operation.of(OperationKind.RENAME, List.of(source), target,
				new UndoPayload.Renamed(source, target));
		return OperationResult.of(List.of(target), List.of(), List.of(), operation);
	}

	private OperationResult duplicateItem(Path path, OperationContext context) {
		Path source = normalize(path);
		if (!this.fileSystem.exists(source)) {
			return OperationResult.failure(ErrorKind.NOT_FOUND, source, "Path does not exist: " + source);
		}
		if (source.getParent() == null) {
			return OperationResult.failure(ErrorKind.INVALID_TARGET, source, "Cannot duplicate a filesystem root");
		}
		Path destination = this.numbering.generateNumberedName(source);
		try {
			this.fileSystem.copy(source, destination, context.cancellation());
		}
		catch (OperationCancelledException ex) {
			List<OperationError> errors = new ArrayList<>();
			discard(destination, errors);
			return cancelled(OperationKind.DUPLICATE, List.of(), errors);
		}
		catch (IOException ex) {
			logger.warn("Failed to duplicate {}", source, ex);
			return OperationResult.failure(OperationError.from(source, ex));
		}
		context.progress().onProgress(source, 1, 1);
		Operation operation = Operation.of(OperationKind.DUPLICATE, List.of(source), destination,
				new UndoPayload.Transfers(List.of(new PathMapping(source, destination))));
		return OperationResult.of(List.of(destination), List.of(), List.of(), operation);
	}

	private OperationResult create(OperationKind kind, Path parentDirectory, String name) {
		Path parent = normalize(parentDirectory);
		OperationResult invalid = checkDirectory(parent);
		if (invalid == null) {
			invalid = checkName(name, parent);
		}
		if (invalid != null) {
			return invalid;
		}
		Path created = parent.resolve(name);
		if (this.fileSystem.exists(created)) {
			return OperationResult.failure(ErrorKind.NAME_CONFLICT, created,
					"An entry named %s already exists".formatted(name));
		}
		boolean directory = kind == OperationKind.CREATE_DIRECTORY;
		try {
			if (directory) {
				this.fileSystem.createDirectory(created);
			}
			else {
				this.fileSystem.createFile(created);
			}
		}
		catch (IOException ex) {
			logger.warn("Failed to create {}", created, ex);
			return OperationResult.failure(OperationError.from(created, ex));
		}
		Operation operation = Operation.of(kind, List.of(parent), created, new UndoPayload.Created(created, directory));
		return OperationResult.of(List.of(created), List.of(), List.of(), operation);
	}

	private OperationResult fillClipboard(Collection<Path> paths, boolean cut) {
		this.lock.lock();
		try {
			List<Path> existing = new ArrayList<>();
			List<String> warnings = new ArrayList<>();
			for (Path path : normalizeAll(paths)) {
				if (this.fileSystem.exists(path)) {
					existing.add(path);
				}
				else {
					warnings.add("Skipped missing path " + path);
				}
			}
			if (existing.isEmpty()) {
				return OperationResult.failure(ErrorKind.NOT_FOUND, null, "None of the selected paths exist");
			}
			this.clipboard.set(existing, cut);
			ClipboardContents contents = this.clipboard.contents();
			this.events.clipboardChanged(contents);
			logger.debug("{} {} item(s) to the clipboard", cut ? "Cut" : "Copied", existing.size());
			return OperationResult.of(new ArrayList<>(contents.paths()), List.of(), warnings, null);
		}
		finally {
			this.lock.unlock();
		}
	}

	private static OperationResult failedReplay(HistoryReplayer.Replay replay, Operation operation) {
		String warning = replay.stranded().isEmpty() ? "No changes were kept"
				: "%d item(s) could not be put back".formatted(replay.stranded().size());
		return OperationResult.of(replay.stranded(), replay.errors(), List.of(warning), operation);
	}

	/**
	 * Roll back what a cancelled transfer or trash-delete already did and report the cancellation.
	 */
	private OperationResult cancelled(OperationKind kind, List<PathMapping> completed, List<OperationError> errors) {
		List<OperationError> collected = new ArrayList<>(errors);
		for (int i = completed.size() - 1; i >= 0; i--) {
			PathMapping entry = completed.get(i);
			try {
				if (kind == OperationKind.COPY || kind == OperationKind.DUPLICATE) {
					this.fileSystem.deleteRecursively(entry.destination());
				}
				else {
					this.fileSystem.move(entry.destination(), entry.source(), CancellationToken.none());
					if (kind == OperationKind.DELETE) {
						this.trash.release(entry.destination());
					}
				}
			}
			catch (IOException ex) {
				logger.error("Rollback of {} {} failed", kind.id(), entry.source(), ex);
				collected.add(OperationError.from(entry.destination(), ex));
			}
		}
		logger.info("{} cancelled, rolled back {} item(s)", kind.id(), completed.size());
		collected.add(0, new OperationError(ErrorKind.CANCELLED, null,
				"Operation cancelled, %d completed item(s) rolled back".formatted(completed.size())));
		return OperationResult.of(List.of(), collected, List.of(), null);
	}

	private OperationResult partialPermanentDelete(List<Path> deleted, List<OperationError> errors) {
		List<OperationError> collected = new ArrayList<>(errors);
		collected.add(0, new OperationError(ErrorKind.CANCELLED, null,
				"Operation cancelled after permanently deleting %d item(s)".formatted(deleted.size())));
		Operation operation = deleted.isEmpty() ? null : Operation.of(OperationKind.DELETE, deleted, null, null);
		return OperationResult.of(deleted, collected, List.of(), operation);
	}

	private void discard(Path partial, List<OperationError> errors) {
		if (!this.fileSystem.exists(partial)) {
			return;
		}
		try {
			this.fileSystem.deleteRecursively(partial);
		}
		catch (IOException ex) {
			logger.error("Could not remove partial copy {}", partial, ex);
			errors.add(OperationError.from(partial, ex));
		}
	}

	private Path freeName(Path candidate) {
		return this.fileSystem.exists(candidate) ? this.numbering.generateNumberedName(candidate) : candidate;
	}

	private OperationResult checkDirectory(Path directory) {
		if (!this.fileSystem.exists(directory)) {
			return OperationResult.failure(ErrorKind.NOT_FOUND, directory, "Directory does not exist: " + directory);
		}
		if (!this.fileSystem.isDirectory(directory)) {
			return OperationResult.failure(ErrorKind.INVALID_TARGET, directory, "Not a directory: " + directory);
		}
		return null;
	}

	private static OperationResult checkName(String name, Path context) {
		if (name == null || name.isBlank() || name.equals(".") || name.equals("..") || name.contains("/")
				|| name.contains("\\") || name.indexOf('\0') >= 0) {
			return OperationResult.failure(ErrorKind.INVALID_TARGET, context, "Invalid name: " + name);
		}
		return null;
	}

	private static List<Path> affectedByUndo(Operation operation) {
		UndoPayload payload = operation.undoPayload();
		if (payload instanceof UndoPayload.Transfers transfers) {
			return operation.kind() == OperationKind.COPY || operation.kind() == OperationKind.DUPLICATE
					? destinationsOf(transfers.entries()) : sourcesOf(transfers.entries());
		}
		if (payload instanceof UndoPayload.Renamed renamed) {
			return List.of(renamed.originalPath());
		}
		return List.of(((UndoPayload.Created) payload).createdPath());
	}

	private static List<Path> affectedByRedo(Operation operation) {
		UndoPayload payload = operation.undoPayload();
		if (payload instanceof UndoPayload.Transfers transfers) {
			return destinationsOf(transfers.entries());
		}
		if (payload instanceof UndoPayload.Renamed renamed) {
			return List.of(renamed.renamedPath());
		}
		return List.of(((UndoPayload.Created) payload).createdPath());
	}

	private static List<Path> sourcesOf(List<PathMapping> mappings) {
		return mappings.stream().map(PathMapping::source).collect(Collectors.toList());
	}

	private static List<Path> destinationsOf(List<PathMapping> mappings) {
		return mappings.stream().map(PathMapping::destination).collect(Collectors.toList());
	}

	private static List<Path> normalizeAll(Collection<Path> paths) {
		return paths.stream().map(OperationEngine::normalize).distinct().collect(Collectors.toList());
	}

	private static Path normalize(Path path) {
		return path.toAbsolutePath().normalize();
	}

}
