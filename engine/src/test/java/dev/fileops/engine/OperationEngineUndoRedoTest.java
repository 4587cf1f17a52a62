package dev.fileops.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.fileops.engine.clipboard.ClipboardState;
import dev.fileops.engine.event.OperationEvents;
import dev.fileops.engine.event.OperationListener;
import dev.fileops.engine.fs.FileSystemAccess;
import dev.fileops.engine.fs.NioFileSystemAccess;
import dev.fileops.engine.history.HistoryManager;
import dev.fileops.engine.history.HistorySettings;
import dev.fileops.engine.model.ErrorKind;
import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationResult;
import dev.fileops.engine.numbering.NumberingService;
import dev.fileops.engine.numbering.NumberingSettings;

class OperationEngineUndoRedoTest {

	@TempDir
	Path root;

	private Path workspace;

	private Path trash;

	private OperationEngine engine;

	@BeforeEach
	void setUp() throws IOException {
		this.workspace = Files.createDirectory(this.root.resolve("workspace"));
		this.trash = this.root.resolve("trash");
		this.engine = new OperationEngine(new NioFileSystemAccess(), new NumberingService(NumberingSettings.defaults()),
				new HistoryManager(HistorySettings.defaults()), new ClipboardState(), new OperationEvents(), this.trash);
	}

	@Test
	void undoRemovesCopiesAndRedoRestoresThem() throws IOException {
		Path source = file("a.txt", "a");
		Path target = dir("target");
		this.engine.copy(List.of(source), target);

		OperationResult undone = this.engine.undo();

		assertTrue(undone.success());
		assertEquals(List.of(target.resolve("a.txt")), undone.resultPaths());
		assertFalse(Files.exists(target.resolve("a.txt")));
		assertTrue(Files.exists(source));
		assertTrue(this.engine.canRedo());

		OperationResult redone = this.engine.redo();

		assertTrue(redone.success());
		assertEquals("a", Files.readString(target.resolve("a.txt")));
		assertTrue(this.engine.canUndo());
		assertFalse(this.engine.canRedo());
	}

	@Test
	void undoMovesItemsBackInReverseOrder() throws IOException {
		Path first = file("src/one.txt", "1");
		Path second = file("src/two.txt", "2");
		Path target = dir("target");
		this.engine.move(List.of(first, second), target);

		assertTrue(this.engine.undo().success());

		assertEquals("1", Files.readString(first));
		assertEquals("2", Files.readString(second));
		assertTrue(isEmpty(target));
	}

	@Test
	void undoRestoresTrashedItemsAndClearsTheSlot() throws IOException {
		Path doomed = file("nested/doomed.txt", "keep me");
		OperationResult deleted = this.engine.delete(List.of(doomed));
		Path slot = deleted.resultPaths().get(0).getParent();

		assertTrue(this.engine.undo().success());

		assertEquals("keep me", Files.readString(doomed));
		assertFalse(Files.exists(slot));

		assertTrue(this.engine.redo().success());
		assertFalse(Files.exists(doomed));
	}

	@Test
	void undoRestoresTheExactOriginalName() throws IOException {
		Path original = file("draft.txt", "d");
		this.engine.rename(original, "final.txt");

		assertTrue(this.engine.undo().success());
		assertEquals("d", Files.readString(original));
		assertFalse(Files.exists(this.workspace.resolve("final.txt")));

		assertTrue(this.engine.redo().success());
		assertFalse(Files.exists(original));
		assertEquals("d", Files.readString(this.workspace.resolve("final.txt")));
	}

	@Test
	void undoRemovesCreatedEntries() throws IOException {
		this.engine.createFile(this.workspace, "empty.txt");
		this.engine.createDirectory(this.workspace, "folder");

		assertTrue(this.engine.undo().success());
		assertFalse(Files.exists(this.workspace.resolve("folder")));
		assertTrue(this.engine.undo().success());
		assertFalse(Files.exists(this.workspace.resolve("empty.txt")));

		assertTrue(this.engine.redo().success());
		assertTrue(Files.isRegularFile(this.workspace.resolve("empty.txt")));
	}

	@Test
	void undoRemovesTheDuplicate() throws IOException {
		Path document = file("document.txt", "content");
		Path copy = this.engine.duplicate(document).resultPaths().get(0);

		assertTrue(this.engine.undo().success());

		assertFalse(Files.exists(copy));
		assertTrue(Files.exists(document));
	}

	@Test
	void secondUndoOfASingleOperationHasNothingToUndo() throws IOException {
		Path source = file("a.txt", "a");
		Path target = dir("target");
		this.engine.copy(List.of(source), target);
		this.engine.undo();

		OperationResult second = this.engine.undo();

		assertTrue(second.hasError(ErrorKind.NOTHING_TO_UNDO));
		assertTrue(Files.exists(source));
		assertTrue(isEmpty(target));
	}

	@Test
	void redoWithoutUndoHasNothingToRedo() {
		assertTrue(this.engine.redo().hasError(ErrorKind.NOTHING_TO_REDO));
	}

	@Test
	void newOperationDiscardsRedo() throws IOException {
		Path a = file("a.txt", "a");
		this.engine.rename(a, "b.txt");
		this.engine.undo();

		this.engine.createDirectory(this.workspace, "other");

		assertFalse(this.engine.canRedo());
	}

	@Test
	void divergedEntryIsDroppedWithoutTouchingAnything() throws IOException {
		Path first = file("first.txt", "1");
		this.engine.rename(first, "renamed.txt");
		Path source = file("a.txt", "a");
		Path target = dir("target");
		this.engine.copy(List.of(source), target);
		Files.delete(target.resolve("a.txt"));
		Operation diverged = this.engine.peekUndo().orElseThrow();

		OperationResult result = this.engine.undo();

		assertTrue(result.hasError(ErrorKind.HISTORY_DIVERGED));
		assertEquals(diverged, result.operation());
		assertFalse(this.engine.canRedo());
		assertTrue(Files.exists(source));
		assertEquals(1, this.engine.undoHistory().size());

		assertTrue(this.engine.undo().success());
		assertTrue(Files.exists(first));
	}

	@Test
	void undoRefusesToRemoveAFileThatGainedContent() throws IOException {
		this.engine.createFile(this.workspace, "notes.txt");
		Files.writeString(this.workspace.resolve("notes.txt"), "written later");

		OperationResult result = this.engine.undo();

		assertTrue(result.hasError(ErrorKind.HISTORY_DIVERGED));
		assertEquals("written later", Files.readString(this.workspace.resolve("notes.txt")));
		assertFalse(this.engine.canUndo());
	}

	@Test
	void redoDivergesWhenTheDestinationWasRecreated() throws IOException {
		Path original = file("draft.txt", "d");
		this.engine.rename(original, "final.txt");
		this.engine.undo();
		file("final.txt", "someone else");

		OperationResult result = this.engine.redo();

		assertTrue(result.hasError(ErrorKind.HISTORY_DIVERGED));
		assertEquals("someone else", Files.readString(this.workspace.resolve("final.txt")));
		assertEquals("d", Files.readString(original));
		assertFalse(this.engine.canRedo());
	}

	@Test
	void notifiesListenersOfUndoAndRedo() throws IOException {
		OperationListener listener = mock(OperationListener.class);
		this.engine.subscribe(listener);
		this.engine.createDirectory(this.workspace, "folder");
		Operation created = this.engine.peekUndo().orElseThrow();

		this.engine.undo();
		this.engine.redo();

		verify(listener).operationUndone(created);
		verify(listener).operationRedone(created);
	}

	@Test
	void failedUndoPutsBackWhatItReversedAndKeepsTheEntry() throws IOException {
		Path first = file("src/a.txt", "a");
		Path second = file("src/b.txt", "b");
		Path target = dir("dst");
		FileSystemAccess fileSystem = spy(new NioFileSystemAccess());
		OperationEngine engine = newEngine(fileSystem, HistorySettings.defaults());
		engine.move(List.of(first, second), target);
		doThrow(new AccessDeniedException(first.toString())).when(fileSystem)
			.move(eq(target.resolve("a.txt")), eq(first), any());

		OperationResult result = engine.undo();

		assertTrue(result.hasError(ErrorKind.PERMISSION_DENIED));
		assertEquals(List.of("No changes were kept"), result.warnings());
		assertTrue(result.resultPaths().isEmpty());
		assertEquals("a", Files.readString(target.resolve("a.txt")));
		assertEquals("b", Files.readString(target.resolve("b.txt")));
		assertFalse(Files.exists(second));
		assertTrue(engine.canUndo());
		assertFalse(engine.canRedo());

		doCallRealMethod().when(fileSystem).move(eq(target.resolve("a.txt")), eq(first), any());

		assertTrue(engine.undo().success());
		assertEquals("a", Files.readString(first));
		assertEquals("b", Files.readString(second));
	}

	@Test
	void failedUndoReportsItemsThatCouldNotBePutBack() throws IOException {
		Path first = file("src/a.txt", "a");
		Path second = file("src/b.txt", "b");
		Path target = dir("dst");
		FileSystemAccess fileSystem = spy(new NioFileSystemAccess());
		OperationEngine engine = newEngine(fileSystem, HistorySettings.defaults());
		engine.move(List.of(first, second), target);
		doThrow(new AccessDeniedException(first.toString())).when(fileSystem)
			.move(eq(target.resolve("a.txt")), eq(first), any());
		doThrow(new AccessDeniedException(second.toString())).when(fileSystem)
			.move(eq(second), eq(target.resolve("b.txt")), any());

		OperationResult result = engine.undo();

		assertFalse(result.success());
		assertEquals(2, result.errors().size());
		assertEquals(List.of(second), result.resultPaths());
		assertEquals(List.of("1 item(s) could not be put back"), result.warnings());
		assertTrue(engine.canUndo());

		assertTrue(engine.undo().hasError(ErrorKind.HISTORY_DIVERGED));
		assertFalse(engine.canUndo());
	}

	@Test
	void failedRedoRemovesWhatItReappliedAndKeepsTheEntry() throws IOException {
		Path first = file("a.txt", "a");
		Path second = file("b.txt", "b");
		Path target = dir("target");
		FileSystemAccess fileSystem = spy(new NioFileSystemAccess());
		OperationEngine engine = newEngine(fileSystem, HistorySettings.defaults());
		engine.copy(List.of(first, second), target);
		engine.undo();
		doThrow(new AccessDeniedException(second.toString())).when(fileSystem)
			.copy(eq(second), eq(target.resolve("b.txt")), any());

		OperationResult result = engine.redo();

		assertTrue(result.hasError(ErrorKind.PERMISSION_DENIED));
		assertTrue(isEmpty(target));
		assertTrue(engine.canRedo());
		assertFalse(engine.canUndo());
	}

	@Test
	void undoOfMergedRenamesRestoresTheFirstName() throws IOException {
		OperationEngine engine = newEngine(new NioFileSystemAccess(), merging());
		Path original = file("a.txt", "a");
		engine.rename(original, "b.txt");
		engine.rename(this.workspace.resolve("b.txt"), "c.txt");

		assertEquals(1, engine.undoHistory().size());
		assertTrue(engine.undo().success());

		assertEquals("a", Files.readString(original));
		assertFalse(Files.exists(this.workspace.resolve("b.txt")));
		assertFalse(Files.exists(this.workspace.resolve("c.txt")));

		assertTrue(engine.redo().success());
		assertFalse(Files.exists(original));
		assertEquals("a", Files.readString(this.workspace.resolve("c.txt")));
	}

	@Test
	void undoOfMergedMovesReturnsTheItemToItsOrigin() throws IOException {
		OperationEngine engine = newEngine(new NioFileSystemAccess(), merging());
		Path item = file("d1/x.txt", "x");
		Path d2 = dir("d2");
		Path d3 = dir("d3");
		engine.move(List.of(item), d2);
		engine.move(List.of(d2.resolve("x.txt")), d3);

		assertEquals(1, engine.undoHistory().size());
		assertTrue(engine.undo().success());

		assertEquals("x", Files.readString(item));
		assertTrue(isEmpty(d2));
		assertTrue(isEmpty(d3));
	}

	@Test
	void renamesThatReturnToTheStartLeaveNothingToUndo() throws IOException {
		OperationEngine engine = newEngine(new NioFileSystemAccess(), merging());
		Path original = file("a.txt", "a");
		engine.rename(original, "b.txt");
		engine.rename(this.workspace.resolve("b.txt"), "a.txt");

		assertFalse(engine.canUndo());
		assertTrue(engine.undo().hasError(ErrorKind.NOTHING_TO_UNDO));
		assertEquals("a", Files.readString(original));
	}

	private OperationEngine newEngine(FileSystemAccess fileSystem, HistorySettings settings) {
		return new OperationEngine(fileSystem, new NumberingService(NumberingSettings.defaults()),
				new HistoryManager(settings), new ClipboardState(), new OperationEvents(), this.trash);
	}

	private static HistorySettings merging() {
		return new HistorySettings(100, true, Duration.ofMinutes(1));
	}

	private Path file(String relative, String content) throws IOException {
		Path path = this.workspace.resolve(relative);
		Files.createDirectories(path.getParent());
		return Files.writeString(path, content);
	}

	private Path dir(String relative) throws IOException {
		return Files.createDirectories(this.workspace.resolve(relative));
	}

	private static boolean isEmpty(Path directory) throws IOException {
		try (Stream<Path> entries = Files.list(directory)) {
			return entries.findAny().isEmpty();
		}
	}

}
