package dev.fileops.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.fileops.engine.clipboard.ClipboardState;
import dev.fileops.engine.event.OperationEvents;
import dev.fileops.engine.fs.FileSystemAccess;
import dev.fileops.engine.fs.NioFileSystemAccess;
import dev.fileops.engine.history.HistoryManager;
import dev.fileops.engine.history.HistorySettings;
import dev.fileops.engine.model.ErrorKind;
import dev.fileops.engine.model.OperationResult;
import dev.fileops.engine.numbering.NumberingService;
import dev.fileops.engine.numbering.NumberingSettings;

class OperationEngineTrashTest {

	@TempDir
	Path root;

	private Path workspace;

	private Path trash;

	@BeforeEach
	void setUp() throws IOException {
		this.workspace = Files.createDirectory(this.root.resolve("workspace"));
		this.trash = this.root.resolve("trash");
	}

	@Test
	void evictedDeletesAreRemovedFromTheTrash() throws IOException {
		HistoryManager history = new HistoryManager(new HistorySettings(1, false, Duration.ofSeconds(1)));
		OperationEngine engine = newEngine(new NioFileSystemAccess(), history);
		Path last = null;
		for (int i = 0; i < 5; i++) {
			last = file("f" + i + ".txt");
			assertTrue(engine.delete(List.of(last)).success());
		}

		assertEquals(1, slots().size());
		assertTrue(engine.undo().success());
		assertEquals("f4.txt", Files.readString(last));
		assertTrue(slots().isEmpty());
	}

	@Test
	void clearingHistoryEmptiesTheTrash() throws IOException {
		HistoryManager history = new HistoryManager(HistorySettings.defaults());
		OperationEngine engine = newEngine(new NioFileSystemAccess(), history);
		engine.delete(List.of(file("a.txt"), file("b.txt")));
		assertEquals(2, slots().size());

		history.clear();

		assertTrue(slots().isEmpty());
	}

	@Test
	void cancelledDeleteLeavesNoSlotsBehind() throws IOException {
		OperationEngine engine = newEngine(new NioFileSystemAccess(), new HistoryManager(HistorySettings.defaults()));
		Path first = file("one.txt");
		Path second = file("two.txt");
		CancellationToken token = CancellationToken.create();

		OperationResult result = engine.delete(List.of(first, second), false, false,
				new OperationContext(token, (current, completed, total) -> token.cancel()));

		assertTrue(result.hasError(ErrorKind.CANCELLED));
		assertTrue(Files.exists(first));
		assertTrue(Files.exists(second));
		assertTrue(slots().isEmpty());
	}

	@Test
	void failedMoveIntoTheTrashLeavesNoSlotBehind() throws IOException {
		Path locked = file("locked.txt");
		FileSystemAccess fileSystem = spy(new NioFileSystemAccess());
		doThrow(new AccessDeniedException(locked.toString())).when(fileSystem).move(eq(locked), any(), any());
		OperationEngine engine = newEngine(fileSystem, new HistoryManager(HistorySettings.defaults()));

		OperationResult result = engine.delete(List.of(locked));

		assertTrue(result.hasError(ErrorKind.PERMISSION_DENIED));
		assertTrue(Files.exists(locked));
		assertTrue(slots().isEmpty());
		assertFalse(engine.canUndo());
	}

	@Test
	void purgeKeepsSlotsHistoryStillNeeds() throws IOException {
		OperationEngine engine = newEngine(new NioFileSystemAccess(), new HistoryManager(HistorySettings.defaults()));
		engine.delete(List.of(file("kept.txt")));
		Path stale = Files.createDirectories(this.trash.resolve(UUID.randomUUID().toString()));
		Files.writeString(stale.resolve("old.txt"), "from an earlier run");
		Path foreign = Files.createDirectories(this.trash.resolve("not-a-slot"));

		int removed = engine.purgeTrash();

		assertEquals(1, removed);
		assertFalse(Files.exists(stale));
		assertTrue(Files.exists(foreign));
		assertTrue(engine.undo().success());
		assertTrue(Files.exists(this.workspace.resolve("kept.txt")));
	}

	private OperationEngine newEngine(FileSystemAccess fileSystem, HistoryManager history) {
		return new OperationEngine(fileSystem, new NumberingService(NumberingSettings.defaults()), history,
				new ClipboardState(), new OperationEvents(), this.trash);
	}

	private Path file(String name) throws IOException {
		return Files.writeString(this.workspace.resolve(name), name);
	}

	private List<Path> slots() throws IOException {
		if (!Files.isDirectory(this.trash)) {
			return List.of();
		}
		try (Stream<Path> entries = Files.list(this.trash)) {
			return entries.collect(Collectors.toList());
		}
	}

}
