package dev.fileops.server.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.fileops.engine.OperationEngine;
import dev.fileops.engine.clipboard.ClipboardState;
import dev.fileops.engine.event.OperationEvents;
import dev.fileops.engine.fs.NioFileSystemAccess;
import dev.fileops.engine.history.HistoryManager;
import dev.fileops.engine.numbering.NumberingService;
import dev.fileops.server.config.FileOpsProperties;

class StatePersistenceTest {

	@TempDir
	Path tempDir;

	@Test
	void numberingAndHistorySurviveARestart() throws IOException {
		Path document = Files.writeString(this.tempDir.resolve("doc.txt"), "d");

		Session first = new Session(properties(null));
		first.persistence.restore();
		first.engine.duplicate(document);
		first.persistence.shutdown();
		assertTrue(Files.exists(this.tempDir.resolve(".fileops-state.json")));

		Session second = new Session(properties(null));
		second.persistence.restore();
		Path next = second.engine.duplicate(document).resultPaths().get(0);

		assertEquals(List.of("Duplicated doc.txt as doc_00001.txt"), second.persistence.previousSession());
		assertEquals("doc_00002.txt", next.getFileName().toString());
	}

	@Test
	void savesAfterEveryCompletedOperation() throws IOException {
		Session session = new Session(properties("state/engine.json"));
		session.persistence.restore();

		session.engine.createDirectory(this.tempDir, "folder");

		Path stateFile = this.tempDir.resolve("state/engine.json");
		assertTrue(Files.readString(stateFile).contains("Created directory folder"));

		session.engine.undo();

		assertFalse(Files.readString(stateFile).contains("Created directory folder"));
	}

	@Test
	void savesAfterAPartlyFailedBatch() throws IOException {
		Session session = new Session(properties("state/engine.json"));
		session.persistence.restore();
		Path present = Files.writeString(this.tempDir.resolve("present.txt"), "p");
		Path target = Files.createDirectory(this.tempDir.resolve("target"));

		boolean success = session.engine.copy(List.of(present, this.tempDir.resolve("missing.txt")), target).success();

		assertFalse(success);
		assertTrue(Files.readString(this.tempDir.resolve("state/engine.json")).contains("Copied present.txt to target"));
	}

	@Test
	void canBeDisabled() {
		Session session = new Session(properties("none"));
		session.persistence.restore();
		session.persistence.save();

		assertFalse(session.persistence.enabled());
		assertTrue(session.persistence.previousSession().isEmpty());
		assertFalse(Files.exists(this.tempDir.resolve(".fileops-state.json")));
	}

	private FileOpsProperties properties(String stateFile) {
		FileOpsProperties properties = new FileOpsProperties();
		properties.setBaseDir(this.tempDir.toString());
		properties.setStateFile(stateFile);
		return properties;
	}

	private static final class Session {

		final OperationEngine engine;

		final StatePersistence persistence;

		Session(FileOpsProperties properties) {
			NumberingService numbering = new NumberingService(properties.getNumbering().toSettings());
			HistoryManager history = new HistoryManager(properties.getHistory().toSettings());
			this.engine = new OperationEngine(new NioFileSystemAccess(), numbering, history, new ClipboardState(),
					new OperationEvents(), properties.determineTrashDir());
			this.persistence = new StatePersistence(properties, this.engine, numbering, history);
		}

	}

}
