package dev.fileops.server.tool;

import static dev.fileops.server.tool.ToolFixture.call;
import static dev.fileops.server.tool.ToolFixture.isError;
import static dev.fileops.server.tool.ToolFixture.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.fileops.engine.clipboard.ClipboardMode;
import io.modelcontextprotocol.spec.McpSchema;

class ClipboardAndHistoryToolTest {

	@TempDir
	Path tempDir;

	private ToolFixture fixture;

	private ClipboardTool clipboard;

	private HistoryTool history;

	@BeforeEach
	void setUp() {
		this.fixture = new ToolFixture(this.tempDir);
		this.clipboard = this.fixture.clipboardTool();
		this.history = this.fixture.historyTool();
	}

	@Test
	void registersClipboardAndHistoryTools() {
		assertEquals(List.of("clipboard_copy", "clipboard_cut", "paste_items"), ToolFixture.names(this.clipboard.tools()));
		assertEquals(List.of("undo", "redo"), ToolFixture.names(this.history.tools()));
	}

	@Test
	void copyPasteUndoRedo() throws IOException {
		this.fixture.file("note.txt", "n");
		this.fixture.file("target/note.txt", "existing");

		McpSchema.CallToolResult selected = call(this.clipboard.clipboardCopyTool(), Map.of("paths", List.of("note.txt")));
		McpSchema.CallToolResult pasted = call(this.clipboard.pasteItemsTool(), Map.of("target", "target"));
		Path pastedCopy = this.fixture.root.resolve("target/note_00001.txt");

		assertEquals("Copied 1 item(s) to the clipboard", text(selected));
		assertFalse(isError(pasted));
		assertTrue(Files.exists(pastedCopy));

		McpSchema.CallToolResult undone = call(this.history.undoTool(), Map.of());

		assertEquals("Undid: Copied note.txt to target", text(undone));
		assertFalse(Files.exists(pastedCopy));

		McpSchema.CallToolResult redone = call(this.history.redoTool(), Map.of());

		assertEquals("Redid: Copied note.txt to target", text(redone));
		assertTrue(Files.exists(pastedCopy));
	}

	@Test
	void cutPasteClearsTheClipboard() throws IOException {
		this.fixture.file("note.txt", "n");
		this.fixture.dir("target");

		call(this.clipboard.clipboardCutTool(), Map.of("paths", List.of("note.txt")));
		McpSchema.CallToolResult pasted = call(this.clipboard.pasteItemsTool(), Map.of("target", "target"));

		assertFalse(isError(pasted));
		assertTrue(Files.exists(this.fixture.root.resolve("target/note.txt")));
		assertEquals(ClipboardMode.EMPTY, this.fixture.engine.clipboardContents().mode());
	}

	@Test
	void pastingAnEmptyClipboardIsAnError() throws IOException {
		this.fixture.dir("target");

		McpSchema.CallToolResult result = call(this.clipboard.pasteItemsTool(), Map.of("target", "target"));

		assertTrue(isError(result));
		assertEquals("Failed: Clipboard is empty", text(result));
	}

	@Test
	void selectingOnlyMissingPathsIsAnError() {
		McpSchema.CallToolResult result = call(this.clipboard.clipboardCutTool(), Map.of("paths", List.of("ghost.txt")));

		assertTrue(isError(result));
		assertTrue(this.fixture.engine.clipboardContents().isEmpty());
	}

	@Test
	void undoWithEmptyHistoryIsAnError() {
		McpSchema.CallToolResult undo = call(this.history.undoTool(), Map.of());
		McpSchema.CallToolResult redo = call(this.history.redoTool(), Map.of());

		assertTrue(isError(undo));
		assertEquals("Failed: Nothing to undo", text(undo));
		assertTrue(isError(redo));
		assertEquals("Failed: Nothing to redo", text(redo));
	}

}
