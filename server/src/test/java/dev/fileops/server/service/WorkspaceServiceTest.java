package dev.fileops.server.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.fileops.engine.fs.NioFileSystemAccess;
import dev.fileops.engine.numbering.NumberingService;
import dev.fileops.engine.numbering.NumberingSettings;
import dev.fileops.server.config.FileOpsProperties;
import dev.fileops.server.model.DirectoryListing;
import dev.fileops.server.model.WorkspaceEntry;

class WorkspaceServiceTest {

	@TempDir
	Path tempDir;

	private WorkspaceService workspace;

	private Path root;

	@BeforeEach
	void setUp() {
		FileOpsProperties properties = new FileOpsProperties();
		properties.setBaseDir(this.tempDir.resolve("workspace").toString());
		this.workspace = new WorkspaceService(properties, new NioFileSystemAccess(),
				new NumberingService(NumberingSettings.defaults()));
		this.root = this.workspace.baseDirectory();
	}

	@Test
	void createsTheWorkspaceAndTrash() {
		assertTrue(Files.isDirectory(this.root));
		assertTrue(Files.isDirectory(this.root.resolve(".fileops-trash")));
	}

	@Test
	void resolvesPathsInsideTheWorkspace() throws IOException {
		assertEquals(this.root.resolve("a/b.txt"), this.workspace.resolve("a/./b.txt"));
		assertEquals(this.root, this.workspace.resolve(null));
		assertEquals(this.root.resolve("b"), this.workspace.resolve("a/../b"));
	}

	@Test
	void refusesPathsThatEscape() {
		IOException ex = assertThrows(IOException.class, () -> this.workspace.resolve("../outside.txt"));

		assertEquals("Path escapes workspace: ../outside.txt", ex.getMessage());
		assertThrows(IOException.class, () -> this.workspace.resolveAll(List.of("ok.txt", "a/../../x")));
	}

	@Test
	void rendersRelativePaths() {
		assertEquals(".", this.workspace.relativeString(this.root));
		assertEquals("a/b.txt", this.workspace.relativeString(this.root.resolve("a").resolve("b.txt")));
		Path outside = this.tempDir.resolve("elsewhere");
		assertEquals(outside.toString(), this.workspace.relativeString(outside));
	}

	@Test
	void listsEntriesSortedWithMetadata() throws IOException {
		Files.writeString(this.root.resolve("Report_00003.txt"), "12345");
		Files.createDirectory(this.root.resolve("archive"));
		Files.writeString(this.root.resolve("b.txt"), "");

		DirectoryListing listing = this.workspace.list("");

		List<String> paths = listing.entries().stream().map(WorkspaceEntry::path).collect(Collectors.toList());
		assertEquals(List.of("archive", "b.txt", "Report_00003.txt"), paths);
		WorkspaceEntry archive = listing.entries().get(0);
		WorkspaceEntry report = listing.entries().get(2);
		assertTrue(archive.directory());
		assertNull(archive.size());
		assertEquals(5L, report.size());
		assertEquals(3L, report.sequenceNumber());
		assertEquals(". holds 2 file(s) and 1 directory", listing.summaryLine());
	}

	@Test
	void listingRejectsMissingDirectoriesAndFiles() throws IOException {
		Files.writeString(this.root.resolve("file.txt"), "x");

		assertThrows(NoSuchFileException.class, () -> this.workspace.list("missing"));
		assertThrows(NotDirectoryException.class, () -> this.workspace.list("file.txt"));
	}

	@Test
	void emptyDirectorySummary() throws IOException {
		Files.createDirectory(this.root.resolve("empty"));

		assertEquals("empty is empty", this.workspace.list("empty").summaryLine());
	}

}
