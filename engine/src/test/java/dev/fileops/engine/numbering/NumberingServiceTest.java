package dev.fileops.engine.numbering;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NumberingServiceTest {

	@TempDir
	Path workspace;

	private NumberingService numbering;

	@BeforeEach
	void setUp() {
		this.numbering = new NumberingService(NumberingSettings.defaults());
	}

	@Test
	void duplicatesOfTheSameFileCountUp() throws IOException {
		Path document = Files.writeString(this.workspace.resolve("document.txt"), "text");

		Path first = this.numbering.generateNumberedName(document);
		Files.createFile(first);
		Path second = this.numbering.generateNumberedName(document);

		assertEquals("document_00001.txt", first.getFileName().toString());
		assertEquals("document_00002.txt", second.getFileName().toString());
	}

	@Test
	void continuesAfterTheHighestNumberAlreadyOnDisk() throws IOException {
		Files.createFile(this.workspace.resolve("report.pdf"));
		Files.createFile(this.workspace.resolve("report_00001.pdf"));
		Files.createFile(this.workspace.resolve("report_00007.pdf"));

		Path next = this.numbering.generateNumberedName(this.workspace.resolve("report.pdf"));

		assertEquals("report_00008.pdf", next.getFileName().toString());
	}

	@Test
	void numbersAreNotReusedAfterFilesDisappear() throws IOException {
		Path source = Files.createFile(this.workspace.resolve("a.txt"));
		Path first = this.numbering.generateNumberedName(source);
		Files.createFile(first);
		Files.delete(first);

		Path second = this.numbering.generateNumberedName(source);

		assertEquals("a_00002.txt", second.getFileName().toString());
	}

	@Test
	void duplicatingANumberedNameContinuesItsSequence() throws IOException {
		Files.createFile(this.workspace.resolve("doc.txt"));
		Path numbered = Files.createFile(this.workspace.resolve("doc_00003.txt"));

		Path next = this.numbering.generateNumberedName(numbered);

		assertEquals("doc_00004.txt", next.getFileName().toString());
	}

	@Test
	void skipsCandidatesCreatedBehindItsBack() throws IOException {
		Path source = Files.createFile(this.workspace.resolve("x.txt"));
		assertEquals("x_00001.txt", this.numbering.generateNumberedName(source).getFileName().toString());
		Files.createFile(this.workspace.resolve("x_00002.txt"));
		Files.createFile(this.workspace.resolve("x_00003.txt"));

		Path next = this.numbering.generateNumberedName(source);

		assertEquals("x_00004.txt", next.getFileName().toString());
		assertFalse(Files.exists(next));
	}

	@Test
	void rollsOverToAWiderSuffix() throws IOException {
		Files.createFile(this.workspace.resolve("doc.txt"));
		this.numbering.seed(List.of(new CounterSnapshot(this.workspace.toString(), "doc", 99_999L, 5)));

		Path widened = this.numbering.generateNumberedName(this.workspace.resolve("doc.txt"));
		Files.createFile(widened);
		Path after = this.numbering.generateNumberedName(this.workspace.resolve("doc.txt"));

		assertEquals("doc_000001.txt", widened.getFileName().toString());
		assertEquals("doc_000002.txt", after.getFileName().toString());
	}

	@Test
	void seededCountersAreNeverLowered() throws IOException {
		Path source = Files.createFile(this.workspace.resolve("notes.md"));
		this.numbering.seed(List.of(new CounterSnapshot(this.workspace.toString(), "notes", 41L, 5)));
		this.numbering.seed(List.of(new CounterSnapshot(this.workspace.toString(), "notes", 3L, 5)));

		Path next = this.numbering.generateNumberedName(source);

		assertEquals("notes_00042.md", next.getFileName().toString());
	}

	@Test
	void counterSurvivesASnapshotRoundTrip() throws IOException {
		Path source = Files.createFile(this.workspace.resolve("img.png"));
		Files.createFile(this.numbering.generateNumberedName(source));
		Files.createFile(this.numbering.generateNumberedName(source));

		NumberingService restarted = new NumberingService(NumberingSettings.defaults());
		restarted.seed(this.numbering.snapshot());
		Files.delete(this.workspace.resolve("img_00001.png"));
		Files.delete(this.workspace.resolve("img_00002.png"));

		assertEquals("img_00003.png", restarted.generateNumberedName(source).getFileName().toString());
	}

	@Test
	void directoriesHaveNoExtension() throws IOException {
		Path folder = Files.createDirectory(this.workspace.resolve("v1.2"));

		Path next = this.numbering.generateNumberedName(folder);

		assertEquals("v1.2_00001", next.getFileName().toString());
	}

	@Test
	void parsesNumberedAndPlainNames() {
		NumberedName numbered = this.numbering.parseNumberedName(this.workspace.resolve("doc_00012.txt"));
		NumberedName plain = this.numbering.parseNumberedName(this.workspace.resolve("doc.txt"));
		NumberedName shortSuffix = this.numbering.parseNumberedName(this.workspace.resolve("doc_12.txt"));

		assertEquals("doc", numbered.baseName());
		assertEquals(12, numbered.number());
		assertEquals(".txt", numbered.extension());
		assertEquals("doc", plain.baseName());
		assertEquals(0, plain.number());
		assertEquals("doc_12", shortSuffix.baseName());
		assertEquals(0, shortSuffix.number());
	}

	@Test
	void honoursACustomTemplate() throws IOException {
		NumberingService custom = new NumberingService(new NumberingSettings("{name} ({number}){ext}", 1, 9L, 2L));
		Path source = Files.createFile(this.workspace.resolve("file.txt"));

		Path next = custom.generateNumberedName(source);

		assertEquals("file (2).txt", next.getFileName().toString());
		assertEquals("file", custom.parseNumberedName(next).baseName());
	}

	@Test
	void recordsCounterPerDirectoryAndBaseName() throws IOException {
		Path source = Files.createFile(this.workspace.resolve("a.txt"));
		this.numbering.generateNumberedName(source);

		assertTrue(this.numbering.counter(this.workspace, "a").isPresent());
		assertEquals(1L, this.numbering.counter(this.workspace, "a").get().highest());
		assertTrue(this.numbering.counter(this.workspace, "b").isEmpty());
	}

	@Test
	void unreadableDirectoryCountsFromTheStart() {
		Path missing = this.workspace.resolve("missing").resolve("ghost.txt");

		assertEquals("ghost_00001.txt", this.numbering.generateNumberedName(missing).getFileName().toString());
	}

	@Test
	void failureWhileReadingTheDirectoryFallsBackToProbing() throws IOException {
		Files.createFile(this.workspace.resolve("report.pdf"));
		Files.createFile(this.workspace.resolve("report_00001.pdf"));
		NumberingService failing = new NumberingService(NumberingSettings.defaults()) {

			@Override
			DirectoryStream<Path> openDirectory(Path directory) {
				return new DirectoryStream<>() {

					@Override
					public Iterator<Path> iterator() {
						return new Iterator<>() {

							@Override
							public boolean hasNext() {
								throw new DirectoryIteratorException(new IOException("device went away"));
							}

							@Override
							public Path next() {
								throw new NoSuchElementException();
							}

						};
					}

					@Override
					public void close() {
					}

				};
			}

		};

		Path next = failing.generateNumberedName(this.workspace.resolve("report.pdf"));

		assertEquals("report_00002.pdf", next.getFileName().toString());
	}

	@Test
	void rejectsTemplatesWithoutPlaceholders() {
		assertThrows(IllegalArgumentException.class,
				() -> new NumberingService(new NumberingSettings("{name}-copy{ext}", 5, 99_999L, 1L)));
	}

}
