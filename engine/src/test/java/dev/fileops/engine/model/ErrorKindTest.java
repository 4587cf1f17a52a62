package dev.fileops.engine.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.fileops.engine.OperationCancelledException;

class ErrorKindTest {

	@Test
	void classifiesFilesystemFailures() {
		assertEquals(ErrorKind.NOT_FOUND, ErrorKind.classify(new NoSuchFileException("a")));
		assertEquals(ErrorKind.PERMISSION_DENIED, ErrorKind.classify(new AccessDeniedException("a")));
		assertEquals(ErrorKind.NAME_CONFLICT, ErrorKind.classify(new FileAlreadyExistsException("a")));
		assertEquals(ErrorKind.CANCELLED, ErrorKind.classify(new OperationCancelledException("stop")));
		assertEquals(ErrorKind.IN_USE, ErrorKind.classify(new FileSystemException("a", null, "Device or resource busy")));
		assertEquals(ErrorKind.CROSS_DEVICE,
				ErrorKind.classify(new FileSystemException("a", "b", "Invalid cross-device link")));
		assertEquals(ErrorKind.IO_ERROR, ErrorKind.classify(new IOException("disk on fire")));
	}

	@Test
	void errorsFromExceptionsKeepThePathAndMessage() {
		OperationError error = OperationError.from(Path.of("a.txt"), new NoSuchFileException("a.txt"));

		assertEquals(new OperationError(ErrorKind.NOT_FOUND, Path.of("a.txt"), "a.txt"), error);
		assertEquals("IOException", OperationError.from(null, new IOException()).message());
	}

	@Test
	void successDependsOnlyOnErrors() {
		OperationResult partial = OperationResult.of(List.of(Path.of("b")), List.of(new OperationError(
				ErrorKind.NOT_FOUND, Path.of("a"), "Source does not exist: a")), List.of(), null);

		assertEquals(false, partial.success());
		assertEquals("Failed: Source does not exist: a", partial.summaryLine());
		assertEquals("Nothing to do", OperationResult.of(List.of(), List.of(), List.of(), null).summaryLine());
	}

}
