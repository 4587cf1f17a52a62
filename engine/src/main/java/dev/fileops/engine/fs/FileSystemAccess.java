package dev.fileops.engine.fs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import dev.fileops.engine.CancellationToken;

/**
 * Filesystem primitives the engine is built on. Implementations never overwrite an existing
 * destination; callers pick collision-free names first.
 */
public interface FileSystemAccess {

	boolean exists(Path path);

	boolean isDirectory(Path path);

	/** Size of a regular file in bytes. */
	long size(Path path) throws IOException;

	/** Lists the direct children of a directory, sorted by name. */
	List<Path> list(Path directory) throws IOException;

	/**
	 * Copy a file or directory tree, preserving timestamps where the target filesystem allows.
	 * Cancellation is checked before each file; a cancelled copy leaves a partial tree behind
	 * for the caller to roll back.
	 */
	void copy(Path source, Path target, CancellationToken cancellation) throws IOException;

	/**
	 * Move a file or directory tree. Within one volume this is a rename; across volumes it is a
	 * copy followed by removal of the source.
	 */
	void move(Path source, Path target, CancellationToken cancellation) throws IOException;

	/** Rename within a single directory, failing when the target exists. */
	void rename(Path source, Path target) throws IOException;

	/** Irreversibly delete a file or directory tree. */
	void deleteRecursively(Path path) throws IOException;

	void createFile(Path path) throws IOException;

	void createDirectory(Path path) throws IOException;

	/** Create a directory and any missing parents. */
	void createDirectories(Path path) throws IOException;

	/**
	 * Decide whether two paths live on the same logical volume. Paths that do not exist yet are
	 * judged by their closest existing ancestor.
	 */
	boolean sameVolume(Path first, Path second);

}
