package dev.fileops.engine.fs;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileStore;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.fileops.engine.CancellationToken;

/** {@link FileSystemAccess} backed by {@code java.nio.file}. */
public class NioFileSystemAccess implements FileSystemAccess {

	private static final Logger logger = LoggerFactory.getLogger(NioFileSystemAccess.class);

	@Override
	public boolean exists(Path path) {
		return Files.exists(path, LinkOption.NOFOLLOW_LINKS);
	}

	@Override
	public boolean isDirectory(Path path) {
		return Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS);
	}

	@Override
	public long size(Path path) throws IOException {
		return Files.size(path);
	}

	@Override
	public List<Path> list(Path directory) throws IOException {
		try (Stream<Path> entries = Files.list(directory)) {
			return entries.sorted().collect(Collectors.toList());
		}
	}

	@Override
	public void copy(Path source, Path target, CancellationToken cancellation) throws IOException {
		if (exists(target)) {
			throw new FileAlreadyExistsException(target.toString());
		}
		if (!isDirectory(source)) {
			cancellation.throwIfCancelled();
			Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
			return;
		}
		Deque<FileTime> directoryTimes = new ArrayDeque<>();
		Files.walkFileTree(source, new SimpleFileVisitor<>() {

			@Override
			public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
				cancellation.throwIfCancelled();
				Files.createDirectory(target.resolve(source.relativize(dir).toString()));
				directoryTimes.push(attrs.lastModifiedTime());
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
				cancellation.throwIfCancelled();
				Files.copy(file, target.resolve(source.relativize(file).toString()), StandardCopyOption.COPY_ATTRIBUTES,
						LinkOption.NOFOLLOW_LINKS);
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
				if (exc != null) {
					throw exc;
				}
				FileTime modified = directoryTimes.pop();
				try {
					Files.setLastModifiedTime(target.resolve(source.relativize(dir).toString()), modified);
				}
				catch (IOException ex) {
					logger.debug("Could not preserve timestamp of {}", dir, ex);
				}
				return FileVisitResult.CONTINUE;
			}

		});
	}

	@Override
	public void move(Path source, Path target, CancellationToken cancellation) throws IOException {
		if (!exists(source)) {
			throw new NoSuchFileException(source.toString());
		}
		if (exists(target)) {
			throw new FileAlreadyExistsException(target.toString());
		}
		cancellation.throwIfCancelled();
		if (sameVolume(source, target)) {
			try {
				Files.move(source, target);
				return;
			}
			catch (DirectoryNotEmptyException ex) {
				logger.debug("Rename of {} not possible, falling back to copy and delete", source, ex);
			}
		}
		try {
			copy(source, target, cancellation);
		}
		catch (IOException ex) {
			if (exists(target)) {
				deleteRecursively(target);
			}
			throw ex;
		}
		deleteRecursively(source);
	}

	@Override
	public void rename(Path source, Path target) throws IOException {
		if (exists(target)) {
			throw new FileAlreadyExistsException(target.toString());
		}
		Files.move(source, target);
	}

	@Override
	public void deleteRecursively(Path path) throws IOException {
		if (!isDirectory(path)) {
			Files.delete(path);
			return;
		}
		Files.walkFileTree(path, new SimpleFileVisitor<>() {

			@Override
			public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
				Files.delete(file);
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
				if (exc != null) {
					throw exc;
				}
				Files.delete(dir);
				return FileVisitResult.CONTINUE;
			}

		});
	}

	@Override
	public void createFile(Path path) throws IOException {
		Files.createFile(path);
	}

	@Override
	public void createDirectory(Path path) throws IOException {
		Files.createDirectory(path);
	}

	@Override
	public void createDirectories(Path path) throws IOException {
		Files.createDirectories(path);
	}

	@Override
	public boolean sameVolume(Path first, Path second) {
		try {
			FileStore firstStore = Files.getFileStore(closestExisting(first));
			FileStore secondStore = Files.getFileStore(closestExisting(second));
			return firstStore.equals(secondStore);
		}
		catch (IOException ex) {
			logger.debug("Unable to compare volumes of {} and {}", first, second, ex);
			return false;
		}
	}

	private static Path closestExisting(Path path) throws NoSuchFileException {
		Path candidate = path.toAbsolutePath();
		while (candidate != null && !Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
			candidate = candidate.getParent();
		}
		if (candidate == null) {
			throw new NoSuchFileException(path.toString());
		}
		return candidate;
	}

}
