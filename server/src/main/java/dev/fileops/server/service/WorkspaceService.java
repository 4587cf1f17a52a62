package dev.fileops.server.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import dev.fileops.engine.fs.FileSystemAccess;
import dev.fileops.engine.numbering.NumberingService;
import dev.fileops.server.config.FileOpsProperties;
import dev.fileops.server.model.DirectoryListing;
import dev.fileops.server.model.WorkspaceEntry;

/**
 * Maps the relative paths MCP clients send onto the workspace root and back, and lists workspace
 * directories. Every resolved path is confined to the workspace.
 */
@Service
public class WorkspaceService {

	private static final Logger logger = LoggerFactory.getLogger(WorkspaceService.class);

	private final Path baseDirectory;

	private final Path trashDirectory;

	private final FileSystemAccess fileSystem;

	private final NumberingService numbering;

	/**
	 * Create the service, creating the workspace root and trash directory when missing.
	 * @param properties configuration supplying the workspace root
	 * @param fileSystem filesystem primitives used for listing
	 * @param numbering parser for numbered names shown in listings
	 */
	public WorkspaceService(FileOpsProperties properties, FileSystemAccess fileSystem, NumberingService numbering) {
		this.baseDirectory = ensureDirectory(properties.determineBaseDir());
		this.trashDirectory = ensureDirectory(properties.determineTrashDir());
		this.fileSystem = fileSystem;
		this.numbering = numbering;
		logger.info("Workspace root {}", this.baseDirectory);
	}

	public Path baseDirectory() {
		return this.baseDirectory;
	}

	/**
	 * List one level of a workspace directory. The trash directory is hidden.
	 * @param relativeDir directory relative to the workspace root, blank for the root
	 * @return the listing
	 * @throws IOException when the directory is missing, not a directory, or unreadable
	 */
	public DirectoryListing list(String relativeDir) throws IOException {
		Path directory = resolve(relativeDir == null || relativeDir.isBlank() ? "." : relativeDir);
		if (!this.fileSystem.exists(directory)) {
			throw new NoSuchFileException(relativeDir);
		}
		if (!this.fileSystem.isDirectory(directory)) {
			throw new NotDirectoryException(relativeDir);
		}
		List<WorkspaceEntry> entries = this.fileSystem.list(directory)
			.stream()
			.filter(entry -> !entry.equals(this.trashDirectory))
			.map(this::toEntry)
			.sorted(Comparator.comparing(WorkspaceEntry::path, String.CASE_INSENSITIVE_ORDER))
			.collect(Collectors.toList());
		return new DirectoryListing(relativeString(directory), entries);
	}

	/**
	 * Resolve a relative path against the workspace root, refusing paths that escape it.
	 * @param relativePath candidate relative path, {@code null} for the root
	 * @return absolute path inside the workspace
	 * @throws IOException when the path would escape the workspace
	 */
	public Path resolve(String relativePath) throws IOException {
		Path candidate = this.baseDirectory.resolve(relativePath == null ? "" : relativePath).normalize();
		if (!candidate.startsWith(this.baseDirectory)) {
			throw new IOException("Path escapes workspace: " + relativePath);
		}
		return candidate;
	}

	public List<Path> resolveAll(Collection<String> relativePaths) throws IOException {
		List<Path> resolved = new ArrayList<>(relativePaths.size());
		for (String relativePath : relativePaths) {
			resolved.add(resolve(relativePath));
		}
		return resolved;
	}

	/**
	 * Render a path relative to the workspace root with forward slashes. Paths outside the
	 * workspace, such as trash locations configured elsewhere, are returned absolute.
	 * @param path absolute path
	 * @return display path
	 */
	public String relativeString(Path path) {
		if (!path.startsWith(this.baseDirectory)) {
			return path.toString();
		}
		String relative = this.baseDirectory.relativize(path).toString().replace('\\', '/');
		return relative.isEmpty() ? "." : relative;
	}

	private WorkspaceEntry toEntry(Path entry) {
		long sequence = this.numbering.parseNumberedName(entry).number();
		try {
			BasicFileAttributes attributes = Files.readAttributes(entry, BasicFileAttributes.class,
					LinkOption.NOFOLLOW_LINKS);
			boolean directory = attributes.isDirectory();
			Instant lastModified = attributes.lastModifiedTime().toInstant();
			return new WorkspaceEntry(relativeString(entry), directory, directory ? null : attributes.size(),
					lastModified, sequence);
		}
		catch (IOException ex) {
			logger.warn("Unable to read metadata of {}", entry, ex);
			return new WorkspaceEntry(relativeString(entry), this.fileSystem.isDirectory(entry), null, null, sequence);
		}
	}

	private static Path ensureDirectory(Path directory) {
		try {
			Files.createDirectories(directory);
			return directory;
		}
		catch (IOException ex) {
			throw new IllegalStateException("Failed to prepare directory: " + directory, ex);
		}
	}

}
