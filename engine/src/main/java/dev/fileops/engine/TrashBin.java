package dev.fileops.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.fileops.engine.fs.FileSystemAccess;
import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationKind;
import dev.fileops.engine.model.PathMapping;
import dev.fileops.engine.model.UndoPayload;

/**
 * Private store for non-permanent deletes. Every trashed item gets its own
 * {@code <trash>/<uuid>/} slot, which lives exactly as long as a history entry can still restore it.
 */
class TrashBin {

	private static final Logger logger = LoggerFactory.getLogger(TrashBin.class);

	private final FileSystemAccess fileSystem;

	private final Path directory;

	TrashBin(FileSystemAccess fileSystem, Path directory) {
		this.fileSystem = fileSystem;
		this.directory = directory;
	}

	Path directory() {
		return this.directory;
	}

	/**
	 * Create a fresh slot for an item.
	 * @return the location the item should be moved to
	 */
	Path allocate(Path item) throws IOException {
		Path slot = this.directory.resolve(UUID.randomUUID().toString());
		this.fileSystem.createDirectories(slot);
		return slot.resolve(item.getFileName().toString());
	}

	/**
	 * Remove the slot of a trashed path once it holds nothing any more.
	 */
	void release(Path trashed) {
		Path slot = slotOf(trashed);
		if (slot == null) {
			return;
		}
		try {
			if (this.fileSystem.isDirectory(slot) && this.fileSystem.list(slot).isEmpty()) {
				this.fileSystem.deleteRecursively(slot);
			}
		}
		catch (IOException ex) {
			logger.warn("Leaving trash slot {} in place", slot, ex);
		}
	}

	/**
	 * Irreversibly remove the trashed items of a delete that left history.
	 */
	void purge(Operation operation) {
		if (operation.kind() != OperationKind.DELETE
				|| !(operation.undoPayload() instanceof UndoPayload.Transfers transfers)) {
			return;
		}
		for (PathMapping entry : transfers.entries()) {
			Path slot = slotOf(entry.destination());
			if (slot == null || !this.fileSystem.exists(slot)) {
				continue;
			}
			try {
				this.fileSystem.deleteRecursively(slot);
				logger.debug("Purged {} from the trash", entry.source());
			}
			catch (IOException ex) {
				logger.warn("Failed to purge trash slot {}", slot, ex);
			}
		}
	}

	/**
	 * Remove slots that no recorded operation refers to, such as those left by an earlier session.
	 * Only directories named like a slot are touched.
	 * @param recorded operations still held in history
	 * @return number of slots removed
	 */
	int purgeUnreferenced(Collection<Operation> recorded) {
		if (!this.fileSystem.isDirectory(this.directory)) {
			return 0;
		}
		List<Path> slots;
		try {
			slots = this.fileSystem.list(this.directory);
		}
		catch (IOException ex) {
			logger.warn("Unable to list trash directory {}", this.directory, ex);
			return 0;
		}
		int removed = 0;
		for (Path slot : slots) {
			if (!isSlotName(slot) || isReferenced(slot, recorded)) {
				continue;
			}
			try {
				this.fileSystem.deleteRecursively(slot);
				removed++;
			}
			catch (IOException ex) {
				logger.warn("Failed to purge trash slot {}", slot, ex);
			}
		}
		if (removed > 0) {
			logger.info("Purged {} unreferenced trash slot(s) from {}", removed, this.directory);
		}
		return removed;
	}

	private Path slotOf(Path trashed) {
		Path slot = trashed.getParent();
		if (slot == null || !this.directory.equals(slot.getParent())) {
			return null;
		}
		return slot;
	}

	private boolean isReferenced(Path slot, Collection<Operation> recorded) {
		for (Operation operation : recorded) {
			if (operation.kind() == OperationKind.DELETE
					&& operation.undoPayload() instanceof UndoPayload.Transfers transfers
					&& transfers.entries().stream().anyMatch(entry -> slot.equals(slotOf(entry.destination())))) {
				return true;
			}
		}
		return false;
	}

	private static boolean isSlotName(Path slot) {
		try {
			UUID.fromString(slot.getFileName().toString());
			return true;
		}
		catch (IllegalArgumentException ex) {
			return false;
		}
	}

}
