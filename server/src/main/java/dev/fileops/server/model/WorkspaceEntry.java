package dev.fileops.server.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a workspace directory listing.
 * @param path path relative to the workspace root
 * @param directory {@code true} for directories
 * @param size size in bytes for regular files, {@code null} otherwise
 * @param lastModified last modification time, {@code null} when unreadable
 * @param sequenceNumber numbered-name suffix, {@code 0} when the name carries none
 */
public record WorkspaceEntry(String path, boolean directory, Long size, Instant lastModified, long sequenceNumber) {

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("path", path);
		structured.put("type", directory ? "directory" : "file");
		if (size != null) {
			structured.put("bytes", size);
		}
		if (lastModified != null) {
			structured.put("lastModified", lastModified.toString());
		}
		if (sequenceNumber > 0) {
			structured.put("sequenceNumber", sequenceNumber);
		}
		return structured;
	}

	public String displayLabel() {
		return directory ? path + "/" : path;
	}

}
