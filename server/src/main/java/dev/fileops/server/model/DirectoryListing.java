package dev.fileops.server.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Contents of one workspace directory.
 * @param directory path relative to the workspace root
 * @param entries entries sorted case-insensitively by path
 */
public record DirectoryListing(String directory, List<WorkspaceEntry> entries) {

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("directory", directory);
		structured.put("entries", entries.stream().map(WorkspaceEntry::toStructured).collect(Collectors.toList()));
		return structured;
	}

	public String summaryLine() {
		if (entries.isEmpty()) {
			return "%s is empty".formatted(directory);
		}
		long directories = entries.stream().filter(WorkspaceEntry::directory).count();
		return "%s holds %d file(s) and %d director%s".formatted(directory, entries.size() - directories, directories,
				directories == 1 ? "y" : "ies");
	}

}
