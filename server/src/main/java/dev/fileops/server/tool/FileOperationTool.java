package dev.fileops.server.tool;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import lombok.RequiredArgsConstructor;

import dev.fileops.engine.OperationContext;
import dev.fileops.engine.OperationEngine;
import dev.fileops.engine.model.OperationResult;
import dev.fileops.server.model.DirectoryListing;
import dev.fileops.server.service.WorkspaceService;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * MCP tools for listing the workspace and for the engine's file mutations: copy, move, delete,
 * rename, duplicate and create. Every mutation is recorded in the engine's undo history.
 */
@Component
@RequiredArgsConstructor
public class FileOperationTool {

	private static final Logger logger = LoggerFactory.getLogger(FileOperationTool.class);

	private final OperationEngine engine;

	private final WorkspaceService workspace;

	private final ToolResults results;

	public Path baseDirectory() {
		return this.workspace.baseDirectory();
	}

	/**
	 * @return every tool this class provides, in registration order
	 */
	public List<McpServerFeatures.SyncToolSpecification> tools() {
		return List.of(listFilesTool(), copyItemsTool(), moveItemsTool(), deleteItemsTool(), renameItemTool(),
				duplicateItemTool(), createFileTool(), createDirectoryTool());
	}

	public McpServerFeatures.SyncToolSpecification listFilesTool() {
		return ToolSchemas.tool("list_files", "List files", "List one level of a workspace directory.",
				ToolSchemas.object(List.of(), "dir", ToolSchemas.string("Relative directory to list (defaults to the root).")),
				this::handleListFiles);
	}

	public McpServerFeatures.SyncToolSpecification copyItemsTool() {
		return ToolSchemas.tool("copy_items", "Copy items",
				"Copy files or directories into a directory. Name clashes get numbered names, nothing is overwritten.",
				transferSchema("copy"), (exchange, request) -> handleTransfer(request, false));
	}

	public McpServerFeatures.SyncToolSpecification moveItemsTool() {
		return ToolSchemas.tool("move_items", "Move items",
				"Move files or directories into a directory. Name clashes get numbered names, nothing is overwritten.",
				transferSchema("move"), (exchange, request) -> handleTransfer(request, true));
	}

	public McpServerFeatures.SyncToolSpecification deleteItemsTool() {
		return ToolSchemas.tool("delete_items", "Delete items",
				"Move items to the trash (undoable). With permanent=true they are removed irreversibly; the client "
						+ "is asked to confirm permanent deletion of directories or several items.",
				ToolSchemas.object(List.of("paths"), "paths", ToolSchemas.paths("Relative paths to delete."),
						"permanent", ToolSchemas.bool("Delete irreversibly instead of moving to the trash."),
						"confirmed", ToolSchemas.bool("Skip the confirmation prompt for permanent deletion.")),
				this::handleDelete);
	}

	public McpServerFeatures.SyncToolSpecification renameItemTool() {
		return ToolSchemas.tool("rename_item", "Rename item",
				"Rename a file or directory in place. Fails when the new name is taken.",
				ToolSchemas.object(List.of("path", "newName"), "path", ToolSchemas.string("Relative path to rename."),
						"newName", ToolSchemas.string("New name, without any directory part.")),
				(exchange, request) -> handleRename(request));
	}

	public McpServerFeatures.SyncToolSpecification duplicateItemTool() {
		return ToolSchemas.tool("duplicate_item", "Duplicate item",
				"Copy an item next to itself under the next numbered name, e.g. report_00001.txt.",
				ToolSchemas.object(List.of("path"), "path", ToolSchemas.string("Relative path to duplicate.")),
				(exchange, request) -> handleDuplicate(request));
	}

	public McpServerFeatures.SyncToolSpecification createFileTool() {
		return ToolSchemas.tool("create_file", "Create file", "Create an empty file. Fails when the name is taken.",
				createSchema("file"), (exchange, request) -> handleCreate(request, false));
	}

	public McpServerFeatures.SyncToolSpecification createDirectoryTool() {
		return ToolSchemas.tool("create_directory", "Create directory", "Create a directory. Fails when the name is taken.",
				createSchema("directory"), (exchange, request) -> handleCreate(request, true));
	}

	private McpSchema.CallToolResult handleListFiles(McpSyncServerExchange exchange,
			McpSchema.CallToolRequest callToolRequest) {
		Map<String, Object> arguments = ToolRequestUtils.safeArguments(callToolRequest);
		String dir = ToolRequestUtils.stringArgument(arguments, "dir", ".");
		logger.debug("Handling list_files request for directory {}", dir);
		try {
			DirectoryListing listing = this.workspace.list(dir);
			String detailed = listing.entries().isEmpty() ? listing.summaryLine()
					: listing.summaryLine() + System.lineSeparator() + listing.entries()
						.stream()
						.map(entry -> "- " + entry.displayLabel())
						.collect(Collectors.joining(System.lineSeparator()));
			return this.results.success(detailed, listing.toStructured());
		}
		catch (NoSuchFileException | NotDirectoryException ex) {
			logger.debug("Directory {} not found or not a directory", dir, ex);
			return this.results.error("Directory not found: " + dir,
					Map.of("path", dir, "reason", ex.getClass().getSimpleName()));
		}
		catch (IOException ex) {
			logger.warn("Failed to list directory {}", dir, ex);
			return this.results.error("Failed to list directory: " + dir, Map.of("path", dir));
		}
	}

	private McpSchema.CallToolResult handleTransfer(McpSchema.CallToolRequest callToolRequest, boolean move) {
		Map<String, Object> arguments = ToolRequestUtils.safeArguments(callToolRequest);
		List<String> paths = ToolRequestUtils.stringListArgument(arguments, "paths");
		String target = ToolRequestUtils.stringArgument(arguments, "target", null);
		if (paths.isEmpty()) {
			return this.results.missingArgument("paths");
		}
		if (!StringUtils.hasText(target)) {
			return this.results.missingArgument("target");
		}
		logger.debug("Handling {} of {} item(s) to {}", move ? "move" : "copy", paths.size(), target);
		try {
			List<Path> sources = this.workspace.resolveAll(paths);
			Path targetDirectory = this.workspace.resolve(target);
			OperationResult result = move ? this.engine.move(sources, targetDirectory)
					: this.engine.copy(sources, targetDirectory);
			return this.results.fromResult(result);
		}
		catch (IOException ex) {
			return escapeError(ex);
		}
	}

	private McpSchema.CallToolResult handleDelete(McpSyncServerExchange exchange,
			McpSchema.CallToolRequest callToolRequest) {
		Map<String, Object> arguments = ToolRequestUtils.safeArguments(callToolRequest);
		List<String> paths = ToolRequestUtils.stringListArgument(arguments, "paths");
		boolean permanent = ToolRequestUtils.booleanArgument(arguments, "permanent", false);
		boolean confirmed = ToolRequestUtils.booleanArgument(arguments, "confirmed", false);
		if (paths.isEmpty()) {
			return this.results.missingArgument("paths");
		}
		try {
			List<Path> targets = this.workspace.resolveAll(paths);
			if (permanent && !confirmed && needsConfirmation(targets)) {
				if (!supportsElicitation(exchange)) {
					return this.results.fromResult(this.engine.delete(targets, true, false, OperationContext.none()));
				}
				if (!confirmPermanentDeletion(exchange, paths)) {
					logger.info("Permanent deletion declined for {}", paths);
					return this.results.success("Skipped deleting " + String.join(", ", paths),
							Map.of("paths", paths, "status", "skipped"));
				}
				confirmed = true;
			}
			return this.results.fromResult(this.engine.delete(targets, permanent, confirmed, OperationContext.none()));
		}
		catch (IOException ex) {
			return escapeError(ex);
		}
	}

	private McpSchema.CallToolResult handleRename(McpSchema.CallToolRequest callToolRequest) {
		Map<String, Object> arguments = ToolRequestUtils.safeArguments(callToolRequest);
		String path = ToolRequestUtils.stringArgument(arguments, "path", null);
		String newName = ToolRequestUtils.stringArgument(arguments, "newName", null);
		if (!StringUtils.hasText(path)) {
			return this.results.missingArgument("path");
		}
		if (!StringUtils.hasText(newName)) {
			return this.results.missingArgument("newName");
		}
		try {
			return this.results.fromResult(this.engine.rename(this.workspace.resolve(path), newName));
		}
		catch (IOException ex) {
			return escapeError(ex);
		}
	}

	private McpSchema.CallToolResult handleDuplicate(McpSchema.CallToolRequest callToolRequest) {
		Map<String, Object> arguments = ToolRequestUtils.safeArguments(callToolRequest);
		String path = ToolRequestUtils.stringArgument(arguments, "path", null);
		if (!StringUtils.hasText(path)) {
			return this.results.missingArgument("path");
		}
		try {
			return this.results.fromResult(this.engine.duplicate(this.workspace.resolve(path)));
		}
		catch (IOException ex) {
			return escapeError(ex);
		}
	}

	private McpSchema.CallToolResult handleCreate(McpSchema.CallToolRequest callToolRequest, boolean directory) {
		Map<String, Object> arguments = ToolRequestUtils.safeArguments(callToolRequest);
		String dir = ToolRequestUtils.stringArgument(arguments, "dir", ".");
		String name = ToolRequestUtils.stringArgument(arguments, "name", null);
		if (!StringUtils.hasText(name)) {
			return this.results.missingArgument("name");
		}
		try {
			Path parent = this.workspace.resolve(dir);
			OperationResult result = directory ? this.engine.createDirectory(parent, name)
					: this.engine.createFile(parent, name);
			return this.results.fromResult(result);
		}
		catch (IOException ex) {
			return escapeError(ex);
		}
	}

	private boolean needsConfirmation(List<Path> targets) {
		return targets.size() > 1 || targets.stream().anyMatch(this.engine.fileSystem()::isDirectory);
	}

	private static boolean supportsElicitation(McpSyncServerExchange exchange) {
		McpSchema.ClientCapabilities capabilities = exchange != null ? exchange.getClientCapabilities() : null;
		return capabilities != null && capabilities.elicitation() != null;
	}

	/**
	 * Ask the client to confirm an irreversible delete.
	 * @param exchange exchange used to issue the prompt
	 * @param paths paths as the client named them
	 * @return {@code true} when the client accepted and confirmed
	 */
	private boolean confirmPermanentDeletion(McpSyncServerExchange exchange, List<String> paths) {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("confirm",
				Map.of("type", "boolean", "description", "Set to true to delete permanently. This cannot be undone."));
		Map<String, Object> schema = new LinkedHashMap<>();
		schema.put("type", "object");
		schema.put("properties", properties);
		schema.put("required", List.of("confirm"));
		schema.put("additionalProperties", false);

		logger.info("Prompting for permanent deletion of {}", paths);
		McpSchema.ElicitResult result = exchange.createElicitation(McpSchema.ElicitRequest.builder()
			.message("Permanently delete " + (paths.size() == 1 ? paths.get(0) : paths.size() + " items") + "?")
			.requestedSchema(schema)
			.build());

		if (result == null || result.action() != McpSchema.ElicitResult.Action.ACCEPT) {
			return false;
		}
		Object confirm = result.content() != null ? result.content().get("confirm") : null;
		return Boolean.TRUE.equals(confirm);
	}

	private McpSchema.CallToolResult escapeError(IOException ex) {
		logger.debug("Rejected path argument", ex);
		return this.results.error(ex.getMessage(), Map.of("reason", "INVALID_PATH"));
	}

	private static McpSchema.JsonSchema transferSchema(String verb) {
		return ToolSchemas.object(List.of("paths", "target"), "paths",
				ToolSchemas.paths("Relative paths of the items to " + verb + "."), "target",
				ToolSchemas.string("Relative destination directory."));
	}

	private static McpSchema.JsonSchema createSchema(String what) {
		return ToolSchemas.object(List.of("name"), "dir",
				ToolSchemas.string("Relative parent directory (defaults to the root)."), "name",
				ToolSchemas.string("Name of the new " + what + "."));
	}

}
