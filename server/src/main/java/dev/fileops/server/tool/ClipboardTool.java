package dev.fileops.server.tool;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import lombok.RequiredArgsConstructor;

import dev.fileops.engine.OperationEngine;
import dev.fileops.engine.clipboard.ClipboardContents;
import dev.fileops.engine.model.OperationResult;
import dev.fileops.server.service.WorkspaceService;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Clipboard tools: select items for copy or cut, then paste them into a directory.
 */
@Component
@RequiredArgsConstructor
public class ClipboardTool {

	private static final Logger logger = LoggerFactory.getLogger(ClipboardTool.class);

	private final OperationEngine engine;

	private final WorkspaceService workspace;

	private final ToolResults results;

	public List<McpServerFeatures.SyncToolSpecification> tools() {
		return List.of(clipboardCopyTool(), clipboardCutTool(), pasteItemsTool());
	}

	public McpServerFeatures.SyncToolSpecification clipboardCopyTool() {
		return ToolSchemas.tool("clipboard_copy", "Copy to clipboard",
				"Select items for copying; paste_items can then be repeated.", selectionSchema(),
				(exchange, request) -> handleSelect(request, false));
	}

	public McpServerFeatures.SyncToolSpecification clipboardCutTool() {
		return ToolSchemas.tool("clipboard_cut", "Cut to clipboard",
				"Select items for moving; the next paste_items moves them and clears the clipboard.", selectionSchema(),
				(exchange, request) -> handleSelect(request, true));
	}

	public McpServerFeatures.SyncToolSpecification pasteItemsTool() {
		return ToolSchemas.tool("paste_items", "Paste items",
				"Paste the clipboard into a directory, copying or moving depending on how it was filled.",
				ToolSchemas.object(List.of("target"), "target", ToolSchemas.string("Relative destination directory.")),
				(exchange, request) -> handlePaste(request));
	}

	private McpSchema.CallToolResult handleSelect(McpSchema.CallToolRequest callToolRequest, boolean cut) {
		Map<String, Object> arguments = ToolRequestUtils.safeArguments(callToolRequest);
		List<String> paths = ToolRequestUtils.stringListArgument(arguments, "paths");
		if (paths.isEmpty()) {
			return this.results.missingArgument("paths");
		}
		try {
			List<Path> selection = this.workspace.resolveAll(paths);
			OperationResult result = cut ? this.engine.cutToClipboard(selection)
					: this.engine.copyToClipboard(selection);
			if (!result.success()) {
				return this.results.fromResult(result);
			}
			Map<String, Object> structured = clipboardState(this.engine.clipboardContents());
			if (!result.warnings().isEmpty()) {
				structured.put("warnings", result.warnings());
			}
			logger.debug("Clipboard now holds {} item(s) for {}", result.resultPaths().size(), cut ? "cut" : "copy");
			return this.results.success("%s %d item(s) to the clipboard".formatted(cut ? "Cut" : "Copied",
					result.resultPaths().size()), structured);
		}
		catch (IOException ex) {
			return this.results.error(ex.getMessage(), Map.of("reason", "INVALID_PATH"));
		}
	}

	private McpSchema.CallToolResult handlePaste(McpSchema.CallToolRequest callToolRequest) {
		Map<String, Object> arguments = ToolRequestUtils.safeArguments(callToolRequest);
		String target = ToolRequestUtils.stringArgument(arguments, "target", null);
		if (!StringUtils.hasText(target)) {
			return this.results.missingArgument("target");
		}
		try {
			return this.results.fromResult(this.engine.paste(this.workspace.resolve(target)));
		}
		catch (IOException ex) {
			return this.results.error(ex.getMessage(), Map.of("reason", "INVALID_PATH"));
		}
	}

	private Map<String, Object> clipboardState(ClipboardContents contents) {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("mode", contents.mode().name());
		structured.put("paths", this.results.relative(new ArrayList<>(contents.paths())));
		return structured;
	}

	private static McpSchema.JsonSchema selectionSchema() {
		return ToolSchemas.object(List.of("paths"), "paths", ToolSchemas.paths("Relative paths to select."));
	}

}
