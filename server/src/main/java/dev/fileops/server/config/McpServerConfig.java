package dev.fileops.server.config;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.fileops.server.resource.HistoryResourceProvider;
import dev.fileops.server.tool.ClipboardTool;
import dev.fileops.server.tool.DropTool;
import dev.fileops.server.tool.FileOperationTool;
import dev.fileops.server.tool.HistoryTool;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpStreamableServerTransportProvider;

/**
 * Assembles the MCP server: every engine operation as a tool, plus the history resource.
 */
@Configuration
@EnableConfigurationProperties(McpTransportProperties.class)
public class McpServerConfig {

	private static final Logger logger = LoggerFactory.getLogger(McpServerConfig.class);

	/**
	 * Build the synchronous MCP server on the streamable HTTP transport.
	 * @param transportProvider the transport
	 * @param transportProperties endpoint settings, for logging
	 * @param fileOperationTool list, copy, move, delete, rename, duplicate and create tools
	 * @param clipboardTool clipboard tools
	 * @param historyTool undo and redo tools
	 * @param dropTool drag-and-drop tool
	 * @param historyResourceProvider history resource
	 * @return configured server
	 */
	@Bean(destroyMethod = "close")
	public McpSyncServer mcpServer(McpStreamableServerTransportProvider transportProvider,
			McpTransportProperties transportProperties, FileOperationTool fileOperationTool,
			ClipboardTool clipboardTool, HistoryTool historyTool, DropTool dropTool,
			HistoryResourceProvider historyResourceProvider) {
		List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>(fileOperationTool.tools());
		tools.addAll(clipboardTool.tools());
		tools.addAll(historyTool.tools());
		tools.add(dropTool.dropItemsTool());
		McpSyncServer server = McpServer.sync(transportProvider)
			.serverInfo("fileops-server", "0.1.0")
			.instructions("Copy, move, delete, rename, duplicate and create files relative to "
					+ fileOperationTool.baseDirectory() + ". Every change can be undone with the undo tool.")
			.tools(tools)
			.resources(historyResourceProvider.historyResource())
			.build();
		logger.info("MCP server initialized with {} tools on endpoint {}", tools.size(),
				transportProperties.getEndpoint());
		return server;
	}

}
