package dev.fileops.server.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.Nullable;

/**
 * Settings of the streamable HTTP transport the MCP server is exposed on.
 */
@ConfigurationProperties(prefix = "mcp.files.transport")
public class McpTransportProperties {

	/**
	 * HTTP endpoint path the MCP transport binds to.
	 */
	private String endpoint = "/mcp";

	/**
	 * Reject HTTP DELETE (client-initiated session termination) on the endpoint.
	 */
	private boolean disallowDelete = false;

	/**
	 * Heartbeat interval; {@code null} keeps the SDK default.
	 */
	@Nullable
	private Duration keepAliveInterval;

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	public boolean isDisallowDelete() {
		return disallowDelete;
	}

	public void setDisallowDelete(boolean disallowDelete) {
		this.disallowDelete = disallowDelete;
	}

	@Nullable
	public Duration getKeepAliveInterval() {
		return keepAliveInterval;
	}

	public void setKeepAliveInterval(@Nullable Duration keepAliveInterval) {
		this.keepAliveInterval = keepAliveInterval;
	}

}
