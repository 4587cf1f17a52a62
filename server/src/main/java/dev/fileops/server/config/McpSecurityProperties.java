package dev.fileops.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials a client must present, via HTTP basic authentication, to reach the MCP endpoint.
 */
@ConfigurationProperties("mcp.files.security")
public record McpSecurityProperties(String username, String password) {

	public static final String DEFAULT_USERNAME = "mcp";

	public static final String DEFAULT_PASSWORD = "change-me";

	public McpSecurityProperties {
		username = username == null || username.isBlank() ? DEFAULT_USERNAME : username;
		password = password == null || password.isBlank() ? DEFAULT_PASSWORD : password;
	}

	public boolean usesDefaultPassword() {
		return DEFAULT_PASSWORD.equals(this.password);
	}

}
