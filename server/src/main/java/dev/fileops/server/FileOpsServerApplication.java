package dev.fileops.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the file operations MCP server.
 */
@SpringBootApplication
public class FileOpsServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(FileOpsServerApplication.class, args);
	}

}
