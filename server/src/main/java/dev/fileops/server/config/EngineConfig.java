package dev.fileops.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.fileops.engine.OperationEngine;
import dev.fileops.engine.clipboard.ClipboardState;
import dev.fileops.engine.drop.DropResolver;
import dev.fileops.engine.event.OperationEvents;
import dev.fileops.engine.fs.FileSystemAccess;
import dev.fileops.engine.fs.NioFileSystemAccess;
import dev.fileops.engine.history.HistoryManager;
import dev.fileops.engine.numbering.NumberingService;

/**
 * Wires the file operation engine from {@link FileOpsProperties}.
 */
@Configuration
@EnableConfigurationProperties(FileOpsProperties.class)
public class EngineConfig {

	private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

	@Bean
	public FileSystemAccess fileSystemAccess() {
		return new NioFileSystemAccess();
	}

	@Bean
	public NumberingService numberingService(FileOpsProperties properties) {
		return new NumberingService(properties.getNumbering().toSettings());
	}

	@Bean
	public HistoryManager historyManager(FileOpsProperties properties) {
		return new HistoryManager(properties.getHistory().toSettings());
	}

	@Bean
	public ClipboardState clipboardState() {
		return new ClipboardState();
	}

	@Bean
	public OperationEvents operationEvents() {
		return new OperationEvents();
	}

	@Bean
	public OperationEngine operationEngine(FileOpsProperties properties, FileSystemAccess fileSystemAccess,
			NumberingService numberingService, HistoryManager historyManager, ClipboardState clipboardState,
			OperationEvents operationEvents) {
		OperationEngine engine = new OperationEngine(fileSystemAccess, numberingService, historyManager,
				clipboardState, operationEvents, properties.determineTrashDir());
		// history does not survive a restart, so nothing can restore earlier trash slots
		engine.purgeTrash();
		logger.info("File operation engine ready (trash {}, history size {}, merge {})", engine.trashDirectory(),
				properties.getHistory().getMaxSize(), properties.getHistory().isMergeEnabled() ? "on" : "off");
		return engine;
	}

	@Bean
	public DropResolver dropResolver(OperationEngine operationEngine) {
		return new DropResolver(operationEngine);
	}

}
