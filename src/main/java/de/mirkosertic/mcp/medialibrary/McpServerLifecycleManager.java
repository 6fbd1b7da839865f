package de.mirkosertic.mcp.medialibrary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exits the server when the process that launched it goes away. MCP clients start the server as
 * a child over STDIO and do not always close the pipe before they die.
 */
public class McpServerLifecycleManager {

    private static final Logger logger = LoggerFactory.getLogger(McpServerLifecycleManager.class);

    private final Runnable onParentExit;

    public McpServerLifecycleManager(final Runnable onParentExit) {
        this.onParentExit = onParentExit;
    }

    public void start() {
        ProcessHandle.current().parent().ifPresent(parent -> {
            parent.onExit().thenRun(() -> {
                logger.info("Parent process {} terminated, shutting down...", parent.pid());
                onParentExit.run();
            });

            logger.info("Monitoring parent process PID: {}", parent.pid());
        });
    }
}
