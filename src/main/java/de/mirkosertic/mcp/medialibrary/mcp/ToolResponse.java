package de.mirkosertic.mcp.medialibrary.mcp;

/**
 * Common shape of every tool response DTO. A response with {@code success == false} is
 * reported to the client as a tool error.
 */
public interface ToolResponse {

    boolean success();

    String error();
}
