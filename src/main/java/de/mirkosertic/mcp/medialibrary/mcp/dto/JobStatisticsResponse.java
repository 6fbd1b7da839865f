package de.mirkosertic.mcp.medialibrary.mcp.dto;

import de.mirkosertic.mcp.medialibrary.job.JobStatistics;
import de.mirkosertic.mcp.medialibrary.mcp.ToolResponse;

/**
 * Response DTO for the getJobStatistics tool.
 */
public record JobStatisticsResponse(
        boolean success,
        JobStatistics statistics,
        String error
) implements ToolResponse {

    public static JobStatisticsResponse success(final JobStatistics statistics) {
        return new JobStatisticsResponse(true, statistics, null);
    }

    public static JobStatisticsResponse error(final String errorMessage) {
        return new JobStatisticsResponse(false, null, errorMessage);
    }
}
