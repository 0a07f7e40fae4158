package com.rozet.worker;

import static com.rozet.orchestration.OrchestrationConstants.*;
import com.rozet.orchestration.model.ToolAction;
import com.rozet.orchestration.model.WorkerResult;
import com.rozet.tools.FileListResult;
import com.rozet.tools.FileReadResult;
import com.rozet.tools.ToolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Confirms reported tool actions against the filesystem without repeating them. The trace is
 * appended to the result logs.
 */
@Slf4j
public class ToolUsageVerifier implements ToolActionProcessor {

    private final Duration bashTimeout;

    public ToolUsageVerifier(Duration bashTimeout) {
        this.bashTimeout = bashTimeout;
    }

    @Override
    public void process(List<ToolAction> actions, Path workingDir, WorkerResult.Builder result) {
        ToolExecutor executor = new ToolExecutor(workingDir, bashTimeout);
        List<String> trace = new ArrayList<>();
        for (ToolAction action : actions) {
            if (action == null) {
                continue;
            }
            String tool = action.normalizedTool();
            switch (tool) {
                case TOOL_WRITE_FILE -> trace.add(checkWritten(executor, action.targetPath()));
                case TOOL_READ_FILE -> trace.add(checkRead(executor, action.targetPath()));
                case TOOL_EXECUTE_BASH -> trace.add("Bash command reported: " + action.command());
                case TOOL_LIST_FILES -> trace.add(checkListed(executor, action));
                default -> trace.add("Unknown tool reported: " + tool);
            }
        }
        log.debug("Tool usage verification: {}", trace);
        result.appendLogs(TOOL_RESULTS_HEADER + String.join("\n", trace));
    }

    private String checkWritten(ToolExecutor executor, String path) {
        if (!StringUtils.hasText(path)) {
            return "write_file reported without a path";
        }
        FileReadResult read = executor.readFile(path);
        return read.success()
                ? "Verified: " + path + " exists and is readable"
                : "Not found after write: " + path + " (" + read.error() + ")";
    }

    private String checkRead(ToolExecutor executor, String path) {
        if (!StringUtils.hasText(path)) {
            return "read_file reported without a path";
        }
        FileReadResult read = executor.readFile(path);
        return read.success()
                ? "Verified: " + path + " read successfully (" + read.size() + " bytes)"
                : "Could not read " + path + ": " + read.error();
    }

    private String checkListed(ToolExecutor executor, ToolAction action) {
        String directory = StringUtils.hasText(action.directory()) ? action.directory()
                : StringUtils.hasText(action.path()) ? action.path() : ".";
        FileListResult listing = executor.listFiles(directory, action.pattern());
        return listing.success()
                ? "Verified: listed " + listing.count() + " files in " + directory
                : "Could not list " + directory + ": " + listing.error();
    }
}
