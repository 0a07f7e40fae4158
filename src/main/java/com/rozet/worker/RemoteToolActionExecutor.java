package com.rozet.worker;

import static com.rozet.orchestration.OrchestrationConstants.*;
import com.rozet.orchestration.model.ToolAction;
import com.rozet.orchestration.model.WorkerResult;
import com.rozet.tools.BashResult;
import com.rozet.tools.FileListResult;
import com.rozet.tools.FileReadResult;
import com.rozet.tools.FileWriteResult;
import com.rozet.tools.RemoteToolClient;
import com.rozet.tools.RemoteToolResponse;
import com.rozet.tools.ToolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Performs every reported tool action, through the remote tool endpoint when one is
 * configured and reachable, otherwise on the local {@link ToolExecutor}. Any failed action
 * fails the task.
 */
@Slf4j
public class RemoteToolActionExecutor implements ToolActionProcessor {

    static final String REMOTE_WRITE = "write";
    static final String REMOTE_READ = "read";
    static final String REMOTE_LIST = "list";
    static final String REMOTE_BASH = "bash";

    private final RemoteToolClient remoteToolClient;
    private final Duration bashTimeout;

    public RemoteToolActionExecutor(RemoteToolClient remoteToolClient, Duration bashTimeout) {
        this.remoteToolClient = remoteToolClient;
        this.bashTimeout = bashTimeout;
    }

    @Override
    public void process(List<ToolAction> actions, Path workingDir, WorkerResult.Builder result) {
        ToolExecutor executor = new ToolExecutor(workingDir, bashTimeout);
        List<String> trace = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (ToolAction action : actions) {
            if (action == null || action.normalizedTool().isEmpty()) {
                continue;
            }
            switch (action.normalizedTool()) {
                case TOOL_WRITE_FILE -> write(action, executor, result, trace, errors);
                case TOOL_READ_FILE -> read(action, executor, trace, errors);
                case TOOL_LIST_FILES -> list(action, executor, trace, errors);
                case TOOL_EXECUTE_BASH -> bash(action, executor, trace, errors);
                default -> {
                    log.info("Unsupported tool '{}', skipping execution", action.tool());
                    trace.add("Unsupported tool '" + action.normalizedTool() + "', skipped");
                }
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Tool execution encountered errors: {}", errors);
            result.errors(errors).success(false);
        }
        result.appendLogs(TOOL_RESULTS_HEADER + String.join("\n", trace));
    }

    private void write(ToolAction action, ToolExecutor executor, WorkerResult.Builder result,
                       List<String> trace, List<String> errors) {
        String path = action.targetPath();
        if (!StringUtils.hasText(path)) {
            errors.add("write_file missing path");
            return;
        }
        String content = action.content() == null ? "" : action.content();
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("filePath", path);
        args.put("content", content);
        Optional<RemoteToolResponse> remote = executeRemotely(REMOTE_WRITE, args, executor.getWorkingDir());
        boolean success;
        String error;
        if (remote.isPresent()) {
            success = remote.get().success();
            error = remote.get().output();
        } else {
            FileWriteResult local = executor.writeFile(path, content);
            success = local.success();
            error = local.error();
        }
        if (success) {
            trace.add("write_file -> " + path);
            result.addFileCreated(path);
        } else {
            errors.add(StringUtils.hasText(error) ? error : "write_file failed for " + path);
        }
    }

    private void read(ToolAction action, ToolExecutor executor, List<String> trace, List<String> errors) {
        String path = action.targetPath();
        if (!StringUtils.hasText(path)) {
            errors.add("read_file missing path");
            return;
        }
        Optional<RemoteToolResponse> remote = executeRemotely(REMOTE_READ, Map.of("filePath", path),
                executor.getWorkingDir());
        boolean success;
        String detail;
        if (remote.isPresent()) {
            success = remote.get().success();
            detail = remote.get().output();
        } else {
            FileReadResult local = executor.readFile(path);
            success = local.success();
            detail = success ? local.content() : local.error();
        }
        if (success) {
            trace.add("read_file -> " + path + " (" + (detail == null ? 0 : detail.length()) + " characters)");
        } else {
            errors.add(StringUtils.hasText(detail) ? detail : "read_file failed for " + path);
        }
    }

    private void list(ToolAction action, ToolExecutor executor, List<String> trace, List<String> errors) {
        String directory = StringUtils.hasText(action.directory()) ? action.directory()
                : StringUtils.hasText(action.path()) ? action.path() : ".";
        String pattern = StringUtils.hasText(action.pattern()) ? action.pattern() : "*";
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("path", directory);
        args.put("pattern", pattern);
        Optional<RemoteToolResponse> remote = executeRemotely(REMOTE_LIST, args, executor.getWorkingDir());
        if (remote.isPresent()) {
            if (remote.get().success()) {
                trace.add("list_files -> " + directory + " ('" + pattern + "')");
            } else {
                errors.add(StringUtils.hasText(remote.get().output()) ? remote.get().output()
                        : "list_files failed for " + directory);
            }
            return;
        }
        FileListResult local = executor.listFiles(directory, pattern);
        if (local.success()) {
            trace.add("list_files -> " + directory + " (" + local.count() + " items matching '" + pattern + "')");
        } else {
            errors.add(StringUtils.hasText(local.error()) ? local.error() : "list_files failed for " + directory);
        }
    }

    private void bash(ToolAction action, ToolExecutor executor, List<String> trace, List<String> errors) {
        String command = action.command();
        if (!StringUtils.hasText(command)) {
            errors.add("execute_bash missing command");
            return;
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("command", command);
        args.put("timeout", bashTimeout.toMillis());
        Optional<RemoteToolResponse> remote = executeRemotely(REMOTE_BASH, args, executor.getWorkingDir());
        if (remote.isPresent()) {
            if (remote.get().success()) {
                trace.add("execute_bash -> " + command);
                if (StringUtils.hasText(remote.get().output())) {
                    trace.add(remote.get().output().strip());
                }
            } else {
                errors.add(StringUtils.hasText(remote.get().output()) ? remote.get().output()
                        : "execute_bash failed for " + command);
            }
            return;
        }
        BashResult local = executor.executeBash(command, bashTimeout);
        if (local.success()) {
            trace.add("execute_bash -> " + command);
            if (StringUtils.hasText(local.stdout())) {
                trace.add(local.stdout().strip());
            }
        } else {
            errors.add("execute_bash failed for " + command + " (exit " + local.returnCode() + ")");
            if (StringUtils.hasText(local.stderr())) {
                trace.add(local.stderr().strip());
            }
        }
    }

    private Optional<RemoteToolResponse> executeRemotely(String tool, Map<String, Object> args, Path directory) {
        if (!remoteToolClient.isConfigured()) {
            return Optional.empty();
        }
        try {
            return Optional.of(remoteToolClient.execute(tool, args, directory));
        } catch (RestClientException ex) {
            log.warn("Remote tool '{}' failed, falling back to local execution: {}", tool, ex.getMessage());
            return Optional.empty();
        }
    }
}
