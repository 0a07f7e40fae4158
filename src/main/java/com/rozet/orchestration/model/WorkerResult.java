package com.rozet.orchestration.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record WorkerResult(
        @JsonProperty("task_id") String taskId,
        boolean success,
        @JsonProperty("files_modified") List<String> filesModified,
        @JsonProperty("files_created") List<String> filesCreated,
        @JsonProperty("tests_run") List<TestRun> testsRun,
        @JsonProperty("verification_passed") boolean verificationPassed,
        List<String> errors,
        String logs
) {

    public WorkerResult {
        filesModified = filesModified == null ? List.of() : List.copyOf(new LinkedHashSet<>(filesModified));
        filesCreated = filesCreated == null ? List.of() : List.copyOf(new LinkedHashSet<>(filesCreated));
        testsRun = testsRun == null ? List.of() : List.copyOf(testsRun);
        errors = errors == null ? List.of() : List.copyOf(errors);
        logs = logs == null ? "" : logs;
    }

    public static WorkerResult failure(String taskId, String error, String logs) {
        return new WorkerResult(taskId, false, List.of(), List.of(), List.of(), false,
                List.of(error == null ? "Unknown error" : error), logs);
    }

    public WorkerResult withVerifiedFiles(List<String> verifiedModified, List<String> verifiedCreated,
                                          boolean verificationPassed, List<String> errors) {
        return new WorkerResult(taskId, success, verifiedModified, verifiedCreated, testsRun,
                verificationPassed, errors, logs);
    }

    public boolean claimsFiles() {
        return !filesModified.isEmpty() || !filesCreated.isEmpty();
    }

    public static Builder builder(String taskId) {
        return new Builder(taskId);
    }

    public static final class Builder {

        private final String taskId;
        private boolean success;
        private final Set<String> filesModified = new LinkedHashSet<>();
        private final Set<String> filesCreated = new LinkedHashSet<>();
        private final List<TestRun> testsRun = new ArrayList<>();
        private boolean verificationPassed;
        private final List<String> errors = new ArrayList<>();
        private final StringBuilder logs = new StringBuilder();

        private Builder(String taskId) {
            this.taskId = taskId;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder filesModified(List<String> paths) {
            if (paths != null) {
                paths.stream().filter(StringUtils::hasText).forEach(filesModified::add);
            }
            return this;
        }

        public Builder filesCreated(List<String> paths) {
            if (paths != null) {
                paths.stream().filter(StringUtils::hasText).forEach(filesCreated::add);
            }
            return this;
        }

        public Builder addFileCreated(String path) {
            filesCreated.add(path);
            return this;
        }

        public Builder testsRun(List<TestRun> runs) {
            if (runs != null) {
                runs.stream().filter(Objects::nonNull).forEach(testsRun::add);
            }
            return this;
        }

        public Builder verificationPassed(boolean verificationPassed) {
            this.verificationPassed = verificationPassed;
            return this;
        }

        public Builder errors(List<String> messages) {
            if (messages != null) {
                messages.stream().filter(StringUtils::hasText).forEach(errors::add);
            }
            return this;
        }

        public Builder addError(String message) {
            errors.add(message);
            return this;
        }

        public Builder logs(String text) {
            logs.setLength(0);
            if (text != null) {
                logs.append(text);
            }
            return this;
        }

        public Builder appendLogs(String text) {
            logs.append(text);
            return this;
        }

        public WorkerResult build() {
            return new WorkerResult(taskId, success, new ArrayList<>(filesModified), new ArrayList<>(filesCreated),
                    testsRun, verificationPassed, errors, logs.toString());
        }
    }
}
