package com.rozet.worker;

import static com.rozet.orchestration.OrchestrationConstants.VERIFICATION_FAILED_MESSAGE;
import com.rozet.orchestration.model.WorkerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks claimed files against the working directory. A result that claimed files of which
 * none exist loses {@code verificationPassed}, whatever the worker reported.
 */
@Component
@Slf4j
public class ResultVerifier {

    public WorkerResult verify(WorkerResult result, Path workingDir) {
        Path root = workingDir.toAbsolutePath().normalize();
        List<String> modified = existing(result.filesModified(), root);
        List<String> created = existing(result.filesCreated(), root);

        boolean verificationPassed = result.verificationPassed();
        List<String> errors = new ArrayList<>(result.errors());
        if (result.claimsFiles() && modified.isEmpty() && created.isEmpty()) {
            if (verificationPassed) {
                log.warn("Task {} claimed verification passed but none of its files exist", result.taskId());
            }
            verificationPassed = false;
            if (!errors.contains(VERIFICATION_FAILED_MESSAGE)) {
                errors.add(VERIFICATION_FAILED_MESSAGE);
            }
        }
        return result.withVerifiedFiles(modified, created, verificationPassed, errors);
    }

    private List<String> existing(List<String> paths, Path root) {
        List<String> found = new ArrayList<>();
        for (String path : paths) {
            if (exists(root, path)) {
                found.add(path);
            } else {
                log.warn("Claimed file does not exist: {}", path);
            }
        }
        return found;
    }

    private boolean exists(Path root, String path) {
        try {
            Path target = root.resolve(path).normalize();
            return target.startsWith(root) && Files.exists(target);
        } catch (InvalidPathException ex) {
            log.warn("Claimed file has an invalid path {}: {}", path, ex.getMessage());
            return false;
        }
    }
}
