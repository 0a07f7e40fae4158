package com.rozet.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * One entry of the {@code tools_used} array a worker model reports.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolAction(
        String tool,
        @Nullable String file,
        @Nullable String path,
        @Nullable String content,
        @Nullable String command,
        @Nullable String directory,
        @Nullable String pattern,
        @Nullable String result
) {

    public String normalizedTool() {
        return StringUtils.hasText(tool) ? tool.trim().toLowerCase(Locale.ROOT) : "";
    }

    @Nullable
    public String targetPath() {
        if (StringUtils.hasText(file)) {
            return file;
        }
        return StringUtils.hasText(path) ? path : null;
    }
}
