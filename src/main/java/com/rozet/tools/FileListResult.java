package com.rozet.tools;

import org.springframework.lang.Nullable;

import java.util.List;

public record FileListResult(
        boolean success,
        List<String> files,
        @Nullable String error
) {

    public int count() {
        return files.size();
    }

    static FileListResult failed(String error) {
        return new FileListResult(false, List.of(), error);
    }
}
