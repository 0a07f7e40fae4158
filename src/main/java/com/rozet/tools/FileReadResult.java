package com.rozet.tools;

import org.springframework.lang.Nullable;

public record FileReadResult(
        boolean success,
        String content,
        long size,
        @Nullable String error
) {

    static FileReadResult ok(String content) {
        return new FileReadResult(true, content, content.length(), null);
    }

    static FileReadResult failed(String error) {
        return new FileReadResult(false, "", 0L, error);
    }
}
