package com.rozet.tools;

import org.springframework.lang.Nullable;

public record FileWriteResult(
        boolean success,
        String path,
        long size,
        boolean verified,
        @Nullable String error
) {

    static FileWriteResult failed(String path, String error) {
        return new FileWriteResult(false, path, 0L, false, error);
    }
}
