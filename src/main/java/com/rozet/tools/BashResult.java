package com.rozet.tools;

public record BashResult(
        boolean success,
        String stdout,
        String stderr,
        int returnCode
) {

    static BashResult failed(String stderr) {
        return new BashResult(false, "", stderr, -1);
    }
}
