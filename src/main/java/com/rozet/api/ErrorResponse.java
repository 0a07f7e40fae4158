package com.rozet.api;

public record ErrorResponse(
        String error,
        String message
) {
}
