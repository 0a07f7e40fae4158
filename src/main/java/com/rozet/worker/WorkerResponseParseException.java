package com.rozet.worker;

public class WorkerResponseParseException extends RuntimeException {

    public WorkerResponseParseException(String message) {
        super(message);
    }

    public WorkerResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
