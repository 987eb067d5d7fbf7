package com.example.paperdigest.port;

public class InferenceTransportException extends RuntimeException {

    public InferenceTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
