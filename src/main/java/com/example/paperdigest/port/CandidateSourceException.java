package com.example.paperdigest.port;

public class CandidateSourceException extends RuntimeException {

    public CandidateSourceException(String message) {
        super(message);
    }

    public CandidateSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
