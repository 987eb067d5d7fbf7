package com.example.paperdigest.port;

public class ArchivePersistenceException extends RuntimeException {

    public ArchivePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
