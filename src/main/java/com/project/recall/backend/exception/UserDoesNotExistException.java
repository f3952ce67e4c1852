package com.project.recall.backend.exception;

public class UserDoesNotExistException extends RuntimeException {
    public UserDoesNotExistException(ExceptionMessage message) {
        super(message.toString());
    }

    public UserDoesNotExistException(ExceptionMessage message, Object user) {
        super(message + ": " + user);
    }
}
