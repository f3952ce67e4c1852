package com.project.recall.backend.exception;

import lombok.Getter;
import org.springframework.validation.Errors;
import org.springframework.validation.FieldError;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class ValidationFailureException extends RuntimeException {
    final private Errors errors;

    public ValidationFailureException(ExceptionMessage message, Errors errors) {
        super(message.toString());
        this.errors = errors;
    }

    /**
     * First message per rejected field, in the order the validator reported them.
     */
    public Map<String, String> getFieldMessages() {
        return fieldMessages(errors);
    }

    public static Map<String, String> fieldMessages(Errors errors) {
        Map<String, String> messages = new LinkedHashMap<>();
        for (FieldError error : errors.getFieldErrors()) {
            messages.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return messages;
    }
}
