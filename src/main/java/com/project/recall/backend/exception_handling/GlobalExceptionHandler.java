package com.project.recall.backend.exception_handling;

import com.project.recall.backend.exception.CardAlreadyGradedException;
import com.project.recall.backend.exception.CardNotFoundException;
import com.project.recall.backend.exception.ExceptionMessage;
import com.project.recall.backend.exception.InvalidCardStateException;
import com.project.recall.backend.exception.UserDoesNotExistException;
import com.project.recall.backend.exception.ValidationFailureException;
import com.project.recall.backend.response.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({CardNotFoundException.class, UserDoesNotExistException.class})
    public ResponseEntity<ApiResponse> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        log.warn("{} for {}", ex.getMessage(), request.getRequestURI());
        return new ResponseEntity<>(new ApiResponse(ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(CardAlreadyGradedException.class)
    public ResponseEntity<ApiResponse> handleAlreadyGraded(CardAlreadyGradedException ex) {
        log.info("Duplicate grade for card {}", ex.getCardId());
        return new ResponseEntity<>(new ApiResponse(ex.getMessage()), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(InvalidCardStateException.class)
    public ResponseEntity<ApiResponse> handleInvalidState(InvalidCardStateException ex) {
        log.warn("Rejected action on card {}: {}", ex.getCardId(), ex.getReason());
        return new ResponseEntity<>(new ApiResponse(ex.getMessage()), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(ValidationFailureException.class)
    public ResponseEntity<ApiResponse> handleValidationFailure(ValidationFailureException ex) {
        return ResponseEntity.badRequest().body(new ApiResponse(ex.getMessage(), ex.getFieldMessages()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        return ResponseEntity.badRequest()
                .body(new ApiResponse(ExceptionMessage.VALIDATION_FAILED.toString(), ValidationFailureException.fieldMessages(ex.getBindingResult())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ApiResponse(ex.getMessage()));
    }

}
