package org.lite.notify.controller;

import lombok.extern.slf4j.Slf4j;
import org.lite.notify.dto.ErrorResponse;
import org.lite.notify.exception.InvalidChannelConfigException;
import org.lite.notify.exception.InvalidExpressionException;
import org.lite.notify.exception.InvalidTaskStateException;
import org.lite.notify.exception.NotifySchedulerException;
import org.lite.notify.exception.TaskNotFoundException;
import org.lite.notify.exception.UnsupportedChannelException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class NotifyExceptionHandler {

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(TaskNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND", e);
    }

    @ExceptionHandler(InvalidTaskStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidTaskStateException e) {
        return respond(HttpStatus.CONFLICT, "INVALID_TASK_STATE", e);
    }

    @ExceptionHandler(InvalidExpressionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidExpression(InvalidExpressionException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_EXPRESSION", e);
    }

    @ExceptionHandler({UnsupportedChannelException.class, InvalidChannelConfigException.class})
    public ResponseEntity<ErrorResponse> handleChannel(NotifySchedulerException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_CHANNEL", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e);
    }

    @ExceptionHandler(NotifySchedulerException.class)
    public ResponseEntity<ErrorResponse> handleScheduler(NotifySchedulerException e) {
        log.error("Scheduler error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "SCHEDULER_ERROR", e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, Exception e) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, e.getMessage()));
    }
}
