package com.tencent.taskmgr.adapter.web;

import com.tencent.taskmgr.client.dto.Response;
import com.tencent.taskmgr.domain.exception.TaskException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一异常处理：任务异常按错误码返回，参数错误返回 INVALID_ARGUMENT，其余为 UNKNOWN_ERROR
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
    static final String UNKNOWN_ERROR = "UNKNOWN_ERROR";

    private static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(TaskException.class)
    public ResponseEntity<Response> handleTaskException(TaskException ex, HttpServletRequest request) {
        String code = ex.getCode().name();
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), code, ex.getMessage());
        return ResponseEntity.status(statusOf(ex)).body(Response.buildFailure(code, ex.getMessage()));
    }

    @ExceptionHandler({
        MethodArgumentNotValidException.class,
        ConstraintViolationException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<Response> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = truncate(ex.getMessage());
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), INVALID_ARGUMENT, message);
        return ResponseEntity.badRequest().body(Response.buildFailure(INVALID_ARGUMENT, message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), UNKNOWN_ERROR, ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Response.buildFailure(UNKNOWN_ERROR, truncate(ex.getMessage())));
    }

    private static HttpStatus statusOf(TaskException ex) {
        switch (ex.getCode()) {
            case TASK_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case UPDATE_CONFLICT:
            case DUPLICATE_TASK_NUMBER:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.UNPROCESSABLE_ENTITY;
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
