package com.ureca.eventbus.common.exception;

import com.ureca.eventbus.common.ApiResponse;
import com.ureca.eventbus.common.BaseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseCustomException.class)
    public ResponseEntity<ApiResponse<?>> handleCustomException(BaseCustomException e) {
        BaseCode baseCode = e.getBaseCode();
        if (baseCode.getStatus().is5xxServerError()) {
            log.error("[API 예외] code: {}, message: {}", baseCode.getCode(), e.getMessage(), e);
        } else {
            log.warn("[API 예외] code: {}, message: {}", baseCode.getCode(), e.getMessage());
        }
        return ResponseEntity.status(baseCode.getStatus())
                .body(ApiResponse.error(baseCode, e.getMessage()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<?>> handleInvalidInput(Exception e) {
        log.warn("[API 예외] 잘못된 요청. message: {}", e.getMessage());
        return ResponseEntity.status(BaseCode.INVALID_INPUT.getStatus())
                .body(ApiResponse.error(BaseCode.INVALID_INPUT, BaseCode.INVALID_INPUT.getMessage()));
    }
}
