package com.yanweiyi.micodeexecutor.controller;

import com.yanweiyi.micodeexecutor.exception.BusinessException;
import com.yanweiyi.micodeexecutor.model.ErrorResponse;
import com.yanweiyi.micodeexecutor.model.enums.ErrorCodeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器，统一返回 {error, message}
 *
 * @author yanweiyi
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> businessExceptionHandler(BusinessException e) {
        log.info("request rejected: {} {}", e.getErrorCode().getValue(), e.getMessage());
        return toResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> messageNotReadableHandler(HttpMessageNotReadableException e) {
        log.info("malformed request body: {}", e.getMessage());
        return toResponse(ErrorCodeEnum.INVALID_REQUEST, "malformed request body");
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> runtimeExceptionHandler(RuntimeException e) {
        log.error("unexpected error", e);
        return toResponse(ErrorCodeEnum.SYSTEM_ERROR, ErrorCodeEnum.SYSTEM_ERROR.getMessage());
    }

    private static ResponseEntity<ErrorResponse> toResponse(ErrorCodeEnum errorCode, String message) {
        return ResponseEntity.status(errorCode.getHttpStatus())
                .body(new ErrorResponse(errorCode.getValue(), message));
    }
}
