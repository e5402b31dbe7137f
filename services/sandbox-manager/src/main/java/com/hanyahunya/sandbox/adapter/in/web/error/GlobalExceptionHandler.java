package com.hanyahunya.sandbox.adapter.in.web.error;

import com.hanyahunya.sandbox.common.error.GlobalErrorCode;
import com.hanyahunya.sandbox.common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import org.apache.catalina.connector.ClientAbortException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        if (e.getErrorCode().getHttpStatus().is5xxServerError()) {
            log.error("Business Exception: [Code: {}] {}", e.getErrorCode().getCode(), e.getMessage(), e);
        } else {
            log.warn("Business Exception: [Code: {}] {}", e.getErrorCode().getCode(), e.getMessage());
        }

        return ErrorResponse.toResponseEntity(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("Invalid Input: {}", e.getMessage());

        return ErrorResponse.toResponseEntity(GlobalErrorCode.INVALID_INPUT_VALUE, e.getMessage());
    }

    @ExceptionHandler(ClientAbortException.class)
    public void handleClientAbortException(ClientAbortException e) {
        log.warn("Client terminated connection: {}", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unhandled Exception: ", e);
        return ErrorResponse.toResponseEntity(GlobalErrorCode.INTERNAL_SERVER_ERROR);
    }
}
