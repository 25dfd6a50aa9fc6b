package com.foodrec.config;

import com.foodrec.dto.response.ErrorResponse;
import com.foodrec.exception.AppException;
import com.foodrec.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 예외 → 구조화된 에러 응답
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionAdvice {

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> onAppException(AppException e) {
        log.warn("[API] {} - {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(e.getStatus())
                .body(ErrorResponse.of(e.getCode(), e.getMessage(), e.getExtra()));
    }

    /**
     * JSON 형식 오류 (candidates가 배열이 아님, lat이 숫자가 아님 등)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> onUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("[API] unreadable request body - {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ValidationException.CODE, "Malformed request body: " + e.getMostSpecificCause().getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> onAny(Exception e) {
        log.error("[API] unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(INTERNAL_ERROR, e.getMessage(), null));
    }
}
