package com.foodrec.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * 요청 파라미터 검증 실패 (400)
 */
public class ValidationException extends AppException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message, CODE, HttpStatus.BAD_REQUEST, null);
    }

    public ValidationException(String message, Map<String, Object> extra) {
        super(message, CODE, HttpStatus.BAD_REQUEST, extra);
    }
}
