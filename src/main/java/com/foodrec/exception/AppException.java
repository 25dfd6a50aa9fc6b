package com.foodrec.exception;

import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.Map;

/**
 * 애플리케이션 공통 예외
 * code는 응답의 "code" 필드로 그대로 노출됨
 */
public class AppException extends RuntimeException {

    private final String code;
    private final HttpStatus status;
    private final Map<String, Object> extra;

    public AppException(String message, String code, HttpStatus status, Map<String, Object> extra) {
        super(message);
        this.code = code;
        this.status = status;
        this.extra = extra != null ? Collections.unmodifiableMap(extra) : Collections.emptyMap();
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public Map<String, Object> getExtra() {
        return extra;
    }
}
