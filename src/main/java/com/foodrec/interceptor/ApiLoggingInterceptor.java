package com.foodrec.interceptor;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.WebUtils;

import java.nio.charset.StandardCharsets;

/**
 * API 요청 로깅 Interceptor
 * 메서드/경로/상태/응답시간은 INFO, 요청 본문(비밀값 가림)은 DEBUG
 */
@Component
public class ApiLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(ApiLoggingInterceptor.class);

    private static final String START_TIME_ATTRIBUTE = "startTime";

    // 요청 본문 최대 길이 (너무 긴 본문은 잘라서 기록)
    private static final int MAX_BODY_LENGTH = 5000;

    private final LogRedactor redactor;

    @Autowired
    public ApiLoggingInterceptor(ObjectMapper objectMapper) {
        this.redactor = new LogRedactor(objectMapper, MAX_BODY_LENGTH);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Long startTime = (Long) request.getAttribute(START_TIME_ATTRIBUTE);
        if (startTime == null) {
            return;
        }
        long responseTimeMs = System.currentTimeMillis() - startTime;

        logger.info("[API] {} {} -> {} ({}ms)",
                request.getMethod(), request.getRequestURI(), response.getStatus(), responseTimeMs);

        if (logger.isDebugEnabled()) {
            logger.debug("[API] request body: {}", redactor.redact(getRequestBody(request)));
        }
    }

    /**
     * 요청 본문 읽기 (RequestWrapperFilter로 캐싱된 경우만)
     */
    private String getRequestBody(HttpServletRequest request) {
        ContentCachingRequestWrapper wrapper =
                WebUtils.getNativeRequest(request, ContentCachingRequestWrapper.class);
        if (wrapper == null) {
            return null;
        }
        byte[] content = wrapper.getContentAsByteArray();
        return content.length > 0 ? new String(content, StandardCharsets.UTF_8) : null;
    }
}
