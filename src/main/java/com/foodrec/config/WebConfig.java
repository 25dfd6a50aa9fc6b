package com.foodrec.config;

import com.foodrec.interceptor.ApiLoggingInterceptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * API 로깅 Interceptor 등록
 * 본문 캐싱 필터(RequestWrapperFilter)와 같은 경로 범위를 사용
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final String API_PREFIX = "/api/";
    static final String API_PATTERN = API_PREFIX + "**";

    @Autowired
    private ApiLoggingInterceptor apiLoggingInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(apiLoggingInterceptor)
                .addPathPatterns(API_PATTERN);
    }

    static boolean isApiPath(String requestUri) {
        return requestUri != null && requestUri.startsWith(API_PREFIX);
    }
}
