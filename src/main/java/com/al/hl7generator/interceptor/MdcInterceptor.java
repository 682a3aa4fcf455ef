package com.al.hl7generator.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Tags every API request with a generation id, taken from the request header
 * or freshly created, and echoes it back on the response.
 */
@Component
public class MdcInterceptor implements HandlerInterceptor {

    public static final String MDC_KEY = "generationId";
    public static final String HEADER_KEY = "X-Generation-Id";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String generationId = request.getHeader(HEADER_KEY);
        if (generationId == null || generationId.isEmpty()) {
            generationId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_KEY, generationId);
        response.setHeader(HEADER_KEY, generationId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
            @Nullable Exception ex) {
        MDC.remove(MDC_KEY);
    }
}
