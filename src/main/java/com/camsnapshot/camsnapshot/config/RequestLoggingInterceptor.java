package com.camsnapshot.camsnapshot.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingInterceptor.class);
    private static final String START_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".start";

    @Value("${logging.request.enabled:false}")
    private boolean enabled;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (enabled) {
            request.setAttribute(START_ATTRIBUTE, System.nanoTime());
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        Object start = request.getAttribute(START_ATTRIBUTE);
        if (!enabled || !(start instanceof Long)) {
            return;
        }
        long ms = (System.nanoTime() - (Long) start) / 1_000_000L;
        logger.info("method={}, uri={}, status={}, took={}ms, remoteAddr={}",
                request.getMethod(), request.getRequestURI(), response.getStatus(), ms, request.getRemoteAddr());
    }
}
