package com.al.hl7fhirconverter.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Tags every request's log lines with a conversion id, taken from the
 * {@code conversionId} request header when present.
 */
@Component
public class MdcInterceptor implements HandlerInterceptor {

    public static final String MDC_KEY = "conversionId";
    public static final String HEADER_KEY = "conversionId";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String conversionId = request.getHeader(HEADER_KEY);
        if (conversionId == null || conversionId.isEmpty()) {
            conversionId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_KEY, conversionId);
        response.setHeader(HEADER_KEY, conversionId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
            @Nullable Exception ex) {
        MDC.remove(MDC_KEY);
    }
}
