package com.uptimefleet.master.config;

import com.uptimefleet.common.security.ApiKeyValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.HandlerInterceptor;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Requires the shared bearer token; failures surface as 401 through the
 * exception handler
 */
@RequiredArgsConstructor
public class ApiKeyInterceptor implements HandlerInterceptor {

    private final ApiKeyValidator validator;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        validator.validate(request.getHeader(HttpHeaders.AUTHORIZATION));
        return true;
    }
}
