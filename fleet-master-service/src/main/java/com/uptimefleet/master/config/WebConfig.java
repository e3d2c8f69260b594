package com.uptimefleet.master.config;

import com.uptimefleet.common.constants.FleetConstants;
import com.uptimefleet.common.security.ApiKeyValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web configuration for master service
 * Everything except the health check needs the API key
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final ApiKeyValidator apiKeyValidator;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiKeyInterceptor(apiKeyValidator))
                .addPathPatterns("/**")
                .excludePathPatterns(FleetConstants.PATH_HEALTH, "/error");
    }
}
