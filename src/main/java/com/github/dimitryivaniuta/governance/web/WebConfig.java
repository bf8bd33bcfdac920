package com.github.dimitryivaniuta.governance.web;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final GovernanceInterceptor governanceInterceptor;
    private final GovernanceProperties properties;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(governanceInterceptor)
                .addPathPatterns("/**")
                .excludePathPatterns(properties.getWeb().getUngovernedPaths());
    }
}
