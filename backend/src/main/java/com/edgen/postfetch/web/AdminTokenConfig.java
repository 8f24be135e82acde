package com.edgen.postfetch.web;

import com.edgen.postfetch.config.PostFetchProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class AdminTokenConfig implements WebMvcConfigurer {

    private final PostFetchProperties postFetchProperties;

    public AdminTokenConfig(PostFetchProperties postFetchProperties) {
        this.postFetchProperties = postFetchProperties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AdminTokenInterceptor(postFetchProperties))
                .addPathPatterns("/api/post-fetch/sources/**", "/api/post-fetch/cache");
    }
}
