package com.dnobretech.epublocator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;


@Configuration
public class WebConfig {

    // ex.: locator.cors.allowed-origins=http://localhost:5173,https://*.dnobretech.com
    @Value("${locator.cors.allowed-origins:*}")
    private List<String> allowedOrigins;

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration c = new CorsConfiguration();
        allowedOrigins.forEach(o -> c.addAllowedOriginPattern(o.trim()));
        c.addAllowedHeader("*");
        // só upload + preflight; nada aqui altera o EPUB
        c.addAllowedMethod(HttpMethod.POST);
        c.addAllowedMethod(HttpMethod.OPTIONS);
        UrlBasedCorsConfigurationSource s = new UrlBasedCorsConfigurationSource();
        s.registerCorsConfiguration("/api/epub/**", c);
        return new CorsFilter(s);
    }
}
