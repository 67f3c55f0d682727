package com.example.adaptivestream.common.config;

import com.example.adaptivestream.common.logging.AccessLogFilter;
import com.example.adaptivestream.infrastructure.security.ApiTokenAuthFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public AccessLogFilter accessLogFilter() {
        return new AccessLogFilter();
    }

    @Bean
    public ApiTokenAuthFilter apiTokenAuthFilter(AppSecurityProperties properties) {
        return new ApiTokenAuthFilter(properties);
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   AccessLogFilter accessLogFilter,
                                                   ApiTokenAuthFilter apiTokenAuthFilter) throws Exception {
        http.csrf().disable()
                .sessionManagement().sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                .and()
                .authorizeRequests()
                .antMatchers(
                        "/actuator/health",
                        "/actuator/info",
                        "/v3/api-docs/**",
                        "/swagger-ui/**",
                        "/swagger-ui.html",
                        "/favicon.ico")
                .permitAll()
                .anyRequest().authenticated()
                .and()
                .addFilterBefore(accessLogFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterAfter(apiTokenAuthFilter, AccessLogFilter.class);

        return http.build();
    }
}
