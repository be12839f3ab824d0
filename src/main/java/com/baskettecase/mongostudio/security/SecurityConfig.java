package com.baskettecase.mongostudio.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security Configuration
 *
 * Stateless token authentication for the REST API and the MCP endpoint. Health and info
 * stay public. Without a configured access token everything is open, which suits a
 * single-user desktop install bound to localhost.
 */
@Slf4j
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final AccessTokenAuthenticationFilter accessTokenFilter;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));

        if (accessTokenFilter.isEnabled()) {
            log.info("🔒 Access token required for /api/** and /mcp");
            http.authorizeHttpRequests(authz -> authz
                    .requestMatchers("/actuator/health", "/actuator/health/**", "/actuator/info").permitAll()
                    .anyRequest().authenticated())
                .addFilterBefore(accessTokenFilter, UsernamePasswordAuthenticationFilter.class);
        } else {
            log.warn("⚠️ No access token configured, REST API and MCP endpoint are open");
            http.authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
        }

        return http.build();
    }

    /**
     * Keep the servlet container from registering the filter a second time outside the security chain
     */
    @Bean
    public FilterRegistrationBean<AccessTokenAuthenticationFilter> accessTokenFilterRegistration() {
        FilterRegistrationBean<AccessTokenAuthenticationFilter> registration =
            new FilterRegistrationBean<>(accessTokenFilter);
        registration.setEnabled(false);
        return registration;
    }
}
