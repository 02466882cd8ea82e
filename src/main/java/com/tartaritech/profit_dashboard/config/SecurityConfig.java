package com.tartaritech.profit_dashboard.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Single dashboard account over HTTP Basic. The push endpoints used by the sync jobs are
 * authenticated with the X-API-Key header instead, see {@code SyncApiKeyValidator}.
 */
@Configuration
public class SecurityConfig {

    private final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);

    @Value("${dashboard.auth.username:admin}")
    private String username;

    @Value("${dashboard.auth.password-hash:}")
    private String passwordHash;

    @Value("${dashboard.auth.password:}")
    private String password;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .cors(Customizer.withDefaults())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/orders/push", "/api/metrics/push").permitAll()
                        .anyRequest().authenticated())
                .httpBasic(Customizer.withDefaults());
        return http.build();
    }

    @Bean
    public UserDetailsService userDetailsService(PasswordEncoder passwordEncoder) {
        String encoded = passwordHash;
        if (encoded == null || encoded.isBlank()) {
            if (password == null || password.isBlank()) {
                throw new IllegalStateException(
                        "Either dashboard.auth.password-hash or dashboard.auth.password must be set");
            }
            logger.warn("dashboard.auth.password-hash is not set, hashing the plain dashboard.auth.password at startup");
            encoded = passwordEncoder.encode(password);
        }

        return new InMemoryUserDetailsManager(User.withUsername(username)
                .password(encoded)
                .roles("ADMIN")
                .build());
    }
}
