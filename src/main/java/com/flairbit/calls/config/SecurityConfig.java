package com.flairbit.calls.config;

import com.flairbit.calls.filter.AuthFilter;
import com.flairbit.calls.filter.JwtAuthenticationEntryPoint;
import com.flairbit.calls.security.CurrentActor;
import com.flairbit.calls.security.FlairbitTokenVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final AuthFilter authFilter;
    private final JwtAuthenticationEntryPoint unauthorizedHandler;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .authorizeHttpRequests(auth -> auth
                // the STOMP CONNECT frame is authenticated in WebSocketConfig
                .requestMatchers("/actuator/health", "/ws/**").permitAll()
                .requestMatchers("/api/escalations/rules/**", "/api/settings/**").hasAuthority(CurrentActor.ADMIN_AUTHORITY)
                .requestMatchers(HttpMethod.GET, "/api/events").hasAuthority(CurrentActor.ADMIN_AUTHORITY)
                .requestMatchers(HttpMethod.POST, "/api/access/grants").hasAuthority(CurrentActor.ADMIN_AUTHORITY)
                .requestMatchers(HttpMethod.DELETE, "/api/access/grants/**").hasAuthority(CurrentActor.ADMIN_AUTHORITY)
                .requestMatchers("/api/access/legal-holds/**").hasAuthority(CurrentActor.ADMIN_AUTHORITY)
                .requestMatchers("/api/**").hasAuthority(FlairbitTokenVerifier.USER_AUTHORITY)
                .anyRequest().denyAll()
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(unauthorizedHandler))
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(authFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
