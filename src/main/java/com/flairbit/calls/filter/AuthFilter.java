package com.flairbit.calls.filter;

import com.flairbit.calls.security.FlairbitTokenVerifier;
import com.flairbit.calls.utils.ErrorUtility;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Objects;

@Slf4j
@Component
public class AuthFilter extends OncePerRequestFilter {

    private final FlairbitTokenVerifier tokenVerifier;

    public AuthFilter(FlairbitTokenVerifier tokenVerifier) {
        this.tokenVerifier = tokenVerifier;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (Objects.nonNull(header) && header.startsWith("Bearer ")) {
            try {
                SecurityContextHolder.getContext().setAuthentication(tokenVerifier.authenticate(header.substring(7)));
            } catch (SecurityException ex) {
                log.debug("Rejected bearer token on {}: {}", request.getRequestURI(), ex.getMessage());
                ErrorUtility.printError(HttpServletResponse.SC_UNAUTHORIZED, "Authentication Failed: " + ex.getMessage(), response);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }
}
