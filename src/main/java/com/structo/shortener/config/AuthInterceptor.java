package com.structo.shortener.config;

import com.structo.shortener.service.JwtService;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Exposes the caller's user id as the {@code userId} request attribute when a valid bearer token is
 * present. Requests without one pass through anonymously; controllers decide whether identity is required.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthInterceptor implements HandlerInterceptor {

    public static final String USER_ID_ATTRIBUTE = "userId";

    private final JwtService jwtService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (request.getMethod().equals("OPTIONS")) return true;

        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            String token = authHeader.substring(7);
            try {
                request.setAttribute(USER_ID_ATTRIBUTE, jwtService.extractUserId(token));
            } catch (JwtException | IllegalArgumentException e) {
                log.debug("Ignoring invalid bearer token: {}", e.getMessage());
            }
        }
        return true;
    }
}
