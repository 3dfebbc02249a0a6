package org.holdem.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/** Puts the token's player id in the security context; no user lookup. */
@Component
@RequiredArgsConstructor
public class JwtFilter extends OncePerRequestFilter {

    private final JwtUtil jwtUtil;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String token = bearer(request.getHeader("Authorization"));
        if (token == null) token = request.getParameter("token");

        if (token != null && jwtUtil.validateToken(token)) {
            String playerId = jwtUtil.extractSubject(token);
            var auth = new UsernamePasswordAuthenticationToken(playerId, null, List.of());
            SecurityContextHolder.getContext().setAuthentication(auth);
        }
        filterChain.doFilter(request, response);
    }

    static String bearer(String header) {
        if (header != null && header.startsWith("Bearer ")) return header.substring(7);
        return null;
    }
}
