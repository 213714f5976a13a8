package uk.gegc.imagestudio.shared.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

@Slf4j
public class IdentityAuthenticationFilter extends OncePerRequestFilter {

    static final String USER_ID_MDC_KEY = "user_id";

    private final IdentityTokenService identityTokenService;

    public IdentityAuthenticationFilter(IdentityTokenService identityTokenService) {
        this.identityTokenService = identityTokenService;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response, @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        boolean identified = false;

        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            String token = authHeader.substring(7);
            Optional<AuthenticatedIdentity> identity = identityTokenService.verify(token);
            if (identity.isPresent()) {
                SecurityContextHolder.getContext().setAuthentication(identityTokenService.toAuthentication(identity.get()));
                MDC.put(USER_ID_MDC_KEY, identity.get().userId());
                identified = true;
                log.debug("Authenticated caller {}", identity.get().userId());
            } else {
                log.warn("Invalid identity token received from IP: {}, URI: {}, User-Agent: {}",
                        request.getRemoteAddr(),
                        request.getRequestURI(),
                        request.getHeader("User-Agent"));
            }
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            if (identified) {
                MDC.remove(USER_ID_MDC_KEY);
            }
        }
    }
}
