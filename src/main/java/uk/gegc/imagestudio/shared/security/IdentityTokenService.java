package uk.gegc.imagestudio.shared.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.List;
import java.util.Optional;

/**
 * Verifies identity tokens minted by the external identity provider.
 * Tokens are HMAC-signed JWTs; {@code sub} carries the user id and a boolean claim marks administrators.
 */
@Component
@Slf4j
public class IdentityTokenService {

    public static final String ROLE_USER = "ROLE_USER";
    public static final String ROLE_ADMIN = "ROLE_ADMIN";

    @Value("${identity.token.secret}")
    private String base64secret;

    @Value("${identity.token.admin-claim:admin}")
    private String adminClaim;

    private SecretKey key;

    @PostConstruct
    public void init() {
        byte[] keyBytes = Decoders.BASE64.decode(base64secret);
        this.key = Keys.hmacShaKeyFor(keyBytes);
    }

    public Optional<AuthenticatedIdentity> verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String userId = claims.getSubject();
            if (userId == null || userId.isBlank()) {
                log.warn("Identity token missing subject");
                return Optional.empty();
            }
            boolean privileged = Boolean.TRUE.equals(claims.get(adminClaim, Boolean.class));
            String email = claims.get("email", String.class);
            return Optional.of(new AuthenticatedIdentity(userId, privileged, email));
        } catch (ExpiredJwtException ex) {
            log.debug("Identity token is expired: {}", ex.getMessage());
            return Optional.empty();
        } catch (MalformedJwtException ex) {
            log.warn("Malformed identity token received: {}", ex.getMessage());
            return Optional.empty();
        } catch (SignatureException ex) {
            log.warn("Invalid identity token signature detected: {}", ex.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException ex) {
            log.warn("Illegal argument passed to token parser: {}", ex.getMessage());
            return Optional.empty();
        } catch (JwtException ex) {
            log.error("Unexpected token exception: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    public Authentication toAuthentication(AuthenticatedIdentity identity) {
        List<SimpleGrantedAuthority> authorities = identity.privileged()
                ? List.of(new SimpleGrantedAuthority(ROLE_USER), new SimpleGrantedAuthority(ROLE_ADMIN))
                : List.of(new SimpleGrantedAuthority(ROLE_USER));
        return new UsernamePasswordAuthenticationToken(identity, null, authorities);
    }
}
