package uk.gegc.imagestudio.shared.security;

import org.springframework.security.access.AccessDeniedException;

import java.security.Principal;

/**
 * The caller as asserted by a verified identity token.
 *
 * @param userId     opaque identifier issued by the identity provider
 * @param privileged administrators bypass rate limits and are never charged
 * @param email      optional, used to pre-fill payment checkout
 */
public record AuthenticatedIdentity(String userId, boolean privileged, String email) implements Principal {

    public static AuthenticatedIdentity user(String userId) {
        return new AuthenticatedIdentity(userId, false, null);
    }

    public static AuthenticatedIdentity admin(String userId) {
        return new AuthenticatedIdentity(userId, true, null);
    }

    @Override
    public String getName() {
        return userId;
    }

    /**
     * Resolves which user a request acts on. Regular callers may only act on themselves;
     * privileged callers may name any user.
     */
    public String resolveTargetUser(String requestedUserId) {
        if (requestedUserId == null || requestedUserId.isBlank() || requestedUserId.equals(userId)) {
            return userId;
        }
        if (!privileged) {
            throw new AccessDeniedException("You may only access your own account");
        }
        return requestedUserId;
    }
}
