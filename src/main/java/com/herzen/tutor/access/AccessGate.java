package com.herzen.tutor.access;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.herzen.tutor.access.AccessModels.CallerRole;
import com.herzen.tutor.access.AccessModels.Identity;
import com.herzen.tutor.access.AccessModels.VerifiedToken;
import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.error.AuthException;
import com.herzen.tutor.error.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

@Component
@Slf4j
public class AccessGate {
    private static final String BEARER = "Bearer ";

    private final JwtTokenVerifier verifier;
    private final Clock clock;
    private final Set<String> adminEmails;
    private final Cache<String, VerifiedToken> verified;
    private final Cache<String, Instant> revoked;

    public AccessGate(JwtTokenVerifier verifier, TutorProperties properties, Clock clock) {
        this.verifier = verifier;
        this.clock = clock;
        TutorProperties.Access props = properties.getAccess();
        this.adminEmails = props.getAdminEmailSet();
        this.verified = Caffeine.newBuilder()
                .maximumSize(props.getVerificationCacheSize())
                .expireAfterWrite(props.getVerificationCacheTtl())
                .build();
        this.revoked = Caffeine.newBuilder()
                .maximumSize(props.getRevocationCacheSize())
                .expireAfter(new UntilTokenExpiry(clock))
                .build();
    }

    public Identity authenticate(String credential) {
        String token = stripBearer(credential);
        VerifiedToken claims = verified.getIfPresent(token);
        if (claims == null) {
            claims = verifier.verify(token);
            verified.put(token, claims);
        } else {
            verifier.checkTimes(claims.issuedAt(), claims.expiresAt());
        }
        if (revoked.getIfPresent(revocationKey(token, claims)) != null) {
            throw new AuthException("Token has been revoked");
        }
        return new Identity(claims.subjectId(), claims.email(), claims.name(), resolveRole(claims.email()), claims.expiresAt());
    }

    /**
     * Rejects the credential for the rest of its lifetime.
     */
    public void revoke(String credential) {
        String token = stripBearer(credential);
        Identity identity = authenticate(token);
        VerifiedToken claims = verifier.verify(token);
        revoked.put(revocationKey(token, claims), claims.expiresAt());
        verified.invalidate(token);
        log.info("Token revoked [subject={}]", identity.subjectId());
    }

    public void requireAdmin(Identity identity) {
        Objects.requireNonNull(identity, "identity");
        if (!identity.isAdmin()) {
            throw new AuthorizationException("Admin access required");
        }
    }

    public void requireSelfOrAdmin(Identity identity, String studentId) {
        Objects.requireNonNull(identity, "identity");
        if (identity.isAdmin()) return;
        if (studentId == null || !studentId.equals(identity.subjectId())) {
            throw new AuthorizationException("Students may only access their own conversation data");
        }
    }

    private CallerRole resolveRole(String email) {
        if (email != null && adminEmails.contains(email.trim().toLowerCase(Locale.ROOT))) return CallerRole.ADMIN;
        return CallerRole.STUDENT;
    }

    private static String stripBearer(String credential) {
        if (credential == null || credential.isBlank()) throw new AuthException("No token provided");
        String c = credential.trim();
        if (c.regionMatches(true, 0, BEARER, 0, BEARER.length())) c = c.substring(BEARER.length()).trim();
        if (c.isEmpty()) throw new AuthException("No token provided");
        return c;
    }

    private static String revocationKey(String token, VerifiedToken claims) {
        return claims.tokenId() != null ? "jti:" + claims.tokenId() : "tok:" + token;
    }

    private static final class UntilTokenExpiry implements Expiry<String, Instant> {
        private static final Duration GRACE = Duration.ofMinutes(5);
        private static final Duration MAX_RETENTION = Duration.ofDays(30);

        private final Clock clock;

        private UntilTokenExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, Instant expiresAt, long currentTime) {
            Duration left = Duration.between(clock.instant(), expiresAt).plus(GRACE);
            if (left.isNegative()) return 0L;
            return left.compareTo(MAX_RETENTION) > 0 ? MAX_RETENTION.toNanos() : left.toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Instant expiresAt, long currentTime, long currentDuration) {
            return expireAfterCreate(key, expiresAt, currentTime);
        }

        @Override
        public long expireAfterRead(String key, Instant expiresAt, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
