package com.herzen.tutor.access;

import java.time.Instant;

public class AccessModels {
    public enum CallerRole { STUDENT, ADMIN }

    /**
     * Resolved caller. {@code subjectId} is the learning platform's user id; for a student it is
     * also the only student id the caller may read.
     */
    public record Identity(String subjectId,
                           String email,
                           String displayName,
                           CallerRole role,
                           Instant expiresAt) {
        public boolean isAdmin() {
            return role == CallerRole.ADMIN;
        }
    }

    /** Claims of a token whose signature has been verified. */
    public record VerifiedToken(String subjectId,
                                String email,
                                String name,
                                String tokenId,
                                Instant issuedAt,
                                Instant expiresAt) {}
}
