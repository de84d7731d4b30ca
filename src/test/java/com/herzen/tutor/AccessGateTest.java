package com.herzen.tutor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.tutor.access.AccessGate;
import com.herzen.tutor.access.AccessModels.CallerRole;
import com.herzen.tutor.access.AccessModels.Identity;
import com.herzen.tutor.access.JwtTokenVerifier;
import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.error.AuthException;
import com.herzen.tutor.error.AuthorizationException;
import com.herzen.tutor.support.MutableClock;
import com.herzen.tutor.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AccessGateTest {
    private MutableClock clock;
    private AccessGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2030-02-01T08:00:00Z"));
        TutorProperties properties = new TutorProperties();
        properties.getAccess().setJwtSecret(TestTokens.SECRET);
        properties.getAccess().setAdminEmails("Admin@School.test, other-admin@school.test");
        gate = new AccessGate(new JwtTokenVerifier(new ObjectMapper(), properties, clock), properties, clock);
    }

    @Test
    void resolvesStudentIdentity() {
        Identity identity = gate.authenticate(TestTokens.student(clock, "st-1"));
        assertEquals("st-1", identity.subjectId());
        assertEquals(CallerRole.STUDENT, identity.role());
        assertEquals("st-1@school.test", identity.email());
    }

    @Test
    void resolvesAdminFromAllowListCaseInsensitively() {
        Identity identity = gate.authenticate(TestTokens.bearer(TestTokens.admin(clock)));
        assertEquals(CallerRole.ADMIN, identity.role());
        assertTrue(identity.isAdmin());
    }

    @Test
    void rejectsMissingMalformedAndForgedCredentials() {
        assertThrows(AuthException.class, () -> gate.authenticate(null));
        assertThrows(AuthException.class, () -> gate.authenticate("Bearer "));
        assertThrows(AuthException.class, () -> gate.authenticate("not-a-token"));

        String token = TestTokens.student(clock, "st-2");
        int sig = token.lastIndexOf('.') + 1;
        String tampered = token.substring(0, sig) + (token.charAt(sig) == 'A' ? 'B' : 'A') + token.substring(sig + 1);
        assertThrows(AuthException.class, () -> gate.authenticate(tampered));

        Map<String, Object> claims = claims("st-2", clock.instant().getEpochSecond() + 3600);
        assertThrows(AuthException.class, () -> gate.authenticate(TestTokens.sign(Map.of("alg", "HS256"), claims, "wrong-secret")));
        assertThrows(AuthException.class, () -> gate.authenticate(TestTokens.sign(Map.of("alg", "none"), claims, TestTokens.SECRET)));
    }

    @Test
    void rejectsExpiredTokensEvenWhenCached() {
        String token = TestTokens.student(clock, "st-3");
        assertNotNull(gate.authenticate(token));
        clock.advance(Duration.ofHours(2));
        assertThrows(AuthException.class, () -> gate.authenticate(token));
    }

    @Test
    void rejectsTokensWithoutExpiryOrSubject() {
        Map<String, Object> noExp = claims("st-4", null);
        assertThrows(AuthException.class, () -> gate.authenticate(TestTokens.sign(Map.of("alg", "HS256"), noExp, TestTokens.SECRET)));
        Map<String, Object> noSubject = claims(null, clock.instant().getEpochSecond() + 3600);
        assertThrows(AuthException.class, () -> gate.authenticate(TestTokens.sign(Map.of("alg", "HS256"), noSubject, TestTokens.SECRET)));
    }

    @Test
    void revokedTokensCannotBeReused() {
        String token = TestTokens.student(clock, "st-5");
        gate.authenticate(token);
        gate.revoke(TestTokens.bearer(token));
        AuthException e = assertThrows(AuthException.class, () -> gate.authenticate(token));
        assertEquals("Token has been revoked", e.getMessage());
        assertNotNull(gate.authenticate(TestTokens.student(clock, "st-5")));
    }

    @Test
    void enforcesScopes() {
        Identity student = gate.authenticate(TestTokens.student(clock, "st-6"));
        Identity admin = gate.authenticate(TestTokens.admin(clock));

        assertThrows(AuthorizationException.class, () -> gate.requireAdmin(student));
        assertThrows(AuthorizationException.class, () -> gate.requireSelfOrAdmin(student, "someone-else"));
        assertDoesNotThrow(() -> gate.requireSelfOrAdmin(student, "st-6"));
        assertDoesNotThrow(() -> gate.requireAdmin(admin));
        assertDoesNotThrow(() -> gate.requireSelfOrAdmin(admin, "st-6"));
    }

    private Map<String, Object> claims(String subject, Long exp) {
        Map<String, Object> claims = new LinkedHashMap<>();
        if (subject != null) claims.put("sub", subject);
        claims.put("iat", clock.instant().getEpochSecond());
        if (exp != null) claims.put("exp", exp);
        return claims;
    }
}
