package com.herzen.tutor.support;

import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Signs HS256 tokens the way the learning platform's issuer does.
 */
public final class TestTokens {
    public static final String SECRET = "test-secret-for-hs256-signing-0123456789";
    public static final String ADMIN_EMAIL = "admin@school.test";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Base64.Encoder URL = Base64.getUrlEncoder().withoutPadding();

    private TestTokens() {}

    public static String student(Clock clock, String studentId) {
        return forSubject(clock, studentId, studentId + "@school.test");
    }

    public static String admin(Clock clock) {
        return forSubject(clock, "admin-1", ADMIN_EMAIL);
    }

    public static String forSubject(Clock clock, String subject, String email) {
        long now = clock.instant().getEpochSecond();
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("student_id", subject);
        claims.put("email", email);
        claims.put("name", "User " + subject);
        claims.put("iat", now);
        claims.put("exp", now + Duration.ofHours(1).toSeconds());
        claims.put("jti", UUID.randomUUID().toString());
        return sign(Map.of("alg", "HS256", "typ", "JWT"), claims, SECRET);
    }

    public static String sign(Map<String, Object> header, Map<String, Object> claims, String secret) {
        try {
            String signingInput = URL.encodeToString(MAPPER.writeValueAsBytes(header)) + "."
                    + URL.encodeToString(MAPPER.writeValueAsBytes(claims));
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return signingInput + "." + URL.encodeToString(mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    public static String bearer(String token) {
        return "Bearer " + token;
    }
}
