package com.herzen.tutor.access;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.error.AuthException;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

@Component
public class JwtTokenVerifier {
    private static final String ALGORITHM = "HmacSHA256";
    private static final TypeReference<Map<String, Object>> CLAIMS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final TutorProperties.Access props;
    private final Clock clock;

    public JwtTokenVerifier(ObjectMapper objectMapper, TutorProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.props = properties.getAccess();
        this.clock = clock;
    }

    public AccessModels.VerifiedToken verify(String token) {
        if (token == null || token.isBlank()) throw new AuthException("No token provided");
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
            throw new AuthException("Malformed token");
        }

        Map<String, Object> header = decodeJson(parts[0]);
        if (!"HS256".equals(header.get("alg"))) throw new AuthException("Unsupported token algorithm");

        byte[] expected = sign(parts[0] + "." + parts[1]);
        byte[] actual;
        try {
            actual = Base64.getUrlDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new AuthException("Malformed token signature");
        }
        if (!MessageDigest.isEqual(expected, actual)) throw new AuthException("Invalid token signature");

        Map<String, Object> claims = decodeJson(parts[1]);
        String subject = firstString(claims, "student_id", "sub");
        if (subject == null || subject.isBlank()) throw new AuthException("Token has no subject");

        Instant expiresAt = epochClaim(claims, "exp");
        if (expiresAt == null) throw new AuthException("Token has no expiry");
        Instant issuedAt = epochClaim(claims, "iat");

        checkTimes(issuedAt, expiresAt);
        return new AccessModels.VerifiedToken(subject, firstString(claims, "email"), firstString(claims, "name"),
                firstString(claims, "jti"), issuedAt, expiresAt);
    }

    void checkTimes(Instant issuedAt, Instant expiresAt) {
        Instant now = clock.instant();
        Duration skew = props.getClockSkew();
        if (!now.isBefore(expiresAt.plus(skew))) throw new AuthException("Token expired");
        if (issuedAt != null) {
            if (issuedAt.isAfter(now.plus(skew))) throw new AuthException("Token issued in the future");
            if (issuedAt.plus(props.getMaxTokenAge()).isBefore(now)) throw new AuthException("Token expired");
        }
    }

    private byte[] sign(String signingInput) {
        String secret = props.getJwtSecret();
        if (secret == null || secret.isBlank()) throw new AuthException("Token verification is not configured");
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private Map<String, Object> decodeJson(String segment) {
        try {
            byte[] json = Base64.getUrlDecoder().decode(segment);
            Map<String, Object> map = objectMapper.readValue(json, CLAIMS);
            if (map == null) throw new AuthException("Malformed token");
            return map;
        } catch (IllegalArgumentException | IOException e) {
            throw new AuthException("Malformed token");
        }
    }

    private static String firstString(Map<String, Object> claims, String... names) {
        for (String name : names) {
            Object v = claims.get(name);
            if (v != null) return v.toString();
        }
        return null;
    }

    private static Instant epochClaim(Map<String, Object> claims, String name) {
        Object v = claims.get(name);
        if (v == null) return null;
        if (v instanceof Number) return Instant.ofEpochSecond(((Number) v).longValue());
        throw new AuthException("Malformed token claim: " + name);
    }
}
