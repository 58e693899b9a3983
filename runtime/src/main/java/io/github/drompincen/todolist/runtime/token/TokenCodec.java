package io.github.drompincen.todolist.runtime.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes a claims map into a signed JWT and verifies it back.
 * Signing material comes from {@link TokenProperties}; the codec refuses to be created without it.
 * The bean is lazy, so the todo endpoints start without token configuration and the check runs
 * when a caller first asks for the codec.
 * <p>
 * Integral claim values travel as {@code Long} and decimals as {@code Double}: an {@code Integer}
 * claim is widened on encode, and {@code decode(encode(m)).equals(m)} holds for any map whose
 * numbers already use those two types.
 */
@Lazy
@Service
public class TokenCodec {

    private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);
    private static final TypeReference<LinkedHashMap<String, Object>> CLAIMS_TYPE = new TypeReference<>() {};

    private final Algorithm algorithm;
    private final JWTVerifier verifier;
    private final ObjectReader claimsReader;

    public TokenCodec(TokenProperties properties, ObjectMapper objectMapper) {
        this.algorithm = resolveAlgorithm(properties);
        this.verifier = JWT.require(algorithm).build();
        this.claimsReader = objectMapper.readerFor(CLAIMS_TYPE).with(DeserializationFeature.USE_LONG_FOR_INTS);
        log.info("Token codec ready with {}", algorithm.getName());
    }

    public String encode(Map<String, ?> claims) {
        try {
            return JWT.create().withPayload(widen(claims)).sign(algorithm);
        } catch (JWTCreationException e) {
            throw new IllegalArgumentException("Claims cannot be signed: " + e.getMessage(), e);
        }
    }

    public Map<String, Object> decode(String token) {
        DecodedJWT jwt;
        try {
            jwt = verifier.verify(token);
        } catch (JWTVerificationException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw new InvalidTokenException(e.getMessage(), e);
        }
        try {
            return claimsReader.readValue(Base64.getUrlDecoder().decode(jwt.getPayload()));
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidTokenException("Token payload is not a JSON object", e);
        }
    }

    private static Map<String, Object> widen(Map<String, ?> claims) {
        Map<String, Object> widened = new LinkedHashMap<>();
        claims.forEach((key, value) -> widened.put(key, widenValue(value)));
        return widened;
    }

    @SuppressWarnings("unchecked")
    private static Object widenValue(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof Map) {
            return widen((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<Object> widened = new ArrayList<>();
            for (Object item : (List<?>) value) {
                widened.add(widenValue(item));
            }
            return widened;
        }
        return value;
    }

    static Algorithm resolveAlgorithm(TokenProperties properties) {
        if (properties == null || isBlank(properties.algorithm())) {
            throw new IllegalStateException("todo.token.algorithm (JWT_ALGORITHM) is not configured");
        }
        if (isBlank(properties.secret())) {
            throw new IllegalStateException("todo.token.secret (SECRET_KEY) is not configured");
        }
        String secret = properties.secret();
        switch (properties.algorithm().trim().toUpperCase()) {
            case "HS256": return Algorithm.HMAC256(secret);
            case "HS384": return Algorithm.HMAC384(secret);
            case "HS512": return Algorithm.HMAC512(secret);
            default:
                throw new IllegalStateException("Unsupported token algorithm: " + properties.algorithm());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
