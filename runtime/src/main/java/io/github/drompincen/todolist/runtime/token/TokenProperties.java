package io.github.drompincen.todolist.runtime.token;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Signing configuration shared by every token the service issues.
 *
 * @param algorithm JWS algorithm name, one of HS256, HS384 or HS512
 * @param secret    shared HMAC secret
 */
@ConfigurationProperties(prefix = "todo.token")
public record TokenProperties(String algorithm, String secret) {

    @Override
    public String toString() {
        return "TokenProperties[algorithm=" + algorithm + ", secret=***]";
    }
}
