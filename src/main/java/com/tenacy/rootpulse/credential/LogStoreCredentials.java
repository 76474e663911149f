package com.tenacy.rootpulse.credential;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

@Getter
@Builder
@AllArgsConstructor
@ToString(exclude = {"accessKeySecret", "securityToken"})
public class LogStoreCredentials {

    private final String accessKeyId;
    private final String accessKeySecret;
    private final String securityToken;
    private final Instant expiresAt;

    public static LogStoreCredentials anonymous(Instant expiresAt) {
        return new LogStoreCredentials(null, null, null, expiresAt);
    }

    public boolean isAnonymous() {
        return isBlank(accessKeyId) && isBlank(securityToken);
    }

    /**
     * 키 쌍이 모두 있거나 보안 토큰이 있거나, 익명 자격 증명이면 유효
     */
    public boolean isValid() {
        if (isAnonymous()) {
            return true;
        }
        if (!isBlank(securityToken)) {
            return true;
        }
        return !isBlank(accessKeyId) && !isBlank(accessKeySecret);
    }

    public boolean expiresWithin(Instant now, Duration skew) {
        return expiresAt == null || !now.plus(skew).isBefore(expiresAt);
    }

    /**
     * 로그 저장소 요청에 붙일 Authorization 헤더 값. 익명이면 비어 있다.
     */
    public Optional<String> toAuthorizationHeader() {
        if (!isBlank(securityToken)) {
            return Optional.of("Bearer " + securityToken);
        }
        if (!isBlank(accessKeyId) && !isBlank(accessKeySecret)) {
            String token = Base64.getEncoder().encodeToString(
                    (accessKeyId + ":" + accessKeySecret).getBytes(StandardCharsets.UTF_8));
            return Optional.of("ApiKey " + token);
        }
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
