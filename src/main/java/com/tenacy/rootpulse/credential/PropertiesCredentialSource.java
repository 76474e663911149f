package com.tenacy.rootpulse.credential;

import com.tenacy.rootpulse.config.CredentialProperties;
import com.tenacy.rootpulse.exception.CredentialException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * 설정(환경 변수 포함)에 주어진 키로 자격 증명을 발급한다.
 */
@Component
@RequiredArgsConstructor
public class PropertiesCredentialSource implements CredentialSource {

    private final CredentialProperties properties;
    private final Clock clock;

    @Override
    public LogStoreCredentials fetch() {
        Instant expiresAt = clock.instant().plus(properties.getTtl());

        LogStoreCredentials credentials = LogStoreCredentials.builder()
                .accessKeyId(properties.getAccessKeyId())
                .accessKeySecret(properties.getAccessKeySecret())
                .securityToken(properties.getSecurityToken())
                .expiresAt(expiresAt)
                .build();

        if (credentials.isAnonymous()) {
            if (properties.isRequired()) {
                throw new CredentialException("Missing required credentials: "
                        + "rootpulse.credentials.access-key-id / access-key-secret or security-token");
            }
            return LogStoreCredentials.anonymous(expiresAt);
        }

        if (!credentials.isValid()) {
            throw new CredentialException("Incomplete credentials: access key id and secret must be set together");
        }
        return credentials;
    }
}
