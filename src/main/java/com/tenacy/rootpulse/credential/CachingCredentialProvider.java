package com.tenacy.rootpulse.credential;

import com.tenacy.rootpulse.config.CredentialProperties;
import com.tenacy.rootpulse.exception.CredentialException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * 자격 증명을 캐시하고 만료가 가까워지면 다시 발급받는다.
 */
@Service
@Slf4j
public class CachingCredentialProvider implements CredentialProvider {

    private final CredentialSource credentialSource;
    private final Duration refreshSkew;
    private final Clock clock;

    private LogStoreCredentials cachedCredentials;

    public CachingCredentialProvider(CredentialSource credentialSource,
                                     CredentialProperties properties,
                                     Clock clock) {
        this.credentialSource = credentialSource;
        this.refreshSkew = properties.getRefreshSkew();
        this.clock = clock;
    }

    @Override
    public synchronized LogStoreCredentials getValidCredentials() {
        if (cachedCredentials != null && cachedCredentials.isValid()
                && !cachedCredentials.expiresWithin(clock.instant(), refreshSkew)) {
            return cachedCredentials;
        }

        LogStoreCredentials credentials;
        try {
            credentials = credentialSource.fetch();
        } catch (CredentialException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CredentialException("Failed to acquire log store credentials: " + e.getMessage(), e);
        }

        if (credentials == null || !credentials.isValid()) {
            throw new CredentialException("Credential source returned invalid credentials");
        }

        cachedCredentials = credentials;
        log.info("Log store credentials refreshed, expires at {}", credentials.getExpiresAt());
        return credentials;
    }

    public synchronized void clearCache() {
        cachedCredentials = null;
    }

    public boolean isAvailable() {
        try {
            return getValidCredentials().isValid();
        } catch (CredentialException e) {
            log.warn("자격 증명을 사용할 수 없음: {}", e.getMessage());
            return false;
        }
    }
}
