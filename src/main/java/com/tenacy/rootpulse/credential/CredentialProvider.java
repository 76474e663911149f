package com.tenacy.rootpulse.credential;

public interface CredentialProvider {

    /**
     * 유효한 자격 증명 반환. 필요하면 갱신한다.
     *
     * @throws com.tenacy.rootpulse.exception.CredentialException 획득 실패
     */
    LogStoreCredentials getValidCredentials();
}
