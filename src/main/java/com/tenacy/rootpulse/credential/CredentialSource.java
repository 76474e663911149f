package com.tenacy.rootpulse.credential;

@FunctionalInterface
public interface CredentialSource {

    LogStoreCredentials fetch();
}
