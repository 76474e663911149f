package com.tenacy.rootpulse.exception;

public class CredentialException extends RootCauseException {

    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "CREDENTIAL_ERROR";
    }
}
