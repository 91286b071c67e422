package com.chaincollector.exception;

public class CredentialsException extends BaseException {

    public CredentialsException(String message) {
        super(ErrorCode.CREDENTIALS_ERROR, message);
    }

    public CredentialsException(String message, Throwable cause) {
        super(ErrorCode.CREDENTIALS_ERROR, message, cause);
    }
}
