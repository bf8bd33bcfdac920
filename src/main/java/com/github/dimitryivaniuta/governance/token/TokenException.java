package com.github.dimitryivaniuta.governance.token;

import lombok.Getter;

@Getter
public class TokenException extends RuntimeException {

    private final TokenFailure failure;

    public TokenException(TokenFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public TokenException(TokenFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
