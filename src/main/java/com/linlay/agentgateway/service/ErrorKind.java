package com.linlay.agentgateway.service;

import org.springframework.http.HttpStatus;

public enum ErrorKind {

    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    UNSUPPORTED_MEDIA_TYPE(HttpStatus.BAD_REQUEST),
    PAYLOAD_TOO_LARGE(HttpStatus.BAD_REQUEST),
    DOWNSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    DOWNSTREAM_TIMEOUT(HttpStatus.REQUEST_TIMEOUT),
    DOWNSTREAM_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
