package com.community.tracker.exception;

import org.springframework.http.HttpStatus;

/**
 * 错误类型，以及 REST 层对应返回的 HTTP 状态码
 */
public enum ErrorKind {
    UNKNOWN_COMMUNITY(HttpStatus.NOT_FOUND),
    ALREADY_LINKED(HttpStatus.CONFLICT),
    HANDLE_NOT_FOUND(HttpStatus.NOT_FOUND),
    ALREADY_SELECTED(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** 进度回退：只作为观测结果返回，不会抛出 */
    STALE_WRITE(HttpStatus.OK),
    NOT_LINKED(HttpStatus.NOT_FOUND),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    DUPLICATE_DEFINITION(HttpStatus.CONFLICT),
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),
    UPSTREAM_UNAVAILABLE(HttpStatus.BAD_GATEWAY);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
