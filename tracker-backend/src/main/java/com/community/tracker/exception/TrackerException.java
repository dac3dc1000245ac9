package com.community.tracker.exception;

/**
 * 业务异常。调用方根据 {@link ErrorKind} 生成面向用户的提示；
 * 抛出时已存数据不会处于半更新状态。
 */
public class TrackerException extends RuntimeException {

    private final ErrorKind kind;

    public TrackerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TrackerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static TrackerException unknownCommunity(Long communityId) {
        return new TrackerException(ErrorKind.UNKNOWN_COMMUNITY, "Community " + communityId + " is not configured");
    }

    public static TrackerException alreadyLinked(String handle) {
        return new TrackerException(ErrorKind.ALREADY_LINKED, "Handle " + handle + " is already linked");
    }

    public static TrackerException handleNotFound(String handle) {
        return new TrackerException(ErrorKind.HANDLE_NOT_FOUND, "No catalog profile named " + handle);
    }

    public static TrackerException alreadySelected(String definitionKey) {
        return new TrackerException(ErrorKind.ALREADY_SELECTED, "Challenge " + definitionKey + " is already selected");
    }

    public static TrackerException notFound(String what) {
        return new TrackerException(ErrorKind.NOT_FOUND, what + " not found");
    }

    public static TrackerException notLinked(Long personId) {
        return new TrackerException(ErrorKind.NOT_LINKED, "Person " + personId + " has no linked profile");
    }

    public static TrackerException permissionDenied(String message) {
        return new TrackerException(ErrorKind.PERMISSION_DENIED, message);
    }

    public static TrackerException duplicateDefinition(String definitionKey) {
        return new TrackerException(ErrorKind.DUPLICATE_DEFINITION, "Challenge definition " + definitionKey + " already exists");
    }

    public static TrackerException invalidArgument(String message) {
        return new TrackerException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static TrackerException upstreamUnavailable(String message, Throwable cause) {
        return new TrackerException(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
