package com.theset.setlist.domain.model;

/**
 * Tagged result of a single store write.
 * row is the persisted row when the store returned one, otherwise null.
 */
public record WriteOutcome<T>(
        Status status,
        T row,
        Throwable cause
) {
    public enum Status {
        WRITTEN,
        PERMISSION_DENIED,
        FAILED
    }

    public static <T> WriteOutcome<T> written(T row) {
        return new WriteOutcome<>(Status.WRITTEN, row, null);
    }

    public static <T> WriteOutcome<T> permissionDenied(Throwable cause) {
        return new WriteOutcome<>(Status.PERMISSION_DENIED, null, cause);
    }

    public static <T> WriteOutcome<T> failed(Throwable cause) {
        return new WriteOutcome<>(Status.FAILED, null, cause);
    }

    public boolean isWritten() {
        return status == Status.WRITTEN;
    }

    public boolean isPermissionDenied() {
        return status == Status.PERMISSION_DENIED;
    }

    public String describeFailure() {
        if (cause == null) {
            return status.name();
        }
        return status + ": " + cause.getMessage();
    }
}
