package com.di.logsift.store;

/**
 * Per-item outcome of a bulk request, in request order.
 */
public record BulkItemResult(String index, String id, int status, String errorType, String errorReason) {

    public static BulkItemResult ok(String index, String id, int status) {
        return new BulkItemResult(index, id, status, null, null);
    }

    public static BulkItemResult failed(String index, String id, int status, String errorType, String errorReason) {
        return new BulkItemResult(index, id, status, errorType, errorReason);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isConflict() {
        return status == StoreException.CONFLICT;
    }

    public boolean isTransientFailure() {
        return StoreException.isTransientStatus(status) || status == StoreException.NO_RESPONSE;
    }

    public String describeError() {
        return "status=" + status + (errorType != null ? " type=" + errorType : "") + (errorReason != null ? " reason=" + errorReason : "");
    }
}
