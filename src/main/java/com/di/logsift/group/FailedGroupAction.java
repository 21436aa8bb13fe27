package com.di.logsift.group;

import com.di.logsift.store.BulkOperation;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One line of the failed-groups file: a group merge that could not be applied, with the
 * store's error. Replaying it re-sends the same merge.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FailedGroupAction(@JsonProperty("_op_type") String opType,
                                @JsonProperty("_index") String index,
                                @JsonProperty("_id") String id,
                                @JsonProperty("retry_on_conflict") int retryOnConflict,
                                @JsonProperty("params") Map<String, Object> params,
                                @JsonProperty("upsert") Map<String, Object> upsert,
                                @JsonProperty("error") String error) {

    static final String OP_TYPE = "update";

    public static FailedGroupAction of(BulkOperation operation, String error) {
        return new FailedGroupAction(OP_TYPE, operation.getIndex(), operation.getId(), operation.getRetryOnConflict(),
                operation.getParams(), operation.getUpsert(), error);
    }

    public BulkOperation toOperation() {
        return BulkOperation.scriptedUpsert(index, id, GroupMergeScript.INSTANCE, params, upsert, retryOnConflict);
    }
}
