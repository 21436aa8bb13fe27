package com.di.logsift.store;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One action of a bulk request.
 */
@Value
@Builder(toBuilder = true)
public class BulkOperation {

    public enum Type {
        /** Create or replace by id. */
        INDEX,
        /** Create only; 409 when the id exists. */
        CREATE,
        /** Merge {@link #document} into an existing document; 404 when missing. */
        UPDATE_DOC,
        /** Run {@link #script} on the existing document, or store {@link #upsert} when missing. */
        SCRIPTED_UPSERT
    }

    Type type;
    String index;
    String id;
    Map<String, Object> document;
    MergeScript script;
    Map<String, Object> params;
    Map<String, Object> upsert;
    int retryOnConflict;

    public static BulkOperation index(String index, String id, Map<String, Object> document) {
        return BulkOperation.builder().type(Type.INDEX).index(index).id(id).document(document).build();
    }

    public static BulkOperation create(String index, String id, Map<String, Object> document) {
        return BulkOperation.builder().type(Type.CREATE).index(index).id(id).document(document).build();
    }

    public static BulkOperation updateDoc(String index, String id, Map<String, Object> partial) {
        return BulkOperation.builder().type(Type.UPDATE_DOC).index(index).id(id).document(partial).build();
    }

    public static BulkOperation scriptedUpsert(String index, String id, MergeScript script,
                                               Map<String, Object> params, Map<String, Object> upsert,
                                               int retryOnConflict) {
        return BulkOperation.builder()
                .type(Type.SCRIPTED_UPSERT)
                .index(index)
                .id(id)
                .script(script)
                .params(params)
                .upsert(upsert)
                .retryOnConflict(retryOnConflict)
                .build();
    }
}
