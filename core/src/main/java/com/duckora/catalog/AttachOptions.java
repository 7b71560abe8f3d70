package com.duckora.catalog;

/**
 * Options given with an attach, applied over what the target string says.
 *
 * <p>Example:
 * <pre>
 *   AttachOptions.defaults().withReadOnly(true).withSchema("hr").withFetchSize(500)
 * </pre>
 *
 * @param readOnly whether DDL and writes are rejected
 * @param schema schema override, or null to keep the target's
 * @param fetchSize driver row prefetch, or null to keep the target's
 */
public record AttachOptions(boolean readOnly, String schema, Integer fetchSize) {

    public static AttachOptions defaults() {
        return new AttachOptions(false, null, null);
    }

    public AttachOptions withReadOnly(boolean readOnly) {
        return new AttachOptions(readOnly, schema, fetchSize);
    }

    public AttachOptions withSchema(String schema) {
        return new AttachOptions(readOnly, schema, fetchSize);
    }

    public AttachOptions withFetchSize(int fetchSize) {
        return new AttachOptions(readOnly, schema, fetchSize);
    }
}
