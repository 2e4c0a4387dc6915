package io.seriescache.batch;

/** How an emitted batch is materialized. */
public enum LayoutMode {
    /** field name mapped to the ordered values of that field */
    COLUMN,
    /** ordered list of records */
    ROW
}
