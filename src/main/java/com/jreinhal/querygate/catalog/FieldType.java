package com.jreinhal.querygate.catalog;

/**
 * Storage type of a catalog field whose stored form differs from the JSON a translator writes.
 * Untyped fields are compared as written.
 */
public enum FieldType {
    /** Stored as a BSON date; queried with ISO-8601 strings. */
    DATE,
    /** Stored as an ObjectId (or its hex string in older documents); queried with 24-hex strings. */
    OBJECT_ID
}
