package com.streamfirst.querycache.domain;

/**
 * The table names of a schema owner could not be listed. This is a setup defect, not a data
 * condition, and is always propagated to the caller.
 */
public class SchemaEnumerationException extends IllegalStateException {

    private final SchemaOwnerId schemaOwner;

    public SchemaEnumerationException(SchemaOwnerId schemaOwner, String message, Throwable cause) {
        super("Failed to enumerate resources of schema owner " + schemaOwner + ": " + message, cause);
        this.schemaOwner = schemaOwner;
    }

    public SchemaOwnerId getSchemaOwner() {
        return schemaOwner;
    }
}
