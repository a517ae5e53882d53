package com.streamfirst.querycache.domain;

import java.util.Objects;

/**
 * Identifies the data model a command was issued against. Resource catalogs are scoped to this
 * identity, so two owners never share a set of known table names.
 *
 * @param name stable name of the schema owner (e.g., a context class name, "sales-db")
 */
public record SchemaOwnerId(String name) {
    public SchemaOwnerId {
        Objects.requireNonNull(name, "Schema owner name cannot be null");

        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Schema owner name cannot be empty");
        }
    }

    /**
     * Creates an identity for a data model represented by a type, one catalog per type.
     */
    public static SchemaOwnerId of(Class<?> ownerType) {
        Objects.requireNonNull(ownerType, "Schema owner type cannot be null");
        return new SchemaOwnerId(ownerType.getName());
    }

    @Override
    public String toString() {
        return name;
    }
}
