package com.streamfirst.querycache.ports;

import com.streamfirst.querycache.domain.SchemaOwnerId;

import java.util.SortedSet;

/**
 * Port for listing the tables declared by a data model.
 * Results are memoized by the resource catalog, so implementations may be expensive.
 */
public interface SchemaEnumeratorPort {

    /**
     * Lists every table name the schema owner declares.
     *
     * @param schemaOwner the data model to enumerate
     * @return table names, exactly as they appear in generated commands
     * @throws RuntimeException if the schema cannot be enumerated; treated as a configuration error
     */
    SortedSet<String> enumerateResourceNames(SchemaOwnerId schemaOwner);
}
