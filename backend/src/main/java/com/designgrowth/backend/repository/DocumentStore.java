package com.designgrowth.backend.repository;

import com.designgrowth.backend.model.GrowthDocument;

import java.util.List;

/**
 * Uniform create/list access to the entity collections.
 * Services depend on this seam rather than on the Mongo client directly.
 */
public interface DocumentStore {

    /**
     * Inserts the document into its entity's collection.
     *
     * @return the store-assigned id as a string
     */
    <T extends GrowthDocument> String create(T document);

    /**
     * Returns at most {@code limit} documents of the given type matching the filter, in store order.
     */
    <T extends GrowthDocument> List<T> list(Class<T> type, DocumentFilter filter, int limit);

    /**
     * Names of the collections currently present in the database.
     */
    List<String> collectionNames();
}
