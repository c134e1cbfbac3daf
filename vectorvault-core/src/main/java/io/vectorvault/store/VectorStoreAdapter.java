package io.vectorvault.store;

import io.vectorvault.engine.SearchResult;
import io.vectorvault.engine.VectorItem;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Narrow interface to the embedded vector engine. It owns physical collections and knows
 * nothing about the catalog.
 *
 * <p>Failures to read or write the data root surface as
 * {@link io.vectorvault.StorageUnavailableException}; missing collections as
 * {@link io.vectorvault.NotFoundException}.</p>
 */
public interface VectorStoreAdapter {

    /**
     * Creates an empty physical collection.
     *
     * @throws io.vectorvault.AlreadyExistsException if a physical collection already exists under the id
     */
    void create(String collectionId, String modelId, int dimension);

    /**
     * Removes a physical collection and all of its files.
     */
    void drop(String collectionId);

    boolean exists(String collectionId);

    /**
     * Deletes hidden directories left behind by a drop or restore that did not finish.
     *
     * @return the directories removed
     */
    List<Path> removeLeftovers();

    /**
     * Exact item count, read from the collection header.
     */
    long count(String collectionId);

    /**
     * Ids of every item in the collection, in insertion order.
     */
    List<String> listIds(String collectionId);

    /**
     * Ids of every physical collection under the data root.
     */
    Set<String> listCollections();

    List<VectorItem> readItems(String collectionId);

    void addItems(String collectionId, List<VectorItem> items);

    /**
     * Vector lengths observed on up to {@code sampleSize} items spread across the collection.
     */
    Set<Integer> sampleDimensions(String collectionId, int sampleSize);

    List<SearchResult> search(String collectionId, float[] queryVector, int topK);

    Path directoryOf(String collectionId);
}
