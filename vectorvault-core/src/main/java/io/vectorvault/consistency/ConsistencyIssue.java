package io.vectorvault.consistency;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One disagreement between the catalog and the physical store.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OrphanedVector.class, name = "orphaned_vector"),
    @JsonSubTypes.Type(value = OrphanedCatalogEntry.class, name = "orphaned_catalog_entry"),
    @JsonSubTypes.Type(value = DimensionMismatch.class, name = "dimension_mismatch")
})
public interface ConsistencyIssue {

    String collectionId();

    /**
     * Human-readable one-line description.
     */
    String describe();
}
