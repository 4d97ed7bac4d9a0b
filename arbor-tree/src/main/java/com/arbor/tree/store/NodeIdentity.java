package com.arbor.tree.store;

/**
 * Reads and assigns the store-generated key of a payload type.
 */
public interface NodeIdentity<T> {

    /** Key of the node, or {@code null} when it has never been persisted. */
    Long getId(T node);

    void setId(T node, long id);
}
