package io.gamevault.storage;

/** Backend technologies a {@link DurableStore} can be built on. */
public enum StoreKind {
    MEMORY,
    LOG,
    DOCUMENT,
    SQL
}
