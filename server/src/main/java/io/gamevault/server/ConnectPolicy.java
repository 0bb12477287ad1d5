package io.gamevault.server;

/** What {@link CachingGameStorage#connect()} does when the store cannot be reached. */
public enum ConnectPolicy {
    /** Log and rethrow. */
    STRICT,
    /** Log a warning and carry on; later operations fail against the store. */
    LENIENT
}
