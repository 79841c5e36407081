package com.singularity.trading.store;

/**
 * Named JSON documents with an opaque version token per revision.
 *
 * <p>Implementations never cache: every {@link #read(String)} goes to the backing store so the
 * caller observes the latest token.
 */
public interface DocumentStore {

    /**
     * Reads the current revision of a document.
     *
     * @param key The document key.
     * @return The document and its token, or {@link VersionedDocument#absent()} if never written.
     * @throws StoreUnavailableException if the store cannot be read.
     */
    VersionedDocument read(String key);

    /**
     * Writes a document only if the store's current token still equals {@code expectedVersionToken}.
     * A {@code null} expected token means the key must still be absent.
     *
     * @param key                  The document key.
     * @param body                 The complete new document.
     * @param expectedVersionToken The token observed by the caller's read.
     * @return {@code COMMITTED}, {@code VERSION_CONFLICT} or {@code OUTCOME_UNKNOWN}.
     * @throws StoreUnavailableException if the store rejected the write for another reason.
     */
    WriteResult writeIfVersion(String key, String body, String expectedVersionToken);

    /**
     * Last-writer-wins write. Only for non-critical side logs.
     *
     * @param key  The document key.
     * @param body The complete new document.
     * @return {@code COMMITTED} or {@code OUTCOME_UNKNOWN}.
     * @throws StoreUnavailableException if the store rejected the write.
     */
    WriteResult writeUnconditionally(String key, String body);
}
