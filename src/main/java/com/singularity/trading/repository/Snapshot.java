package com.singularity.trading.repository;

/**
 * A decoded document together with the version token it was read at.
 *
 * @param <T> The decoded collection type.
 */
public final class Snapshot<T> {

    private final T value;
    private final String versionToken;

    public Snapshot(T value, String versionToken) {
        this.value = value;
        this.versionToken = versionToken;
    }

    public T getValue() {
        return value;
    }

    /**
     * @return The token to pass back on a conditional write; {@code null} if the document did not exist.
     */
    public String getVersionToken() {
        return versionToken;
    }
}
