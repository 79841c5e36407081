package com.singularity.trading.store;

/**
 * A document body as read from the store, paired with the version token the store assigned to it.
 * A key that was never written reads as an absent document: no body and no token.
 */
public final class VersionedDocument {

    private static final VersionedDocument ABSENT = new VersionedDocument(null, null);

    private final String body;
    private final String versionToken;

    private VersionedDocument(String body, String versionToken) {
        this.body = body;
        this.versionToken = versionToken;
    }

    public static VersionedDocument of(String body, String versionToken) {
        if (body == null || versionToken == null) {
            throw new IllegalArgumentException("A stored document needs both a body and a version token");
        }
        return new VersionedDocument(body, versionToken);
    }

    public static VersionedDocument absent() {
        return ABSENT;
    }

    public boolean exists() {
        return versionToken != null;
    }

    public String getBody() {
        return body;
    }

    /**
     * @return The opaque version token, or {@code null} when the document does not exist.
     */
    public String getVersionToken() {
        return versionToken;
    }
}
