package ch.so.agi.gretlreclass.model;

/**
 * The four backends a reclassification can run against.
 */
public enum SourceKind {
    LOCAL_RASTER(false),
    LOCAL_VECTOR(false),
    REMOTE_IMAGE(true),
    REMOTE_FEATURE_COLLECTION(true);

    private final boolean remote;

    SourceKind(boolean remote) {
        this.remote = remote;
    }

    public boolean isRemote() {
        return remote;
    }
}
