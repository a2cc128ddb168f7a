package ch.so.agi.gretlreclass.remote;

import java.util.Objects;

/**
 * Opaque reference to a (possibly not yet materialised) dataset on the remote
 * backend, e.g. the result of a server side remap.
 */
public final class AssetHandle {

    private final String id;

    public AssetHandle(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AssetHandle && id.equals(((AssetHandle) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AssetHandle(" + id + ")";
    }
}
