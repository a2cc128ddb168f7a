package ch.so.agi.gretlreclass.remote;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.locationtech.jts.geom.Geometry;

/**
 * Capability giving access to an authenticated remote geospatial compute
 * backend. Implementations live outside the engine (they own authentication
 * and transport) and are passed explicitly to every component that needs
 * remote access.
 * <p>
 * Every call is a single blocking round trip that must give up after the
 * supplied timeout with a {@link TimeoutException}. Transport or backend
 * failures are reported as {@link IOException}.
 * </p>
 * <p>
 * A {@code region} restricts a call to an area of interest: images are
 * clipped to it, collections are filtered to the features intersecting it.
 * {@code null} means the whole asset.
 * </p>
 */
public interface SessionProvider {

    /**
     * @return the backend's asset type, e.g. {@code IMAGE} or {@code TABLE}
     */
    String assetType(String assetId, Duration timeout) throws IOException, TimeoutException;

    /**
     * @return band names of an image or property names of a feature collection
     */
    List<String> listBands(String assetId, Duration timeout) throws IOException, TimeoutException;

    /**
     * Distinct values of a band (frequency histogram over the image geometry
     * or the region) or of a collection column (aggregate distinct).
     */
    Set<Object> enumerateRemote(String assetId, String bandOrColumn, Geometry region, Duration timeout)
            throws IOException, TimeoutException;

    /**
     * Server side remap of one band into a new single band image.
     */
    AssetHandle remapRemoteImage(String assetId, String band, List<Object> from, List<Integer> to,
            int defaultValue, Geometry region, Duration timeout) throws IOException, TimeoutException;

    /**
     * Attaches image level properties (visualization metadata) to a handle.
     */
    AssetHandle setProperties(AssetHandle handle, Map<String, String> properties, Duration timeout)
            throws IOException, TimeoutException;

    /**
     * Server side per feature map operation described by {@code expression}.
     */
    AssetHandle mapRemoteCollection(String assetId, String column, JsonNode expression, Geometry region,
            Duration timeout) throws IOException, TimeoutException;

    /**
     * Submits an asynchronous export of the handle to {@code destination}.
     */
    JobReference export(AssetHandle handle, String destination, ObjectNode options, Duration timeout)
            throws IOException, TimeoutException;

    JobStatus jobStatus(JobReference job, Duration timeout) throws IOException, TimeoutException;

    /**
     * Requests cancellation. The job is not guaranteed to stop immediately.
     */
    void cancel(JobReference job, Duration timeout) throws IOException, TimeoutException;
}
