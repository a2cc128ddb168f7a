package ch.so.agi.gretlreclass.steps;

import java.util.Map;
import java.util.Set;

import org.locationtech.jts.geom.Geometry;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.model.ClassTable;
import ch.so.agi.gretlreclass.model.ExecResult;
import ch.so.agi.gretlreclass.model.ReclassMatrix;
import ch.so.agi.gretlreclass.model.SourceDescriptor;
import ch.so.agi.gretlreclass.model.SourceKind;
import ch.so.agi.gretlreclass.model.ValueCounts;
import ch.so.agi.gretlreclass.remote.AssetHandle;
import ch.so.agi.gretlreclass.remote.JobReference;
import ch.so.agi.gretlreclass.remote.RemapRequest;
import ch.so.agi.gretlreclass.remote.RemoteCalls;
import ch.so.agi.gretlreclass.remote.RemotePayloads;
import ch.so.agi.gretlreclass.remote.SessionProvider;
import ch.so.agi.gretlreclass.utils.Stage;

/**
 * Remaps a band of a remote image on the backend, attaches categorical
 * visualization properties and submits an export. The image is clipped to the
 * area of interest of the source, if any. Returns as soon as the export is
 * submitted; the job may still be running.
 */
public class RemoteImageReclassifyStep {
    private ReclassLogger log;
    private String taskName;
    private final SessionProvider session;
    private final ReclassifySettings settings;

    public RemoteImageReclassifyStep(SessionProvider session, ReclassifySettings settings) {
        this(null, session, settings);
    }

    public RemoteImageReclassifyStep(String taskName, SessionProvider session, ReclassifySettings settings) {
        if (taskName == null) {
            this.taskName = RemoteImageReclassifyStep.class.getSimpleName();
        } else {
            this.taskName = taskName;
        }
        this.session = session;
        this.settings = settings;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    /**
     * @param enumerated values found by a preceding enumeration, {@code null} if none ran
     */
    public ExecResult execute(SourceDescriptor source, ReclassMatrix matrix, ClassTable classTable,
            String destination, Set<Object> enumerated) {
        String id = source.getLocation();
        String band = source.getBandOrColumn();
        log.lifecycle(String.format("Start RemoteImageReclassifyStep(Name: %s source: %s band: %s destination: %s)",
                taskName, id, band, destination));

        RemapRequest remap = RemapRequest.of(matrix);
        Geometry region = source.getAreaOfInterest() != null ? source.getAreaOfInterest().getGeometry() : null;
        log.debug("Remapping " + remap.size() + " values, default " + remap.getDefaultValue());
        AssetHandle remapped = RemoteCalls.call(id, Stage.TRANSFORM, "remapRemoteImage", settings.getSubmitTimeout(),
                () -> session.remapRemoteImage(id, band, remap.getFrom(), remap.getTo(), remap.getDefaultValue(),
                        region, settings.getSubmitTimeout()));
        Map<String, String> properties = RemotePayloads.visualizationProperties(band, classTable);
        AssetHandle styled = RemoteCalls.call(id, Stage.TRANSFORM, "setProperties", settings.getSubmitTimeout(),
                () -> session.setProperties(remapped, properties, settings.getSubmitTimeout()));
        JobReference job = RemoteCalls.call(id, Stage.COMMIT, "export", settings.getSubmitTimeout(),
                () -> session.export(styled, destination, RemotePayloads.imageExportOptions(destination),
                        settings.getSubmitTimeout()));

        log.lifecycle(String.format("Finished RemoteImageReclassifyStep(Name: %s job: %s)", taskName, job.getId()));
        return ExecResult.remote(SourceKind.REMOTE_IMAGE, id, job, ValueCounts.summarizeRemote(matrix, enumerated));
    }
}
