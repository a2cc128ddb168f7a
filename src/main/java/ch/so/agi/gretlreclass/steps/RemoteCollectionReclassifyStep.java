package ch.so.agi.gretlreclass.steps;

import java.util.Set;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.locationtech.jts.geom.Geometry;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
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
 * Adds a reclassified property to every feature of a remote collection with a
 * single server side map operation and submits an export of the result.
 * With an area of interest only the features intersecting it are mapped.
 */
public class RemoteCollectionReclassifyStep {
    private ReclassLogger log;
    private String taskName;
    private final SessionProvider session;
    private final ReclassifySettings settings;

    public RemoteCollectionReclassifyStep(SessionProvider session, ReclassifySettings settings) {
        this(null, session, settings);
    }

    public RemoteCollectionReclassifyStep(String taskName, SessionProvider session, ReclassifySettings settings) {
        if (taskName == null) {
            this.taskName = RemoteCollectionReclassifyStep.class.getSimpleName();
        } else {
            this.taskName = taskName;
        }
        this.session = session;
        this.settings = settings;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    public ExecResult execute(SourceDescriptor source, ReclassMatrix matrix, String destination,
            Set<Object> enumerated) {
        String id = source.getLocation();
        String column = source.getBandOrColumn();
        log.lifecycle(String.format(
                "Start RemoteCollectionReclassifyStep(Name: %s source: %s column: %s destination: %s)",
                taskName, id, column, destination));

        ObjectNode expression = RemotePayloads.featureMapExpression(column, settings.getOutputColumn(),
                RemapRequest.of(matrix));
        log.debug("Map expression " + expression);
        Geometry region = source.getAreaOfInterest() != null ? source.getAreaOfInterest().getGeometry() : null;
        AssetHandle mapped = RemoteCalls.call(id, Stage.TRANSFORM, "mapRemoteCollection", settings.getSubmitTimeout(),
                () -> session.mapRemoteCollection(id, column, expression, region, settings.getSubmitTimeout()));
        JobReference job = RemoteCalls.call(id, Stage.COMMIT, "export", settings.getSubmitTimeout(),
                () -> session.export(mapped, destination, RemotePayloads.tableExportOptions(destination),
                        settings.getSubmitTimeout()));

        log.lifecycle(String.format("Finished RemoteCollectionReclassifyStep(Name: %s job: %s)", taskName,
                job.getId()));
        return ExecResult.remote(SourceKind.REMOTE_FEATURE_COLLECTION, id, job,
                ValueCounts.summarizeRemote(matrix, enumerated));
    }
}
