package io.nodelog.server.rs;

import java.io.IOException;
import java.time.Duration;
import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.StreamingOutput;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nodelog.client.api.RestLogCategoryIndex;
import io.nodelog.core.log.InvalidLogRequestException;
import io.nodelog.core.log.LogCategoryIndex;
import io.nodelog.core.log.LogFileNotFoundException;
import io.nodelog.core.log.LogIdentifier;
import io.nodelog.core.log.LogRequest;
import io.nodelog.core.log.LogStream;
import io.nodelog.core.log.LogsManager;
import io.nodelog.spi.NodeId;
import io.nodelog.spi.NodeUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Strings.emptyToNull;

@Path("/")
@Produces("application/json")
public class LogResource
{
    // GET  /api/v0/logs[?node_id=<id>&node_ip=<ip>&glob=<glob>&timeout=<seconds>]
    // GET  /api/v0/logs/{media_type}[?node_id=<id>&filename=<name>&actor_id=<id>&task_id=<id>&...]

    private static final Logger logger = LoggerFactory.getLogger(LogResource.class);

    private static final String MEDIA_TYPE_FILE = "file";
    private static final String MEDIA_TYPE_STREAM = "stream";

    private final LogsManager lm;

    @Inject
    public LogResource(LogsManager lm)
    {
        this.lm = lm;
    }

    @GET
    @Path("/api/v0/logs")
    public RestLogCategoryIndex listLogs(
            @QueryParam("node_id") String nodeId,
            @QueryParam("node_ip") String nodeIp,
            @QueryParam("glob") String glob,
            @QueryParam("timeout") Integer timeout)
        throws IOException
    {
        NodeId node = requireNodeId(nodeId, nodeIp);
        LogCategoryIndex index = lm.listLogs(node,
                seconds("timeout", timeout),
                Optional.fromNullable(emptyToNull(glob)));
        return RestModels.logCategoryIndex(node, index);
    }

    @GET
    @Path("/api/v0/logs/{media_type}")
    @Produces("application/octet-stream")
    public Response getLogs(
            @PathParam("media_type") String mediaType,
            @QueryParam("node_id") String nodeId,
            @QueryParam("node_ip") String nodeIp,
            @QueryParam("filename") String fileName,
            @QueryParam("actor_id") String actorId,
            @QueryParam("task_id") String taskId,
            @QueryParam("attempt_number") Integer attemptNumber,
            @QueryParam("pid") Integer pid,
            @QueryParam("submission_id") String submissionId,
            @QueryParam("suffix") String suffix,
            @QueryParam("lines") Integer lines,
            @QueryParam("interval") Double interval,
            @QueryParam("timeout") Integer timeout)
        throws LogFileNotFoundException, IOException
    {
        boolean follow = isFollow(mediaType);

        LogIdentifier identifier = LogIdentifier.select(
                Optional.fromNullable(fileName),
                Optional.fromNullable(actorId),
                Optional.fromNullable(taskId),
                Optional.fromNullable(attemptNumber),
                Optional.fromNullable(pid),
                Optional.fromNullable(submissionId));

        if (lines != null && lines < 0) {
            throw new InvalidLogRequestException("lines must not be negative: " + lines);
        }
        if (interval != null && !(interval > 0 && interval < Double.POSITIVE_INFINITY)) {
            throw new InvalidLogRequestException("interval must be positive: " + interval);
        }

        LogRequest request = LogRequest.builder()
            .identifier(identifier)
            .nodeId(Optional.fromNullable(emptyToNull(nodeId)).transform(NodeId::of))
            .nodeIp(Optional.fromNullable(emptyToNull(nodeIp)))
            .suffix(Optional.fromNullable(emptyToNull(suffix)))
            .lines(Optional.fromNullable(lines))
            .interval(Optional.fromNullable(interval).transform(sec -> Duration.ofMillis((long) (sec * 1000))))
            .timeout(seconds("timeout", timeout))
            .follow(follow)
            .build();

        LogStream stream = lm.streamLogs(request);
        StreamingOutput body = (out) -> {
            try {
                while (stream.hasNext()) {
                    out.write(stream.next());
                    out.flush();
                }
            }
            catch (IOException ex) {
                logger.debug("Client stopped reading the log stream: {}", ex.toString());
                throw ex;
            }
            finally {
                stream.close();
            }
        };
        return Response.ok(body, "application/octet-stream").build();
    }

    private NodeId requireNodeId(String nodeId, String nodeIp)
    {
        if (emptyToNull(nodeId) != null) {
            return NodeId.of(nodeId);
        }
        if (emptyToNull(nodeIp) == null) {
            throw new InvalidLogRequestException("Either node_id or node_ip must be given");
        }
        Optional<NodeId> resolved = lm.ipToNodeId(nodeIp);
        if (!resolved.isPresent()) {
            throw new NodeUnavailableException("No alive node has ip " + nodeIp);
        }
        return resolved.get();
    }

    private static boolean isFollow(String mediaType)
    {
        switch (mediaType) {
        case MEDIA_TYPE_FILE:
            return false;
        case MEDIA_TYPE_STREAM:
            return true;
        default:
            throw new InvalidLogRequestException(
                    "media_type must be " + MEDIA_TYPE_FILE + " or " + MEDIA_TYPE_STREAM + " but got " + mediaType);
        }
    }

    private static Optional<Duration> seconds(String name, Integer value)
    {
        if (value == null) {
            return Optional.absent();
        }
        if (value <= 0) {
            throw new InvalidLogRequestException(name + " must be positive: " + value);
        }
        return Optional.of(Duration.ofSeconds(value));
    }
}
