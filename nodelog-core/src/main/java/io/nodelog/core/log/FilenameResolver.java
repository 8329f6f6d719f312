package io.nodelog.core.log;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nodelog.spi.ActorPlacement;
import io.nodelog.spi.ActorRegistry;
import io.nodelog.spi.JobInfo;
import io.nodelog.spi.JobRegistry;
import io.nodelog.spi.NodeId;
import io.nodelog.spi.TaskAttemptEvent;
import io.nodelog.spi.TaskEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a {@link LogRequest} to the node and the name of one log file.
 *
 * Actor, task and job identifiers are looked up in their registries, which
 * also decide the node. Pid and filename identifiers need the node id of the
 * request. Worker logs are found by listing the node with
 * {@link WorkerFileMatcher}.
 */
public class FilenameResolver
{
    private static final Logger logger = LoggerFactory.getLogger(FilenameResolver.class);

    private final NodeLivenessGate livenessGate;
    private final WorkerFileMatcher workerFileMatcher;
    private final ActorRegistry actorRegistry;
    private final TaskEventStore taskEventStore;
    private final JobRegistry jobRegistry;
    private final RemoteCallExecutor remoteCalls;
    private final LogConfig config;

    @Inject
    public FilenameResolver(
            NodeLivenessGate livenessGate,
            WorkerFileMatcher workerFileMatcher,
            ActorRegistry actorRegistry,
            TaskEventStore taskEventStore,
            JobRegistry jobRegistry,
            RemoteCallExecutor remoteCalls,
            LogConfig config)
    {
        this.livenessGate = livenessGate;
        this.workerFileMatcher = workerFileMatcher;
        this.actorRegistry = actorRegistry;
        this.taskEventStore = taskEventStore;
        this.jobRegistry = jobRegistry;
        this.remoteCalls = remoteCalls;
        this.config = config;
    }

    /**
     * @throws LogFileNotFoundException if no log file matches the request
     * @throws InvalidLogRequestException if the request or the records it refers to are invalid
     * @throws io.nodelog.spi.NodeUnavailableException if the node is not alive
     * @throws io.nodelog.spi.RemoteTimeoutException if a remote lookup does not answer in time
     */
    public ResolvedLog resolve(LogRequest request)
        throws LogFileNotFoundException, IOException
    {
        Resolution resolution = new Resolution(request);
        ResolvedLog resolved = request.getIdentifier().accept(resolution);
        logger.info("Resolved log file: {} on node {}", resolved.getFileName(), resolved.getNodeId());
        return resolved;
    }

    private class Resolution
            implements LogIdentifier.Visitor<ResolvedLog>
    {
        private final LogRequest request;
        private final String suffix;
        private final Duration timeout;

        Resolution(LogRequest request)
        {
            this.request = request;
            this.suffix = request.getSuffix().or(config.getDefaultSuffix());
            this.timeout = request.getTimeout().or(config.getRpcTimeout());
        }

        @Override
        public ResolvedLog visitFilename(String fileName)
        {
            NodeId nodeId = requireNodeId("filename " + fileName);
            return ResolvedLog.of(nodeId, fileName);
        }

        @Override
        public ResolvedLog visitActor(String actorId)
            throws LogFileNotFoundException, IOException
        {
            Optional<ActorPlacement> actor = actorRegistry.getActor(actorId);
            if (!actor.isPresent()) {
                throw new InvalidLogRequestException("Actor ID " + actorId + " not found.");
            }

            if (!actor.get().getWorkerId().isPresent()) {
                throw new InvalidLogRequestException(
                        "Worker ID for Actor ID " + actorId + " not found. Actor is not scheduled yet.");
            }
            if (!actor.get().getNodeId().isPresent()) {
                throw new InvalidLogRequestException(
                        "Node ID for Actor ID " + actorId + " not found. Actor is not scheduled yet.");
            }
            NodeId nodeId = actor.get().getNodeId().get();

            livenessGate.verify(nodeId);
            return matchWorkerFile(nodeId, Optional.of(actor.get().getWorkerId().get()), Optional.absent());
        }

        @Override
        public ResolvedLog visitTask(String taskId, int attemptNumber)
            throws LogFileNotFoundException, IOException
        {
            List<TaskAttemptEvent> events = remoteCalls.call(
                    () -> taskEventStore.getEvents(taskId, timeout),
                    timeout,
                    "Getting events of task " + taskId);
            if (events.isEmpty()) {
                throw new LogFileNotFoundException(
                        "Could not find log file for task: " + taskId +
                        " (attempt " + attemptNumber + ") with suffix: " + suffix);
            }

            TaskAttemptEvent event = null;
            for (TaskAttemptEvent candidate : events) {
                if (candidate.getAttemptNumber() == attemptNumber) {
                    event = candidate;
                    break;
                }
            }
            if (event == null) {
                throw new LogFileNotFoundException(
                        "Could not find log file for task attempt: " + taskId + "(" + attemptNumber + ")");
            }

            if (!event.getWorkerId().isPresent() || !event.getNodeId().isPresent()) {
                throw new LogFileNotFoundException(
                        "Could not find log file for task attempt: " + taskId + "(" + attemptNumber + "). " +
                        "Worker id = " + event.getWorkerId().orNull() + ", node id = " + event.getNodeId().orNull());
            }

            return matchWorkerFile(event.getNodeId().get(), Optional.of(event.getWorkerId().get()), Optional.absent());
        }

        @Override
        public ResolvedLog visitSubmission(String submissionId)
            throws LogFileNotFoundException
        {
            Optional<JobInfo> job = jobRegistry.getJob(submissionId);
            if (!job.isPresent()) {
                logger.info("Submission job ID {} not found.", submissionId);
                throw new LogFileNotFoundException("Submission job ID " + submissionId + " not found.");
            }
            if (!job.get().getDriverNodeId().isPresent()) {
                throw new InvalidLogRequestException(
                        "Job " + submissionId + " has no driver node id. The job has not been scheduled.");
            }
            NodeId nodeId = job.get().getDriverNodeId().get();
            String fileName = LogFiles.formatJobFileName(config.getJobFileTemplate(), submissionId);

            logger.info("Resolving job {} on node {} with filename {}", submissionId, nodeId, fileName);
            return ResolvedLog.of(nodeId, fileName);
        }

        @Override
        public ResolvedLog visitPid(int pid)
            throws LogFileNotFoundException, IOException
        {
            NodeId nodeId = requireNodeId("pid " + pid);
            livenessGate.verify(nodeId);
            return matchWorkerFile(nodeId, Optional.absent(), Optional.of(pid));
        }

        private NodeId requireNodeId(String what)
        {
            if (!request.getNodeId().isPresent()) {
                throw new InvalidLogRequestException(
                        "Node id needs to be specified for resolving " + what);
            }
            return request.getNodeId().get();
        }

        private ResolvedLog matchWorkerFile(NodeId nodeId, Optional<String> workerId, Optional<Integer> pid)
            throws LogFileNotFoundException, IOException
        {
            Optional<String> fileName = workerFileMatcher.match(nodeId, workerId, pid, suffix, timeout);
            if (!fileName.isPresent()) {
                throw notFound(nodeId);
            }
            return ResolvedLog.of(nodeId, fileName.get());
        }

        private LogFileNotFoundException notFound(NodeId nodeId)
        {
            StringBuilder message = new StringBuilder()
                .append("Could not find a log file. Please make sure the given option exists in the cluster.\n")
                .append("\tnode_id: ").append(nodeId).append('\n');
            for (Map.Entry<String, String> field : request.getIdentifier().getFields().entrySet()) {
                message.append('\t').append(field.getKey()).append(": ").append(field.getValue()).append('\n');
            }
            message.append("\tsuffix: ").append(suffix).append('\n');
            return new LogFileNotFoundException(message.toString());
        }
    }
}
