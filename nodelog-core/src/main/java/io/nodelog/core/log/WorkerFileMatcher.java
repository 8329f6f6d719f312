package io.nodelog.core.log;

import java.io.IOException;
import java.time.Duration;
import com.google.common.base.Optional;
import com.google.common.collect.Iterables;
import com.google.inject.Inject;
import io.nodelog.spi.NodeId;

/**
 * Finds the log file of a worker process on a node by worker id or by pid.
 */
public class WorkerFileMatcher
{
    private final LogLister lister;

    @Inject
    public WorkerFileMatcher(LogLister lister)
    {
        this.lister = lister;
    }

    /**
     * Returns the first worker log file, stdout files before stderr files,
     * whose name carries the given worker id or pid and ends with the suffix.
     * Returns absent if there is no such file.
     *
     * @throws InvalidLogRequestException unless exactly one of workerId and pid is given
     */
    public Optional<String> match(NodeId nodeId, Optional<String> workerId, Optional<Integer> pid, String suffix, Duration timeout)
        throws IOException
    {
        if (workerId.isPresent() && pid.isPresent()) {
            throw new InvalidLogRequestException(
                    "Only one of worker id (" + workerId.get() + ") or pid (" + pid.get() + ") should be provided.");
        }
        if (!workerId.isPresent() && !pid.isPresent()) {
            throw new InvalidLogRequestException("Either worker id or pid must be provided.");
        }

        String glob = LogFiles.formatWorkerGlob(workerId.isPresent() ? workerId.get() : pid.get().toString(), suffix);
        LogCategoryIndex index = lister.listLogs(nodeId, glob, timeout);

        for (String fileName : Iterables.concat(index.get(LogCategory.WORKER_OUT), index.get(LogCategory.WORKER_ERR))) {
            Optional<WorkerLogFilename> parsed = WorkerLogFilename.parse(fileName);
            if (!parsed.isPresent()) {
                continue;
            }
            if (workerId.isPresent()) {
                if (parsed.get().getWorkerId().equals(workerId.get())) {
                    return Optional.of(fileName);
                }
            }
            else if (parsed.get().getPid() == pid.get()) {
                return Optional.of(fileName);
            }
        }
        return Optional.absent();
    }
}
