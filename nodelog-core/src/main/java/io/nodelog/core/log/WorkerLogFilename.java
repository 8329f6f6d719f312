package io.nodelog.core.log;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Parsed name of a worker log file: {@code worker-<worker_id>-<job_id>-<pid>.<out|err>}.
 */
@Value.Immutable
public interface WorkerLogFilename
{
    // leading path is allowed, ids are lower-case hex
    Pattern PATTERN = Pattern.compile(".*worker-([0-9a-f]+)-([0-9a-f]+)-(\\d+)\\.(out|err)");

    String getWorkerId();

    String getJobId();

    int getPid();

    String getExtension();

    static Optional<WorkerLogFilename> parse(String fileName)
    {
        Matcher m = PATTERN.matcher(fileName);
        if (!m.matches()) {
            return Optional.absent();
        }
        int pid;
        try {
            pid = Integer.parseInt(m.group(3));
        }
        catch (NumberFormatException ex) {
            // too many digits
            return Optional.absent();
        }
        return Optional.of(ImmutableWorkerLogFilename.builder()
                .workerId(m.group(1))
                .jobId(m.group(2))
                .pid(pid)
                .extension(m.group(4))
                .build());
    }
}
