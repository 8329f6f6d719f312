package io.nodelog.core.log;

import java.io.IOException;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The field that identifies which log file a request refers to.
 *
 * Exactly one of filename, actor id, task id with attempt number, pid or
 * submission id. Use {@link #accept(Visitor)} to dispatch on the kind.
 */
public abstract class LogIdentifier
{
    public interface Visitor<R>
    {
        R visitFilename(String fileName)
            throws LogFileNotFoundException, IOException;

        R visitActor(String actorId)
            throws LogFileNotFoundException, IOException;

        R visitTask(String taskId, int attemptNumber)
            throws LogFileNotFoundException, IOException;

        R visitPid(int pid)
            throws LogFileNotFoundException, IOException;

        R visitSubmission(String submissionId)
            throws LogFileNotFoundException, IOException;
    }

    public static LogIdentifier ofFilename(String fileName)
    {
        return new Filename(fileName);
    }

    public static LogIdentifier ofActor(String actorId)
    {
        return new Actor(actorId);
    }

    public static LogIdentifier ofTask(String taskId, int attemptNumber)
    {
        return new Task(taskId, attemptNumber);
    }

    public static LogIdentifier ofPid(int pid)
    {
        return new Pid(pid);
    }

    public static LogIdentifier ofSubmission(String submissionId)
    {
        return new Submission(submissionId);
    }

    /**
     * Picks the identifier out of loosely specified request fields.
     *
     * When more than one field is set, the first in the order actor id, task
     * id, submission id, pid, filename takes effect. Empty strings count as
     * not set. A missing attempt number means the first attempt (0).
     *
     * @throws InvalidLogRequestException if none of the fields is set, or the
     * attempt number is negative or the pid is not positive
     */
    public static LogIdentifier select(
            Optional<String> fileName,
            Optional<String> actorId,
            Optional<String> taskId,
            Optional<Integer> attemptNumber,
            Optional<Integer> pid,
            Optional<String> submissionId)
    {
        if (isSet(actorId)) {
            return ofActor(actorId.get());
        }
        else if (isSet(taskId)) {
            int attempt = attemptNumber.or(0);
            if (attempt < 0) {
                throw new InvalidLogRequestException("attempt_number must not be negative: " + attempt);
            }
            return ofTask(taskId.get(), attempt);
        }
        else if (isSet(submissionId)) {
            return ofSubmission(submissionId.get());
        }
        else if (pid.isPresent()) {
            if (pid.get() <= 0) {
                throw new InvalidLogRequestException("pid must be positive: " + pid.get());
            }
            return ofPid(pid.get());
        }
        else if (isSet(fileName)) {
            return ofFilename(fileName.get());
        }
        throw new InvalidLogRequestException(
                "One of filename, actor_id, task_id, pid or submission_id must be given");
    }

    private static boolean isSet(Optional<String> value)
    {
        return value.isPresent() && !value.get().isEmpty();
    }

    private LogIdentifier()
    { }

    public abstract <R> R accept(Visitor<R> visitor)
        throws LogFileNotFoundException, IOException;

    /**
     * Request field names and values of this identifier, for error messages.
     */
    public abstract Map<String, String> getFields();

    // agents attribute task output within shared worker logs by these
    public Optional<String> getTaskId()
    {
        return Optional.absent();
    }

    public Optional<Integer> getAttemptNumber()
    {
        return Optional.absent();
    }

    @Override
    public String toString()
    {
        return getFields().toString();
    }

    @Override
    public boolean equals(Object obj)
    {
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return getFields().equals(((LogIdentifier) obj).getFields());
    }

    @Override
    public int hashCode()
    {
        return getFields().hashCode();
    }

    private static String checkNotEmpty(String value, String name)
    {
        checkNotNull(value, "%s", name);
        checkArgument(!value.isEmpty(), "%s must not be empty", name);
        return value;
    }

    private static final class Filename
            extends LogIdentifier
    {
        private final String fileName;

        Filename(String fileName)
        {
            this.fileName = checkNotEmpty(fileName, "filename");
        }

        @Override
        public <R> R accept(Visitor<R> visitor)
            throws LogFileNotFoundException, IOException
        {
            return visitor.visitFilename(fileName);
        }

        @Override
        public Map<String, String> getFields()
        {
            return ImmutableMap.of("filename", fileName);
        }
    }

    private static final class Actor
            extends LogIdentifier
    {
        private final String actorId;

        Actor(String actorId)
        {
            this.actorId = checkNotEmpty(actorId, "actor_id");
        }

        @Override
        public <R> R accept(Visitor<R> visitor)
            throws LogFileNotFoundException, IOException
        {
            return visitor.visitActor(actorId);
        }

        @Override
        public Map<String, String> getFields()
        {
            return ImmutableMap.of("actor_id", actorId);
        }
    }

    private static final class Task
            extends LogIdentifier
    {
        private final String taskId;
        private final int attemptNumber;

        Task(String taskId, int attemptNumber)
        {
            this.taskId = checkNotEmpty(taskId, "task_id");
            checkArgument(attemptNumber >= 0, "attempt_number must not be negative");
            this.attemptNumber = attemptNumber;
        }

        @Override
        public <R> R accept(Visitor<R> visitor)
            throws LogFileNotFoundException, IOException
        {
            return visitor.visitTask(taskId, attemptNumber);
        }

        @Override
        public Optional<String> getTaskId()
        {
            return Optional.of(taskId);
        }

        @Override
        public Optional<Integer> getAttemptNumber()
        {
            return Optional.of(attemptNumber);
        }

        @Override
        public Map<String, String> getFields()
        {
            return ImmutableMap.of(
                    "task_id", taskId,
                    "attempt_number", Integer.toString(attemptNumber));
        }
    }

    private static final class Pid
            extends LogIdentifier
    {
        private final int pid;

        Pid(int pid)
        {
            checkArgument(pid > 0, "pid must be positive");
            this.pid = pid;
        }

        @Override
        public <R> R accept(Visitor<R> visitor)
            throws LogFileNotFoundException, IOException
        {
            return visitor.visitPid(pid);
        }

        @Override
        public Map<String, String> getFields()
        {
            return ImmutableMap.of("pid", Integer.toString(pid));
        }
    }

    private static final class Submission
            extends LogIdentifier
    {
        private final String submissionId;

        Submission(String submissionId)
        {
            this.submissionId = checkNotEmpty(submissionId, "submission_id");
        }

        @Override
        public <R> R accept(Visitor<R> visitor)
            throws LogFileNotFoundException, IOException
        {
            return visitor.visitSubmission(submissionId);
        }

        @Override
        public Map<String, String> getFields()
        {
            return ImmutableMap.of("submission_id", submissionId);
        }
    }
}
