package io.nodelog.spi;

import java.time.Duration;
import java.util.List;

public interface TaskEventStore
{
    /**
     * Returns the recorded events of all attempts of a task, or an empty list
     * if the task is unknown.
     *
     * @throws RemoteTimeoutException if the store does not answer within timeout
     */
    List<TaskAttemptEvent> getEvents(String taskId, Duration timeout);
}
