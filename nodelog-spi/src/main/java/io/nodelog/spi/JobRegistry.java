package io.nodelog.spi;

import com.google.common.base.Optional;

public interface JobRegistry
{
    Optional<JobInfo> getJob(String submissionId);
}
