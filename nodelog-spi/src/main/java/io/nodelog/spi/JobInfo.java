package io.nodelog.spi;

import com.google.common.base.Optional;
import org.immutables.value.Value;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@Value.Immutable
@JsonSerialize(as = ImmutableJobInfo.class)
@JsonDeserialize(as = ImmutableJobInfo.class)
public interface JobInfo
{
    String getSubmissionId();

    // absent until the driver process is scheduled
    Optional<NodeId> getDriverNodeId();

    static ImmutableJobInfo.Builder builder()
    {
        return ImmutableJobInfo.builder();
    }
}
