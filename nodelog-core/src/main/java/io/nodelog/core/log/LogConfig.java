package io.nodelog.core.log;

import java.time.Duration;
import io.nodelog.client.config.Config;
import io.nodelog.client.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
public interface LogConfig
{
    String SUBMISSION_ID_PLACEHOLDER = "{submission_id}";

    long DEFAULT_RPC_TIMEOUT = 30;
    String DEFAULT_JOB_FILE_TEMPLATE = "job-driver-" + SUBMISSION_ID_PLACEHOLDER + ".log";
    String DEFAULT_SUFFIX = "out";
    int DEFAULT_REMOTE_CALL_THREADS = 0;

    Duration getRpcTimeout();

    String getJobFileTemplate();

    String getDefaultSuffix();

    // 0 means an unbounded cached pool
    int getRemoteCallThreads();

    static ImmutableLogConfig.Builder defaultBuilder()
    {
        return ImmutableLogConfig.builder()
            .rpcTimeout(Duration.ofSeconds(DEFAULT_RPC_TIMEOUT))
            .jobFileTemplate(DEFAULT_JOB_FILE_TEMPLATE)
            .defaultSuffix(DEFAULT_SUFFIX)
            .remoteCallThreads(DEFAULT_REMOTE_CALL_THREADS);
    }

    static LogConfig convertFrom(Config config)
    {
        long rpcTimeout = config.get("log.rpc-timeout", long.class, DEFAULT_RPC_TIMEOUT);
        if (rpcTimeout <= 0) {
            throw new ConfigException("log.rpc-timeout must be positive but got " + rpcTimeout);
        }

        String jobFileTemplate = config.get("log.job-file-template", String.class, DEFAULT_JOB_FILE_TEMPLATE);
        if (!jobFileTemplate.contains(SUBMISSION_ID_PLACEHOLDER)) {
            throw new ConfigException("log.job-file-template must contain " + SUBMISSION_ID_PLACEHOLDER + ": " + jobFileTemplate);
        }

        String defaultSuffix = config.get("log.default-suffix", String.class, DEFAULT_SUFFIX);
        if (defaultSuffix.isEmpty()) {
            throw new ConfigException("log.default-suffix must not be empty");
        }

        int remoteCallThreads = config.get("log.remote-call-threads", int.class, DEFAULT_REMOTE_CALL_THREADS);
        if (remoteCallThreads < 0) {
            throw new ConfigException("log.remote-call-threads must not be negative but got " + remoteCallThreads);
        }

        return defaultBuilder()
            .rpcTimeout(Duration.ofSeconds(rpcTimeout))
            .jobFileTemplate(jobFileTemplate)
            .defaultSuffix(defaultSuffix)
            .remoteCallThreads(remoteCallThreads)
            .build();
    }
}
