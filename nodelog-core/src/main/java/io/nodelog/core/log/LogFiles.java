package io.nodelog.core.log;

import java.util.List;

public class LogFiles
{
    private LogFiles()
    { }

    /**
     * Returns the category of a log file by its naming convention.
     * Rules are tested in a fixed order and the first match wins.
     */
    public static LogCategory categorize(String fileName)
    {
        if (fileName.contains("worker") && fileName.endsWith(".out")) {
            return LogCategory.WORKER_OUT;
        }
        else if (fileName.contains("worker") && fileName.endsWith(".err")) {
            return LogCategory.WORKER_ERR;
        }
        else if (fileName.contains("core-worker") && fileName.endsWith(".log")) {
            return LogCategory.CORE_WORKER;
        }
        else if (fileName.contains("core-driver") && fileName.endsWith(".log")) {
            return LogCategory.DRIVER;
        }
        else if (fileName.contains("raylet.")) {
            return LogCategory.RAYLET;
        }
        else if (fileName.contains("gcs_server.")) {
            return LogCategory.GCS_SERVER;
        }
        else if (fileName.contains("log_monitor")) {
            // must precede the "monitor" rule
            return LogCategory.INTERNAL;
        }
        else if (fileName.contains("monitor")) {
            return LogCategory.AUTOSCALER;
        }
        else if (fileName.contains("agent.")) {
            return LogCategory.AGENT;
        }
        else if (fileName.contains("dashboard.")) {
            return LogCategory.DASHBOARD;
        }
        else {
            return LogCategory.INTERNAL;
        }
    }

    public static LogCategoryIndex categorize(List<String> fileNames)
    {
        LogCategoryIndex.Builder builder = LogCategoryIndex.builder();
        for (String fileName : fileNames) {
            builder.add(categorize(fileName), fileName);
        }
        return builder.build();
    }

    public static String formatJobFileName(String template, String submissionId)
    {
        return template.replace(LogConfig.SUBMISSION_ID_PLACEHOLDER, submissionId);
    }

    // *{id}*{suffix}
    public static String formatWorkerGlob(String id, String suffix)
    {
        return "*" + id + "*" + suffix;
    }
}
