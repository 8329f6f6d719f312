package io.nodelog.core.log;

public enum LogCategory
{
    WORKER_OUT("worker_out"),
    WORKER_ERR("worker_err"),
    CORE_WORKER("core_worker"),
    DRIVER("driver"),
    RAYLET("raylet"),
    GCS_SERVER("gcs_server"),
    INTERNAL("internal"),
    AUTOSCALER("autoscaler"),
    AGENT("agent"),
    DASHBOARD("dashboard");

    private final String name;

    LogCategory(String name)
    {
        this.name = name;
    }

    public String getName()
    {
        return name;
    }
}
