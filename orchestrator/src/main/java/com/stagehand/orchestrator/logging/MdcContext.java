package com.stagehand.orchestrator.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * Puts projectId/taskId/executionId into the MDC for the lifetime of a
 * try-with-resources block, then removes exactly the keys it added.
 */
public final class MdcContext implements AutoCloseable {

    public static final String PROJECT_ID   = "projectId";
    public static final String TASK_ID      = "taskId";
    public static final String EXECUTION_ID = "executionId";

    private final List<MDC.MDCCloseable> entries = new ArrayList<>();

    private MdcContext() {}

    public static MdcContext of(String projectId, String taskId, String executionId) {
        MdcContext ctx = new MdcContext();
        ctx.put(PROJECT_ID, projectId);
        ctx.put(TASK_ID, taskId);
        ctx.put(EXECUTION_ID, executionId);
        return ctx;
    }

    private void put(String key, String value) {
        if (value != null) entries.add(MDC.putCloseable(key, value));
    }

    @Override
    public void close() {
        entries.forEach(MDC.MDCCloseable::close);
        entries.clear();
    }
}
