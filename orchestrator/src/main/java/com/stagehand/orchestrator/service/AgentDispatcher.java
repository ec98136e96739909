package com.stagehand.orchestrator.service;

import com.stagehand.orchestrator.agent.AgentRequest;
import com.stagehand.orchestrator.agent.AgentResult;
import com.stagehand.orchestrator.agent.AgentRunner;
import com.stagehand.orchestrator.config.StagehandProperties;
import com.stagehand.orchestrator.logging.MdcContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

/**
 * Runs agent invocations on a fixed worker pool.
 *
 * The pool size caps how many agents run at once; extra work queues. Each
 * job reports back through its {@link Callback} exactly once.
 */
@Component
public class AgentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatcher.class);

    /** Receives the outcome of one dispatched agent run. */
    public interface Callback {
        void completed(AgentResult result);

        void failed(String message);
    }

    private record InFlight(Future<?> future, Callback callback) {}

    private final AgentRunner           runner;
    private final ExecutorService       workers;
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    public AgentDispatcher(AgentRunner runner, StagehandProperties props) {
        this.runner  = runner;
        this.workers = Executors.newFixedThreadPool(props.agent().workers());
    }

    public void dispatch(String projectId, String taskId, AgentRequest request, Callback callback) {
        String executionId = request.executionId();
        FutureTask<Void> job = new FutureTask<>(() -> {
            try (MdcContext mdc = MdcContext.of(projectId, taskId, executionId)) {
                AgentResult result;
                try {
                    result = runner.run(request);
                } catch (RuntimeException e) {
                    log.error("Agent run failed for execution {}: {}", executionId, e.getMessage(), e);
                    callback.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                    return;
                }
                callback.completed(result);
            } finally {
                inFlight.remove(executionId);
            }
        }, null);
        inFlight.put(executionId, new InFlight(job, callback));
        workers.execute(job);
        log.info("Dispatched execution {} for task {}", executionId, taskId);
    }

    /**
     * Stops the run for {@code executionId}. A running agent is killed and
     * reports back as killed; a queued one is dropped and reported as failed.
     *
     * @return false if nothing was in flight for this execution
     */
    public boolean cancel(String executionId) {
        if (runner.cancel(executionId)) return true;
        InFlight queued = inFlight.remove(executionId);
        if (queued != null && queued.future().cancel(false)) {
            queued.callback().failed("Stopped by user");
            return true;
        }
        return false;
    }

    public boolean isInFlight(String executionId) {
        return inFlight.containsKey(executionId);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Agent workers did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
