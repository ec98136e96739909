package com.stagehand.orchestrator.service;

import com.stagehand.orchestrator.agent.AgentRequest;
import com.stagehand.orchestrator.agent.AgentResult;
import com.stagehand.orchestrator.agent.AgentRunner;
import com.stagehand.orchestrator.agent.AgentRunnerException;
import com.stagehand.orchestrator.model.ExecutionTelemetry;
import com.stagehand.orchestrator.store.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/** The test properties give the dispatcher a single worker thread. */
@ExtendWith(MockitoExtension.class)
class AgentDispatcherTest {

    @Mock AgentRunner runner;

    private AgentDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new AgentDispatcher(runner, TestStores.properties(Path.of("unused")));
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    private static AgentRequest request(String executionId) {
        return new AgentRequest(executionId, "prompt", Path.of("."), null, null, null, null, "s");
    }

    /** Completes a future with the callback outcome: the result text, or "failed: message". */
    private static AgentDispatcher.Callback into(CompletableFuture<String> outcome) {
        return new AgentDispatcher.Callback() {
            @Override
            public void completed(AgentResult result) {
                outcome.complete(result.resultText());
            }

            @Override
            public void failed(String message) {
                outcome.complete("failed: " + message);
            }
        };
    }

    @Test
    void dispatch_successfulRun_reportsResult() throws Exception {
        when(runner.run(any())).thenReturn(
                new AgentResult(0, false, "raw", "answer", null, ExecutionTelemetry.empty(), "s"));
        CompletableFuture<String> outcome = new CompletableFuture<>();

        dispatcher.dispatch("p", "t", request("e1"), into(outcome));

        assertThat(outcome.get(5, TimeUnit.SECONDS)).isEqualTo("answer");
    }

    @Test
    void dispatch_runnerThrows_reportsFailure() throws Exception {
        when(runner.run(any())).thenThrow(new AgentRunnerException("Failed to spawn agent: no such file"));
        CompletableFuture<String> outcome = new CompletableFuture<>();

        dispatcher.dispatch("p", "t", request("e1"), into(outcome));

        assertThat(outcome.get(5, TimeUnit.SECONDS)).isEqualTo("failed: Failed to spawn agent: no such file");
    }

    @Test
    void cancel_queuedRun_isDroppedAndReportedAsStopped() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(runner.run(any())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return new AgentResult(0, false, "", "first", null, ExecutionTelemetry.empty(), "s");
        });
        when(runner.cancel("e2")).thenReturn(false);
        CompletableFuture<String> first  = new CompletableFuture<>();
        CompletableFuture<String> second = new CompletableFuture<>();

        dispatcher.dispatch("p", "t", request("e1"), into(first));
        dispatcher.dispatch("p", "t", request("e2"), into(second));

        assertThat(dispatcher.isInFlight("e2")).isTrue();
        assertThat(dispatcher.cancel("e2")).isTrue();
        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("failed: Stopped by user");
        assertThat(dispatcher.isInFlight("e2")).isFalse();

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("first");
    }

    @Test
    void cancel_runningAgent_delegatesToRunner() {
        when(runner.cancel("e1")).thenReturn(true);

        assertThat(dispatcher.cancel("e1")).isTrue();
    }

    @Test
    void cancel_unknownExecution_returnsFalse() {
        when(runner.cancel("nope")).thenReturn(false);

        assertThat(dispatcher.cancel("nope")).isFalse();
    }
}
