package com.example.apitest.service;

import com.example.apitest.model.ReportStatus;
import com.example.apitest.model.TestCaseDefinition;
import com.example.apitest.model.TestReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.example.apitest.service.ExecutionOrchestratorTest.policy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ExecutionDispatcherTest {
    private final ExecutionOrchestrator caseOrchestrator = mock(ExecutionOrchestrator.class);
    private final SuiteOrchestrator suiteOrchestrator = mock(SuiteOrchestrator.class);
    private final InMemoryReportStore reportStore = new InMemoryReportStore();
    private final ExecutionDispatcher dispatcher = new ExecutionDispatcher(caseOrchestrator, suiteOrchestrator, reportStore, 1);

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    @DisplayName("Queued runs start by policy priority, then submission order")
    void startsQueuedRunsByPriority() throws Exception {
        // Given
        CountDownLatch blockerStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> order = new CopyOnWriteArrayList<>();
        when(caseOrchestrator.runCase(any(), any(), any())).thenAnswer(invocation -> {
            TestReport report = invocation.getArgument(0);
            order.add(report.getEntityId());
            if ("blocker".equals(report.getEntityId())) {
                blockerStarted.countDown();
                assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            }
            return report;
        });
        TestCaseDefinition testCase = TestCaseDefinition.builder().id("c").name("c").build();

        // When
        CompletableFuture<TestReport> blocker = dispatcher.submitCase(TestReport.forCase("blocker"), testCase,
                policy(1, false, 0).priority(0).build());
        assertThat(blockerStarted.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<TestReport> low = dispatcher.submitCase(TestReport.forCase("low"), testCase,
                policy(1, false, 0).priority(1).build());
        CompletableFuture<TestReport> lowSecond = dispatcher.submitCase(TestReport.forCase("low-2"), testCase,
                policy(1, false, 0).priority(1).build());
        CompletableFuture<TestReport> high = dispatcher.submitCase(TestReport.forCase("high"), testCase,
                policy(1, false, 0).priority(9).build());
        assertThat(dispatcher.queuedTasks()).isEqualTo(3);
        release.countDown();
        CompletableFuture.allOf(blocker, low, lowSecond, high).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(order).containsExactly("blocker", "high", "low", "low-2");
    }

    @Test
    void submitStoresPendingReport() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(caseOrchestrator.runCase(any(), any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return invocation.getArgument(0);
        });
        TestReport report = TestReport.forCase("case-1");

        CompletableFuture<TestReport> future = dispatcher.submitCase(report,
                TestCaseDefinition.builder().id("case-1").build(), null);

        assertThat(reportStore.findById(report.getId())).isPresent();
        assertThat(report.getStatus()).isEqualTo(ReportStatus.PENDING);
        release.countDown();
        assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(report);
    }

    @Test
    void failedRunCompletesFutureExceptionally() {
        when(suiteOrchestrator.runSuite(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        CompletableFuture<TestReport> future = dispatcher.submitSuite(TestReport.forSuite("suite-1"), null, null);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("boom");
    }

    @Test
    void prioritizedRunsOrderHigherPriorityFirst() {
        ExecutionDispatcher.PrioritizedRun low = new ExecutionDispatcher.PrioritizedRun(1, 0, () -> null);
        ExecutionDispatcher.PrioritizedRun high = new ExecutionDispatcher.PrioritizedRun(9, 1, () -> null);
        ExecutionDispatcher.PrioritizedRun lowLater = new ExecutionDispatcher.PrioritizedRun(1, 2, () -> null);

        assertThat(high.compareTo(low)).isNegative();
        assertThat(low.compareTo(lowLater)).isNegative();
        assertThat(lowLater.compareTo(low)).isPositive();
    }
}
