package com.example.apitest.service;

import com.example.apitest.model.SuiteDefinition;
import com.example.apitest.model.TestCaseDefinition;
import com.example.apitest.model.TestReport;
import com.example.apitest.policy.PolicySnapshot;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Worker pool for case and suite runs. Queued runs start in order of policy priority (higher
 * first), then submission order. Every run keeps its worker thread for its whole duration,
 * including retry and rate-limit sleeps.
 */
@Slf4j
@Service
public class ExecutionDispatcher {
    private final ExecutionOrchestrator caseOrchestrator;
    private final SuiteOrchestrator suiteOrchestrator;
    private final ReportStore reportStore;
    private final ThreadPoolExecutor executor;
    private final AtomicLong sequence = new AtomicLong();

    public ExecutionDispatcher(ExecutionOrchestrator caseOrchestrator, SuiteOrchestrator suiteOrchestrator,
                               ReportStore reportStore, @Value("${WORKER_POOL_SIZE:8}") int poolSize) {
        this.caseOrchestrator = caseOrchestrator;
        this.suiteOrchestrator = suiteOrchestrator;
        this.reportStore = reportStore;
        int threads = Math.max(1, poolSize);
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new PriorityBlockingQueue<>(), new WorkerThreadFactory());
    }

    public CompletableFuture<TestReport> submitCase(TestReport report, TestCaseDefinition testCase, PolicySnapshot policy) {
        reportStore.save(report);
        return submit(priorityOf(policy), () -> caseOrchestrator.runCase(report, testCase, policy));
    }

    public CompletableFuture<TestReport> submitSuite(TestReport report, SuiteDefinition suite, PolicySnapshot policy) {
        reportStore.save(report);
        return submit(priorityOf(policy), () -> suiteOrchestrator.runSuite(report, suite, policy));
    }

    public int queuedTasks() {
        return executor.getQueue().size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down execution dispatcher, {} queued run(s) dropped", executor.getQueue().size());
        executor.shutdownNow();
    }

    private CompletableFuture<TestReport> submit(int priority, Supplier<TestReport> work) {
        PrioritizedRun run = new PrioritizedRun(priority, sequence.getAndIncrement(), work);
        executor.execute(run);
        return run.future;
    }

    private static int priorityOf(PolicySnapshot policy) {
        return policy == null ? 0 : policy.getPriority();
    }

    static final class PrioritizedRun implements Runnable, Comparable<PrioritizedRun> {
        private final int priority;
        private final long sequence;
        private final Supplier<TestReport> work;
        private final CompletableFuture<TestReport> future = new CompletableFuture<>();

        PrioritizedRun(int priority, long sequence, Supplier<TestReport> work) {
            this.priority = priority;
            this.sequence = sequence;
            this.work = work;
        }

        @Override
        public void run() {
            try {
                future.complete(work.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }

        @Override
        public int compareTo(PrioritizedRun other) {
            int byPriority = Integer.compare(other.priority, priority);
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "execution-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
