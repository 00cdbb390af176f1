package com.yanweiyi.micodeexecutor.service;

import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import com.yanweiyi.micodeexecutor.exception.BusinessException;
import com.yanweiyi.micodeexecutor.model.FailureReport;
import com.yanweiyi.micodeexecutor.model.JobAssignment;
import com.yanweiyi.micodeexecutor.model.JobStatusResponse;
import com.yanweiyi.micodeexecutor.model.JobStatusUpdate;
import com.yanweiyi.micodeexecutor.model.SubmitRequest;
import com.yanweiyi.micodeexecutor.model.TestCase;
import com.yanweiyi.micodeexecutor.model.Verdict;
import com.yanweiyi.micodeexecutor.model.VerdictReport;
import com.yanweiyi.micodeexecutor.model.WorkerRegistration;
import com.yanweiyi.micodeexecutor.model.WorkerView;
import com.yanweiyi.micodeexecutor.model.enums.ErrorCodeEnum;
import com.yanweiyi.micodeexecutor.model.enums.JobStatusEnum;
import com.yanweiyi.micodeexecutor.model.enums.VerdictOutcomeEnum;
import com.yanweiyi.micodeexecutor.sandbox.language.LanguageProfileRegistry;
import com.yanweiyi.micodeexecutor.support.MutableClock;
import com.yanweiyi.micodeexecutor.support.TestLanguages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JobSchedulerTest {

    private MutableClock clock;

    private MicodeProperties properties;

    private JobStore jobStore;

    private JobScheduler scheduler;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        properties = new MicodeProperties();
        properties.getMaster().setAckTimeoutMs(1_000L);
        properties.getMaster().setJobTimeoutMs(60_000L);
        properties.getMaster().setHeartbeatGraceMs(5_000L);
        properties.getMaster().setMaxAttempts(2);
        properties.getMaster().setJobRetentionMs(10_000L);
        jobStore = new JobStore();
        scheduler = new JobScheduler(jobStore, new WorkerRegistry(),
                new LanguageProfileRegistry(TestLanguages.pythonAndC()), properties, clock);
    }

    private static SubmitRequest request(String language, TestCase... testCases) {
        SubmitRequest request = new SubmitRequest();
        request.setLanguage(language);
        request.setSourceCode("print(input())");
        request.setTestCases(new ArrayList<>(Arrays.asList(testCases)));
        return request;
    }

    private static SubmitRequest simpleRequest() {
        return request("python", new TestCase("t1", "a\n", "a\n"));
    }

    private void register(String workerId, int capacity) {
        scheduler.registerWorker(new WorkerRegistration(workerId, "10.0.0.1", capacity));
    }

    private static Verdict verdict(String testCaseId, VerdictOutcomeEnum outcome) {
        return Verdict.builder().testCaseId(testCaseId).outcome(outcome).actualOutput("").errorOutput("")
                .exitCode(0).durationMs(1L).peakMemoryMb(1L).build();
    }

    @Test
    public void submitWithoutWorkersStaysPending() {
        String jobId = scheduler.submit(simpleRequest());
        JobStatusResponse status = scheduler.getStatus(jobId);
        assertEquals(JobStatusEnum.PENDING, status.getStatus());
        assertEquals("python", status.getLanguage());
        assertEquals(0, status.getAttempts());
        assertTrue(status.getVerdicts().isEmpty());
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    public void aliasIsStoredAsCanonicalLanguage() {
        String jobId = scheduler.submit(request("PY", new TestCase("t1", "", "")));
        assertEquals("python", scheduler.getStatus(jobId).getLanguage());
    }

    @Test
    public void rejectsInvalidSubmissions() {
        assertEquals(ErrorCodeEnum.UNKNOWN_LANGUAGE,
                assertThrows(BusinessException.class, () -> scheduler.submit(request("cobol",
                        new TestCase("t1", "", "")))).getErrorCode());
        assertEquals(ErrorCodeEnum.INVALID_REQUEST,
                assertThrows(BusinessException.class, () -> scheduler.submit(request("python"))).getErrorCode());
        assertEquals(ErrorCodeEnum.INVALID_REQUEST,
                assertThrows(BusinessException.class, () -> scheduler.submit(request("python",
                        new TestCase("t1", "", ""), new TestCase("t1", "", "")))).getErrorCode());
        SubmitRequest noSource = simpleRequest();
        noSource.setSourceCode("");
        assertEquals(ErrorCodeEnum.INVALID_REQUEST,
                assertThrows(BusinessException.class, () -> scheduler.submit(noSource)).getErrorCode());
        assertEquals(ErrorCodeEnum.INVALID_REQUEST,
                assertThrows(BusinessException.class, () -> scheduler.submit(null)).getErrorCode());
        assertEquals(0, jobStore.size());
    }

    @Test
    public void limitsAreDefaultedAndClamped() {
        register("w1", 4);
        SubmitRequest huge = simpleRequest();
        huge.setTimeLimitMs(1_000_000);
        huge.setMemoryLimitMb(1);
        scheduler.submit(huge);
        scheduler.submit(simpleRequest());

        List<JobAssignment> assignments = scheduler.pollAssignments("w1");
        assertEquals(2, assignments.size());
        assertEquals(30_000, assignments.get(0).getTimeLimitMs());
        assertEquals(16, assignments.get(0).getMemoryLimitMb());
        assertEquals(2_000, assignments.get(1).getTimeLimitMs());
        assertEquals(128, assignments.get(1).getMemoryLimitMb());
    }

    @Test
    public void compilerFlagsAreCarriedToTheAssignment() {
        register("w1", 1);
        SubmitRequest withFlags = request("c", new TestCase("t1", "", ""));
        withFlags.setCompilerFlags(Arrays.asList("-Wall", "-std=c11", "-DLIMIT=10"));
        scheduler.submit(withFlags);

        List<JobAssignment> assignments = scheduler.pollAssignments("w1");
        assertEquals(Arrays.asList("-Wall", "-std=c11", "-DLIMIT=10"), assignments.get(0).getCompilerFlags());
    }

    @Test
    public void missingCompilerFlagsAreEmpty() {
        register("w1", 1);
        scheduler.submit(simpleRequest());
        assertTrue(scheduler.pollAssignments("w1").get(0).getCompilerFlags().isEmpty());
    }

    @Test
    public void rejectsCompilerFlagsThatCouldEscapeTheShell() {
        for (String flag : Arrays.asList("-O2; rm -rf /", "$(id)", "-o main`id`", "O2", "-", "-a b", "-x'y")) {
            SubmitRequest unsafe = request("c", new TestCase("t1", "", ""));
            unsafe.setCompilerFlags(Arrays.asList("-O2", flag));
            assertEquals(ErrorCodeEnum.INVALID_REQUEST,
                    assertThrows(BusinessException.class, () -> scheduler.submit(unsafe)).getErrorCode(), flag);
        }
        SubmitRequest nullFlag = request("c", new TestCase("t1", "", ""));
        nullFlag.setCompilerFlags(Arrays.asList("-O2", null));
        assertThrows(BusinessException.class, () -> scheduler.submit(nullFlag));
        assertEquals(0, jobStore.size());
    }

    @Test
    public void unknownJobIsNotFound() {
        BusinessException e = assertThrows(BusinessException.class, () -> scheduler.getStatus("nope"));
        assertEquals(ErrorCodeEnum.JOB_NOT_FOUND, e.getErrorCode());
    }

    @Test
    public void pendingJobsAreDispatchedInSubmissionOrder() {
        String first = scheduler.submit(simpleRequest());
        String second = scheduler.submit(simpleRequest());
        String third = scheduler.submit(simpleRequest());
        register("w1", 2);

        List<JobAssignment> assignments = scheduler.pollAssignments("w1");
        assertEquals(Arrays.asList(first, second), Arrays.asList(assignments.get(0).getJobId(),
                assignments.get(1).getJobId()));
        assertEquals(JobStatusEnum.PENDING, scheduler.getStatus(third).getStatus());
    }

    @Test
    public void prefersWorkerWithMostAvailableSlots() {
        register("small", 1);
        register("large", 3);
        String jobId = scheduler.submit(simpleRequest());
        assertTrue(scheduler.pollAssignments("small").isEmpty());
        assertEquals(jobId, scheduler.pollAssignments("large").get(0).getJobId());

        List<WorkerView> workers = scheduler.listWorkers();
        assertEquals(2, workers.size());
        assertEquals("large", workers.get(0).getId());
        assertEquals(2, workers.get(0).getAvailableSlots());
    }

    @Test
    public void neverAssignsBeyondCapacity() {
        register("w1", 1);
        scheduler.submit(simpleRequest());
        String waiting = scheduler.submit(simpleRequest());
        assertEquals(1, scheduler.pollAssignments("w1").size());
        assertEquals(JobStatusEnum.PENDING, scheduler.getStatus(waiting).getStatus());
        assertEquals(0, scheduler.listWorkers().get(0).getAvailableSlots());
    }

    @Test
    public void completesWhenEveryTestCaseIsJudgedAndFreesTheSlot() {
        register("w1", 1);
        String jobId = scheduler.submit(request("python", new TestCase("t1", "", ""), new TestCase("t2", "", "")));
        String next = scheduler.submit(simpleRequest());
        scheduler.pollAssignments("w1");
        scheduler.updateStatus(jobId, new JobStatusUpdate("w1", JobStatusEnum.RUNNING, null));
        assertEquals(JobStatusEnum.RUNNING, scheduler.getStatus(jobId).getStatus());

        scheduler.recordVerdict(jobId, new VerdictReport("w1", verdict("t2", VerdictOutcomeEnum.WRONG_ANSWER)));
        assertEquals(JobStatusEnum.RUNNING, scheduler.getStatus(jobId).getStatus());
        scheduler.recordVerdict(jobId, new VerdictReport("w1", verdict("t1", VerdictOutcomeEnum.ACCEPTED)));

        JobStatusResponse status = scheduler.getStatus(jobId);
        assertEquals(JobStatusEnum.COMPLETED, status.getStatus());
        assertEquals("t1", status.getVerdicts().get(0).getTestCaseId());
        assertEquals("t2", status.getVerdicts().get(1).getTestCaseId());
        assertEquals(JobStatusEnum.ASSIGNED, scheduler.getStatus(next).getStatus());
    }

    @Test
    public void verdictIsWrittenOnlyOnce() {
        register("w1", 1);
        String jobId = scheduler.submit(request("python", new TestCase("t1", "", ""), new TestCase("t2", "", "")));
        scheduler.pollAssignments("w1");
        scheduler.recordVerdict(jobId, new VerdictReport("w1", verdict("t1", VerdictOutcomeEnum.ACCEPTED)));
        scheduler.recordVerdict(jobId, new VerdictReport("w1", verdict("t1", VerdictOutcomeEnum.WRONG_ANSWER)));
        assertEquals(VerdictOutcomeEnum.ACCEPTED, scheduler.getStatus(jobId).getVerdicts().get(0).getOutcome());
        assertEquals(1, scheduler.getStatus(jobId).getVerdicts().size());
    }

    @Test
    public void compilerOutputIsKeptOnCompileError() {
        register("w1", 1);
        String jobId = scheduler.submit(request("c", new TestCase("t1", "", "")));
        scheduler.pollAssignments("w1");
        scheduler.updateStatus(jobId, new JobStatusUpdate("w1", JobStatusEnum.COMPILING, null));
        scheduler.updateStatus(jobId, new JobStatusUpdate("w1", JobStatusEnum.COMPILING, "main.c:1: error"));
        scheduler.recordVerdict(jobId, new VerdictReport("w1", verdict("t1", VerdictOutcomeEnum.COMPILE_ERROR)));

        JobStatusResponse status = scheduler.getStatus(jobId);
        assertEquals(JobStatusEnum.COMPLETED, status.getStatus());
        assertEquals("main.c:1: error", status.getCompilerOutput());
    }

    @Test
    public void workersMayNotReportTerminalStatus() {
        register("w1", 1);
        String jobId = scheduler.submit(simpleRequest());
        BusinessException e = assertThrows(BusinessException.class, () -> scheduler.updateStatus(jobId,
                new JobStatusUpdate("w1", JobStatusEnum.COMPLETED, null)));
        assertEquals(ErrorCodeEnum.INVALID_REQUEST, e.getErrorCode());
    }

    @Test
    public void unacknowledgedAssignmentIsRetriedThenFailed() {
        register("w1", 1);
        String jobId = scheduler.submit(simpleRequest());
        assertEquals(JobStatusEnum.ASSIGNED, scheduler.getStatus(jobId).getStatus());

        clock.advanceMillis(1_500L);
        scheduler.heartbeat("w1", 0);
        assertEquals(1, scheduler.reapExpiredAssignments());
        // 重新排队后立即再次分配给唯一的节点
        JobStatusResponse retried = scheduler.getStatus(jobId);
        assertEquals(JobStatusEnum.ASSIGNED, retried.getStatus());
        assertEquals(2, retried.getAttempts());

        clock.advanceMillis(1_500L);
        assertEquals(1, scheduler.reapExpiredAssignments());
        JobStatusResponse failed = scheduler.getStatus(jobId);
        assertEquals(JobStatusEnum.FAILED, failed.getStatus());
        assertNotNull(failed.getError());
        assertEquals(1, scheduler.listWorkers().get(0).getAvailableSlots());
    }

    @Test
    public void acknowledgedJobIsNotReapedBeforeJobTimeout() {
        register("w1", 1);
        String jobId = scheduler.submit(simpleRequest());
        scheduler.pollAssignments("w1");
        clock.advanceMillis(30_000L);
        assertEquals(0, scheduler.reapExpiredAssignments());
        clock.advanceMillis(31_000L);
        assertEquals(1, scheduler.reapExpiredAssignments());
        assertEquals(2, scheduler.getStatus(jobId).getAttempts());
    }

    @Test
    public void retriedJobKeepsVerdictsAndResendsOnlyRemainingCases() {
        register("w1", 1);
        String jobId = scheduler.submit(request("python", new TestCase("t1", "", ""), new TestCase("t2", "", "")));
        scheduler.pollAssignments("w1");
        scheduler.recordVerdict(jobId, new VerdictReport("w1", verdict("t1", VerdictOutcomeEnum.ACCEPTED)));
        scheduler.reportFailure(jobId, new FailureReport("w1", "docker daemon unavailable"));

        List<JobAssignment> retry = scheduler.pollAssignments("w1");
        assertEquals(1, retry.size());
        assertEquals(2, retry.get(0).getAttempt());
        assertEquals(1, retry.get(0).getTestCases().size());
        assertEquals("t2", retry.get(0).getTestCases().get(0).getId());
        assertEquals(1, scheduler.getStatus(jobId).getVerdicts().size());
    }

    @Test
    public void reportsFromFormerAssigneeAreIgnored() {
        register("w1", 1);
        String jobId = scheduler.submit(simpleRequest());
        scheduler.pollAssignments("w1");
        register("w2", 1);
        scheduler.deregisterWorker("w1");
        assertEquals(1, scheduler.pollAssignments("w2").size());

        scheduler.recordVerdict(jobId, new VerdictReport("w1", verdict("t1", VerdictOutcomeEnum.ACCEPTED)));
        assertTrue(scheduler.getStatus(jobId).getVerdicts().isEmpty());
        scheduler.reportFailure(jobId, new FailureReport("w1", "late failure"));
        assertEquals(JobStatusEnum.ASSIGNED, scheduler.getStatus(jobId).getStatus());
    }

    @Test
    public void internalErrorVerdictTriggersRetry() {
        register("w1", 1);
        String jobId = scheduler.submit(simpleRequest());
        scheduler.pollAssignments("w1");
        scheduler.recordVerdict(jobId, new VerdictReport("w1", verdict("t1", VerdictOutcomeEnum.INTERNAL_ERROR)));
        JobStatusResponse status = scheduler.getStatus(jobId);
        assertTrue(status.getVerdicts().isEmpty());
        assertEquals(2, status.getAttempts());
    }

    @Test
    public void silentWorkerIsEvictedAndItsJobMovesElsewhere() {
        register("w1", 1);
        String jobId = scheduler.submit(simpleRequest());
        scheduler.pollAssignments("w1");
        clock.advanceMillis(3_000L);
        register("w2", 1);
        clock.advanceMillis(3_000L);
        scheduler.heartbeat("w2", 0);

        assertEquals(1, scheduler.evictDeadWorkers());
        assertEquals(1, scheduler.listWorkers().size());
        assertFalse(scheduler.heartbeat("w1", 0));
        assertEquals(jobId, scheduler.pollAssignments("w2").get(0).getJobId());

        BusinessException e = assertThrows(BusinessException.class, () -> scheduler.pollAssignments("w1"));
        assertEquals(ErrorCodeEnum.UNKNOWN_WORKER, e.getErrorCode());
    }

    @Test
    public void reRegistrationRetriesJobsOfThePreviousIncarnation() {
        register("w1", 1);
        String jobId = scheduler.submit(simpleRequest());
        scheduler.pollAssignments("w1");
        register("w1", 1);
        List<JobAssignment> assignments = scheduler.pollAssignments("w1");
        assertEquals(1, assignments.size());
        assertEquals(jobId, assignments.get(0).getJobId());
        assertEquals(2, assignments.get(0).getAttempt());
    }

    @Test
    public void finishedJobsAreEvictedAfterRetention() {
        register("w1", 1);
        String jobId = scheduler.submit(simpleRequest());
        scheduler.pollAssignments("w1");
        scheduler.recordVerdict(jobId, new VerdictReport("w1", verdict("t1", VerdictOutcomeEnum.ACCEPTED)));
        String activeId = scheduler.submit(simpleRequest());

        clock.advanceMillis(5_000L);
        assertEquals(0, scheduler.evictFinishedJobs());
        clock.advanceMillis(6_000L);
        scheduler.heartbeat("w1", 0);
        assertEquals(1, scheduler.evictFinishedJobs());
        assertThrows(BusinessException.class, () -> scheduler.getStatus(jobId));
        assertEquals(JobStatusEnum.ASSIGNED, scheduler.getStatus(activeId).getStatus());
    }

    @Test
    public void invalidRegistrationIsRejected() {
        assertThrows(BusinessException.class,
                () -> scheduler.registerWorker(new WorkerRegistration("w1", "addr", 0)));
        assertThrows(BusinessException.class,
                () -> scheduler.registerWorker(new WorkerRegistration(" ", "addr", 1)));
    }
}
