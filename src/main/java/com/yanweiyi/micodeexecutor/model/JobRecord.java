package com.yanweiyi.micodeexecutor.model;

import com.yanweiyi.micodeexecutor.model.enums.JobStatusEnum;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Master 端保存的任务记录
 * <p>
 * 不可变字段在构造时确定；状态、分配信息由对象自身的监视器保护；
 * 判定结果按用例 id 只写一次，写入后不会被覆盖。
 *
 * @author yanweiyi
 */
public class JobRecord {

    @Getter
    private final String id;

    /**
     * 提交顺序，FIFO 调度依据
     */
    @Getter
    private final long sequence;

    @Getter
    private final String language;

    @Getter
    private final String sourceCode;

    @Getter
    private final List<TestCase> testCases;

    /**
     * 附加到编译命令的编译参数
     */
    @Getter
    private final List<String> compilerFlags;

    @Getter
    private final int timeLimitMs;

    @Getter
    private final int memoryLimitMb;

    @Getter
    private final Instant createdAt;

    private final Map<String, Verdict> verdicts = new ConcurrentHashMap<>();

    private JobStatusEnum status = JobStatusEnum.PENDING;

    private Instant updatedAt;

    private String assignedWorkerId;

    private Instant assignedAt;

    private Instant acknowledgedAt;

    private int attempts;

    private String compilerOutput;

    private String failureReason;

    public JobRecord(String id, long sequence, String language, String sourceCode, List<TestCase> testCases,
                     int timeLimitMs, int memoryLimitMb, Instant createdAt) {
        this(id, sequence, language, sourceCode, testCases, Collections.emptyList(), timeLimitMs, memoryLimitMb,
                createdAt);
    }

    public JobRecord(String id, long sequence, String language, String sourceCode, List<TestCase> testCases,
                     List<String> compilerFlags, int timeLimitMs, int memoryLimitMb, Instant createdAt) {
        this.id = id;
        this.sequence = sequence;
        this.language = language;
        this.sourceCode = sourceCode;
        List<TestCase> copies = new ArrayList<>(testCases.size());
        for (TestCase testCase : testCases) {
            copies.add(new TestCase(testCase.getId(), testCase.getInput(), testCase.getExpectedOutput()));
        }
        this.testCases = Collections.unmodifiableList(copies);
        this.compilerFlags = Collections.unmodifiableList(new ArrayList<>(compilerFlags));
        this.timeLimitMs = timeLimitMs;
        this.memoryLimitMb = memoryLimitMb;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public synchronized JobStatusEnum getStatus() {
        return status;
    }

    public synchronized String getAssignedWorkerId() {
        return assignedWorkerId;
    }

    public synchronized Instant getAssignedAt() {
        return assignedAt;
    }

    public synchronized Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized String getFailureReason() {
        return failureReason;
    }

    public synchronized boolean isAssignedTo(String workerId) {
        return assignedWorkerId != null && assignedWorkerId.equals(workerId) && !status.isTerminal();
    }

    /**
     * pending -> assigned，分配次数加一
     */
    public synchronized boolean assign(String workerId, Instant now) {
        if (!status.canTransitionTo(JobStatusEnum.ASSIGNED)) {
            return false;
        }
        status = JobStatusEnum.ASSIGNED;
        assignedWorkerId = workerId;
        assignedAt = now;
        acknowledgedAt = null;
        attempts++;
        updatedAt = now;
        return true;
    }

    /**
     * 工作节点拉取任务即视为确认
     */
    public synchronized boolean acknowledge(String workerId, Instant now) {
        if (status != JobStatusEnum.ASSIGNED || !Objects.equals(assignedWorkerId, workerId) || acknowledgedAt != null) {
            return false;
        }
        acknowledgedAt = now;
        updatedAt = now;
        return true;
    }

    /**
     * 工作节点上报的状态迁移（compiling / running）
     */
    public synchronized boolean advance(String workerId, JobStatusEnum target, String compilerOutput, Instant now) {
        if (!isAssignedTo(workerId)) {
            return false;
        }
        if (compilerOutput != null) {
            this.compilerOutput = compilerOutput;
        }
        if (status == target) {
            return true;
        }
        if (!status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        updatedAt = now;
        return true;
    }

    /**
     * 写入判定结果，仅接受当前分配节点的上报，同一用例只写一次
     *
     * @return 是否为首次写入
     */
    public synchronized boolean recordVerdict(String workerId, Verdict verdict, Instant now) {
        if (!isAssignedTo(workerId) || !hasTestCase(verdict.getTestCaseId())) {
            return false;
        }
        boolean recorded = verdicts.putIfAbsent(verdict.getTestCaseId(), verdict) == null;
        if (recorded) {
            updatedAt = now;
        }
        return recorded;
    }

    /**
     * 所有用例都有判定结果时迁移到 completed，只有一次调用会返回 true
     */
    public synchronized boolean completeIfJudged(Instant now) {
        if (status.isTerminal() || verdicts.size() < testCases.size()
                || !status.canTransitionTo(JobStatusEnum.COMPLETED)) {
            return false;
        }
        status = JobStatusEnum.COMPLETED;
        updatedAt = now;
        return true;
    }

    /**
     * 重试：回到 pending 并清除分配信息
     */
    public synchronized boolean requeue(Instant now) {
        if (!status.canTransitionTo(JobStatusEnum.PENDING)) {
            return false;
        }
        status = JobStatusEnum.PENDING;
        assignedWorkerId = null;
        assignedAt = null;
        acknowledgedAt = null;
        updatedAt = now;
        return true;
    }

    public synchronized boolean fail(String reason, Instant now) {
        if (!status.canTransitionTo(JobStatusEnum.FAILED)) {
            return false;
        }
        status = JobStatusEnum.FAILED;
        failureReason = reason;
        updatedAt = now;
        return true;
    }

    public synchronized List<TestCase> remainingTestCases() {
        List<TestCase> remaining = new ArrayList<>();
        for (TestCase testCase : testCases) {
            if (!verdicts.containsKey(testCase.getId())) {
                remaining.add(testCase);
            }
        }
        return remaining;
    }

    public synchronized JobAssignment toAssignment() {
        JobAssignment assignment = new JobAssignment();
        assignment.setJobId(id);
        assignment.setLanguage(language);
        assignment.setSourceCode(sourceCode);
        assignment.setTestCases(remainingTestCases());
        assignment.setCompilerFlags(new ArrayList<>(compilerFlags));
        assignment.setTimeLimitMs(timeLimitMs);
        assignment.setMemoryLimitMb(memoryLimitMb);
        assignment.setAttempt(attempts);
        return assignment;
    }

    public synchronized JobStatusResponse toStatusResponse() {
        JobStatusResponse response = new JobStatusResponse();
        response.setJobId(id);
        response.setStatus(status);
        response.setLanguage(language);
        response.setAttempts(attempts);
        response.setCreatedAt(createdAt);
        response.setUpdatedAt(updatedAt);
        response.setCompilerOutput(compilerOutput);
        response.setError(failureReason);
        List<Verdict> ordered = new ArrayList<>(verdicts.size());
        for (TestCase testCase : testCases) {
            Verdict verdict = verdicts.get(testCase.getId());
            if (verdict != null) {
                ordered.add(verdict);
            }
        }
        response.setVerdicts(ordered);
        return response;
    }

    private boolean hasTestCase(String testCaseId) {
        for (TestCase testCase : testCases) {
            if (testCase.getId().equals(testCaseId)) {
                return true;
            }
        }
        return false;
    }
}
