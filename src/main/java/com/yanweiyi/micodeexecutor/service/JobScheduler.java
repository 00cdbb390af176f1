package com.yanweiyi.micodeexecutor.service;

import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.ReUtil;
import cn.hutool.core.util.StrUtil;
import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import com.yanweiyi.micodeexecutor.exception.BusinessException;
import com.yanweiyi.micodeexecutor.model.FailureReport;
import com.yanweiyi.micodeexecutor.model.JobAssignment;
import com.yanweiyi.micodeexecutor.model.JobRecord;
import com.yanweiyi.micodeexecutor.model.JobStatusResponse;
import com.yanweiyi.micodeexecutor.model.JobStatusUpdate;
import com.yanweiyi.micodeexecutor.model.SubmitRequest;
import com.yanweiyi.micodeexecutor.model.TestCase;
import com.yanweiyi.micodeexecutor.model.Verdict;
import com.yanweiyi.micodeexecutor.model.VerdictReport;
import com.yanweiyi.micodeexecutor.model.WorkerNode;
import com.yanweiyi.micodeexecutor.model.WorkerRegistration;
import com.yanweiyi.micodeexecutor.model.WorkerView;
import com.yanweiyi.micodeexecutor.model.enums.ErrorCodeEnum;
import com.yanweiyi.micodeexecutor.model.enums.JobStatusEnum;
import com.yanweiyi.micodeexecutor.model.enums.VerdictOutcomeEnum;
import com.yanweiyi.micodeexecutor.sandbox.language.LanguageProfile;
import com.yanweiyi.micodeexecutor.sandbox.language.LanguageProfileRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 任务队列与调度器
 * <p>
 * 待调度任务按提交顺序排队，分配给空闲槽位最多的节点；
 * 节点拉取任务即视为确认。确认超时、执行超时、节点失联都会触发重试，
 * 超过最大分配次数后任务进入 failed。
 * <p>
 * 加锁顺序：先 queueLock 后任务监视器，持有任务监视器时不获取 queueLock。
 *
 * @author yanweiyi
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "micode.master", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobScheduler {

    private static final int MAX_COMPILER_FLAGS = 32;

    // 以 - 开头，只含字母数字和 = + . , : / _ -
    private static final Pattern COMPILER_FLAG_PATTERN = Pattern.compile("-[A-Za-z0-9_=+.,:/-]{1,127}");

    private final JobStore jobStore;

    private final WorkerRegistry workerRegistry;

    private final LanguageProfileRegistry languageProfileRegistry;

    private final MicodeProperties.Master masterProperties;

    private final MicodeProperties.Limits limits;

    private final Clock clock;

    private final AtomicLong sequence = new AtomicLong();

    private final ReentrantLock queueLock = new ReentrantLock();

    private final PriorityQueue<JobRecord> pendingQueue =
            new PriorityQueue<>(Comparator.comparingLong(JobRecord::getSequence));

    public JobScheduler(JobStore jobStore, WorkerRegistry workerRegistry,
                        LanguageProfileRegistry languageProfileRegistry, MicodeProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.workerRegistry = workerRegistry;
        this.languageProfileRegistry = languageProfileRegistry;
        this.masterProperties = properties.getMaster();
        this.limits = properties.getLimits();
        this.clock = clock;
    }

    /**
     * 校验并接收任务，返回任务 id
     * <p>
     * 没有在线节点时任务保持 pending，等待节点加入。
     */
    public String submit(SubmitRequest request) {
        if (request == null) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "request body is required");
        }
        if (StrUtil.isBlank(request.getLanguage())) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "language is required");
        }
        LanguageProfile profile = languageProfileRegistry.require(request.getLanguage());
        if (StrUtil.isBlank(request.getSourceCode())) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "source_code is required");
        }
        List<TestCase> testCases = normalizeTestCases(request.getTestCases());
        List<String> compilerFlags = normalizeCompilerFlags(request.getCompilerFlags());
        int timeLimitMs = clamp(request.getTimeLimitMs(), limits.getDefaultTimeLimitMs(),
                limits.getMinTimeLimitMs(), limits.getMaxTimeLimitMs());
        int memoryLimitMb = clamp(request.getMemoryLimitMb(), limits.getDefaultMemoryLimitMb(),
                limits.getMinMemoryLimitMb(), limits.getMaxMemoryLimitMb());

        JobRecord job = new JobRecord(IdUtil.fastSimpleUUID(), sequence.incrementAndGet(), profile.getLanguage(),
                request.getSourceCode(), testCases, compilerFlags, timeLimitMs, memoryLimitMb, clock.instant());
        jobStore.save(job);
        log.info("job {} submitted: language={}, testCases={}, compilerFlags={}, timeLimitMs={}, memoryLimitMb={}",
                job.getId(), job.getLanguage(), testCases.size(), compilerFlags, timeLimitMs, memoryLimitMb);
        enqueue(job);
        dispatchPending();
        return job.getId();
    }

    public JobStatusResponse getStatus(String jobId) {
        return requireJob(jobId).toStatusResponse();
    }

    public List<WorkerView> listWorkers() {
        return workerRegistry.snapshot().stream()
                .map(WorkerNode::toView)
                .collect(Collectors.toList());
    }

    /**
     * 登记工作节点；同 id 重新注册时，旧节点上的任务按失联处理
     */
    public void registerWorker(WorkerRegistration registration) {
        if (registration == null || StrUtil.isBlank(registration.getId())) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "worker id is required");
        }
        if (registration.getCapacity() == null || registration.getCapacity() < 1) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "worker capacity must be positive");
        }
        String workerId = registration.getId();
        Optional<WorkerNode> previous = workerRegistry.remove(workerId);
        if (previous.isPresent()) {
            log.warn("worker {} re-registered, retrying its unfinished jobs", workerId);
            retryJobsOf(workerId, "worker " + workerId + " restarted");
        }
        workerRegistry.register(new WorkerNode(workerId, registration.getAddress(),
                registration.getCapacity(), clock.instant()));
        log.info("worker {} registered: address={}, capacity={}",
                workerId, registration.getAddress(), registration.getCapacity());
        dispatchPending();
    }

    /**
     * @return 节点未登记时返回 false，节点应重新注册
     */
    public boolean heartbeat(String workerId, int activeTasks) {
        Optional<WorkerNode> worker = workerRegistry.findById(workerId);
        if (!worker.isPresent()) {
            log.debug("heartbeat from unknown worker {}", workerId);
            return false;
        }
        worker.get().heartbeat(activeTasks, clock.instant());
        dispatchPending();
        return true;
    }

    /**
     * 节点拉取已分配给它的任务，拉取即确认
     */
    public List<JobAssignment> pollAssignments(String workerId) {
        WorkerNode worker = requireWorker(workerId);
        Instant now = clock.instant();
        List<JobAssignment> assignments = new ArrayList<>();
        for (String jobId : worker.drainOutbox()) {
            Optional<JobRecord> job = jobStore.findById(jobId);
            if (!job.isPresent()) {
                continue;
            }
            JobRecord record = job.get();
            synchronized (record) {
                if (record.acknowledge(workerId, now)) {
                    assignments.add(record.toAssignment());
                }
            }
        }
        if (!assignments.isEmpty()) {
            log.debug("worker {} acknowledged {} jobs", workerId, assignments.size());
        }
        return assignments;
    }

    /**
     * 节点上报 compiling / running
     */
    public void updateStatus(String jobId, JobStatusUpdate update) {
        if (update == null || update.getStatus() == null) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "status is required");
        }
        JobStatusEnum target = update.getStatus();
        if (target != JobStatusEnum.COMPILING && target != JobStatusEnum.RUNNING) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "workers may only report compiling or running");
        }
        JobRecord job = requireJob(jobId);
        if (!job.advance(update.getWorkerId(), target, update.getCompilerOutput(), clock.instant())) {
            log.debug("ignored status {} for job {} from worker {}", target.getValue(), jobId, update.getWorkerId());
        }
    }

    /**
     * 写入一个用例的判定结果，所有用例判定后任务完成并释放槽位
     */
    public void recordVerdict(String jobId, VerdictReport report) {
        if (report == null || report.getVerdict() == null) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "verdict is required");
        }
        Verdict verdict = report.getVerdict();
        if (StrUtil.isBlank(verdict.getTestCaseId()) || verdict.getOutcome() == null) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "verdict needs test_case_id and outcome");
        }
        JobRecord job = requireJob(jobId);
        String workerId = report.getWorkerId();
        if (verdict.getOutcome() == VerdictOutcomeEnum.INTERNAL_ERROR) {
            retryOrFail(job, workerId, "sandbox internal error on test case " + verdict.getTestCaseId());
            return;
        }
        Instant now = clock.instant();
        boolean recorded;
        boolean completed;
        synchronized (job) {
            recorded = job.recordVerdict(workerId, verdict, now);
            completed = recorded && job.completeIfJudged(now);
        }
        if (!recorded) {
            log.debug("ignored verdict for job {} test case {} from worker {}",
                    jobId, verdict.getTestCaseId(), workerId);
            return;
        }
        if (completed) {
            log.info("job {} completed on worker {}", jobId, workerId);
            releaseSlot(workerId);
            dispatchPending();
        }
    }

    public void reportFailure(String jobId, FailureReport report) {
        if (report == null) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "failure report is required");
        }
        JobRecord job = requireJob(jobId);
        String reason = StrUtil.blankToDefault(report.getReason(), "worker reported failure");
        retryOrFail(job, report.getWorkerId(), reason);
    }

    /**
     * 节点正常下线，其未完成的任务重新排队
     */
    public void deregisterWorker(String workerId) {
        Optional<WorkerNode> removed = workerRegistry.remove(workerId);
        if (!removed.isPresent()) {
            throw new BusinessException(ErrorCodeEnum.UNKNOWN_WORKER);
        }
        log.info("worker {} deregistered", workerId);
        retryJobsOf(workerId, "worker " + workerId + " left the cluster");
    }

    /**
     * 把队首任务依次分配给空闲槽位最多的节点，直到队列为空或没有空闲槽位
     *
     * @return 本次分配的任务数
     */
    public int dispatchPending() {
        int dispatched = 0;
        queueLock.lock();
        try {
            while (!pendingQueue.isEmpty()) {
                Optional<WorkerNode> candidate = workerRegistry.selectForAssignment();
                if (!candidate.isPresent()) {
                    break;
                }
                WorkerNode worker = candidate.get();
                if (!worker.tryAcquireSlot()) {
                    continue;
                }
                JobRecord job = pendingQueue.poll();
                if (!job.assign(worker.getId(), clock.instant())) {
                    worker.releaseSlot();
                    continue;
                }
                worker.offer(job.getId());
                dispatched++;
                log.info("job {} assigned to worker {} (attempt {})", job.getId(), worker.getId(), job.getAttempts());
            }
        } finally {
            queueLock.unlock();
        }
        return dispatched;
    }

    public int pendingCount() {
        queueLock.lock();
        try {
            return pendingQueue.size();
        } finally {
            queueLock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${micode.master.maintenance-interval-ms:1000}")
    public void runMaintenance() {
        reapExpiredAssignments();
        evictDeadWorkers();
        evictFinishedJobs();
        dispatchPending();
    }

    /**
     * 确认超时、执行超时的任务重新排队或失败
     *
     * @return 处理的任务数
     */
    public int reapExpiredAssignments() {
        Instant now = clock.instant();
        int reaped = 0;
        for (JobRecord job : jobStore.findActive()) {
            String workerId;
            String reason;
            RetryDecision decision;
            synchronized (job) {
                workerId = job.getAssignedWorkerId();
                reason = expiryReason(job, now);
                if (workerId == null || reason == null) {
                    continue;
                }
                decision = decideRetry(job, workerId, reason, now);
            }
            if (decision != RetryDecision.IGNORED) {
                afterRetry(job, workerId, reason, decision);
                reaped++;
            }
        }
        return reaped;
    }

    /**
     * 剔除超过心跳宽限期的节点，其任务按失联处理
     *
     * @return 剔除的节点数
     */
    public int evictDeadWorkers() {
        Instant cutoff = clock.instant().minusMillis(masterProperties.getHeartbeatGraceMs());
        int evicted = 0;
        for (WorkerNode worker : workerRegistry.snapshot()) {
            if (!worker.getLastHeartbeat().isBefore(cutoff)) {
                continue;
            }
            if (workerRegistry.remove(worker)) {
                evicted++;
                log.warn("worker {} evicted, last heartbeat at {}", worker.getId(), worker.getLastHeartbeat());
                retryJobsOf(worker.getId(), "worker " + worker.getId() + " stopped sending heartbeats");
            }
        }
        return evicted;
    }

    public int evictFinishedJobs() {
        return jobStore.evictFinishedBefore(clock.instant().minusMillis(masterProperties.getJobRetentionMs()));
    }

    /**
     * 分配次数未用完时重新排队，否则标记为 failed；只处理当前仍分配给 workerId 的任务
     *
     * @return 是否处理了该任务
     */
    private boolean retryOrFail(JobRecord job, String workerId, String reason) {
        RetryDecision decision;
        synchronized (job) {
            decision = decideRetry(job, workerId, reason, clock.instant());
        }
        if (decision == RetryDecision.IGNORED) {
            log.debug("ignored failure of job {} from worker {}: {}", job.getId(), workerId, reason);
            return false;
        }
        afterRetry(job, workerId, reason, decision);
        return true;
    }

    /**
     * 调用方需持有任务监视器
     */
    private RetryDecision decideRetry(JobRecord job, String workerId, String reason, Instant now) {
        if (!job.isAssignedTo(workerId)) {
            return RetryDecision.IGNORED;
        }
        if (job.getAttempts() >= masterProperties.getMaxAttempts()) {
            job.fail(reason + " (gave up after " + job.getAttempts() + " attempts)", now);
            return RetryDecision.FAILED;
        }
        job.requeue(now);
        return RetryDecision.REQUEUED;
    }

    /**
     * 释放槽位，重新排队的任务立即尝试再次分配；调用方不能持有任务监视器
     */
    private void afterRetry(JobRecord job, String workerId, String reason, RetryDecision decision) {
        releaseSlot(workerId);
        if (decision == RetryDecision.REQUEUED) {
            log.warn("job {} requeued after attempt {}: {}", job.getId(), job.getAttempts(), reason);
            enqueue(job);
            dispatchPending();
        } else {
            log.error("job {} failed: {}", job.getId(), reason);
        }
    }

    private void retryJobsOf(String workerId, String reason) {
        for (JobRecord job : jobStore.findActiveByWorker(workerId)) {
            retryOrFail(job, workerId, reason);
        }
    }

    private String expiryReason(JobRecord job, Instant now) {
        if (job.getStatus().isTerminal() || job.getAssignedAt() == null) {
            return null;
        }
        Instant acknowledgedAt = job.getAcknowledgedAt();
        if (acknowledgedAt == null) {
            if (job.getAssignedAt().plusMillis(masterProperties.getAckTimeoutMs()).isBefore(now)) {
                return "worker " + job.getAssignedWorkerId() + " did not acknowledge the job in time";
            }
            return null;
        }
        if (acknowledgedAt.plusMillis(masterProperties.getJobTimeoutMs()).isBefore(now)) {
            return "job timed out on worker " + job.getAssignedWorkerId();
        }
        return null;
    }

    private void enqueue(JobRecord job) {
        queueLock.lock();
        try {
            pendingQueue.offer(job);
        } finally {
            queueLock.unlock();
        }
    }

    private void releaseSlot(String workerId) {
        workerRegistry.findById(workerId).ifPresent(WorkerNode::releaseSlot);
    }

    private JobRecord requireJob(String jobId) {
        return jobStore.findById(jobId)
                .orElseThrow(() -> new BusinessException(ErrorCodeEnum.JOB_NOT_FOUND, "job " + jobId + " not found"));
    }

    private WorkerNode requireWorker(String workerId) {
        return workerRegistry.findById(workerId)
                .orElseThrow(() -> new BusinessException(ErrorCodeEnum.UNKNOWN_WORKER,
                        "worker " + workerId + " is not registered"));
    }

    private static List<TestCase> normalizeTestCases(List<TestCase> testCases) {
        if (testCases == null || testCases.isEmpty()) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "at least one test case is required");
        }
        Set<String> ids = new HashSet<>();
        List<TestCase> normalized = new ArrayList<>(testCases.size());
        for (TestCase testCase : testCases) {
            if (testCase == null || StrUtil.isBlank(testCase.getId())) {
                throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "every test case needs an id");
            }
            if (!ids.add(testCase.getId())) {
                throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST,
                        "duplicate test case id: " + testCase.getId());
            }
            normalized.add(new TestCase(testCase.getId(),
                    StrUtil.nullToEmpty(testCase.getInput()),
                    StrUtil.nullToEmpty(testCase.getExpectedOutput())));
        }
        return normalized;
    }

    /**
     * 编译参数经 sh -c 执行，只允许不含空白和 shell 元字符的单个参数
     */
    private static List<String> normalizeCompilerFlags(List<String> compilerFlags) {
        if (compilerFlags == null || compilerFlags.isEmpty()) {
            return Collections.emptyList();
        }
        if (compilerFlags.size() > MAX_COMPILER_FLAGS) {
            throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST,
                    "at most " + MAX_COMPILER_FLAGS + " compiler flags are allowed");
        }
        for (String flag : compilerFlags) {
            if (flag == null || !ReUtil.isMatch(COMPILER_FLAG_PATTERN, flag)) {
                throw new BusinessException(ErrorCodeEnum.INVALID_REQUEST, "invalid compiler flag: " + flag);
            }
        }
        return new ArrayList<>(compilerFlags);
    }

    private static int clamp(Integer value, int defaultValue, int min, int max) {
        if (value == null) {
            return defaultValue;
        }
        return Math.max(min, Math.min(max, value));
    }

    private enum RetryDecision {
        IGNORED,
        REQUEUED,
        FAILED
    }
}
