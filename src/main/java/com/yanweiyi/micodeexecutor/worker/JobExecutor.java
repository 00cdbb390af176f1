package com.yanweiyi.micodeexecutor.worker;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.thread.ThreadFactoryBuilder;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.ReUtil;
import cn.hutool.core.util.StrUtil;
import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import com.yanweiyi.micodeexecutor.model.JobAssignment;
import com.yanweiyi.micodeexecutor.model.JobStatusUpdate;
import com.yanweiyi.micodeexecutor.model.TestCase;
import com.yanweiyi.micodeexecutor.model.Verdict;
import com.yanweiyi.micodeexecutor.model.enums.JobStatusEnum;
import com.yanweiyi.micodeexecutor.sandbox.SandboxRequest;
import com.yanweiyi.micodeexecutor.sandbox.SandboxResult;
import com.yanweiyi.micodeexecutor.sandbox.SandboxRunner;
import com.yanweiyi.micodeexecutor.sandbox.VerdictClassifier;
import com.yanweiyi.micodeexecutor.sandbox.language.LanguageProfile;
import com.yanweiyi.micodeexecutor.sandbox.language.LanguageProfileRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 在工作节点上执行一个任务：保存源码、编译一次、逐个用例在沙箱中运行并上报判定结果
 * <p>
 * 同时运行的用例数不超过节点槽位数，每个任务的工作目录在结束后删除。
 *
 * @author yanweiyi
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "micode.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobExecutor {

    private static final String SANDBOX_PATH_PREFIX = "/sandbox/";

    private static final long REPORT_BACKOFF_MS = 200L;

    private static final String FLAGS_PLACEHOLDER = "{flags}";

    private final SandboxRunner sandboxRunner;

    private final LanguageProfileRegistry languageProfileRegistry;

    private final MasterClient masterClient;

    private final MicodeProperties.Worker workerProperties;

    private final Semaphore slots;

    private final AtomicInteger activeTasks = new AtomicInteger();

    private final ExecutorService jobPool;

    private final ExecutorService casePool;

    public JobExecutor(SandboxRunner sandboxRunner, LanguageProfileRegistry languageProfileRegistry,
                       MasterClient masterClient, MicodeProperties properties) {
        this.sandboxRunner = sandboxRunner;
        this.languageProfileRegistry = languageProfileRegistry;
        this.masterClient = masterClient;
        this.workerProperties = properties.getWorker();
        int capacity = workerProperties.resolveCapacity();
        this.slots = new Semaphore(capacity);
        this.jobPool = Executors.newFixedThreadPool(capacity,
                ThreadFactoryBuilder.create().setNamePrefix("micode-job-").build());
        this.casePool = Executors.newCachedThreadPool(
                ThreadFactoryBuilder.create().setNamePrefix("micode-case-").build());
    }

    /**
     * 正在运行的用例数
     */
    public int getActiveTasks() {
        return activeTasks.get();
    }

    /**
     * 异步执行任务
     */
    public void submit(String workerId, JobAssignment assignment) {
        jobPool.execute(() -> execute(workerId, assignment));
    }

    /**
     * 同步执行任务，结果通过 {@link MasterClient} 上报
     */
    public void execute(String workerId, JobAssignment assignment) {
        String jobId = assignment.getJobId();
        LanguageProfile profile = languageProfileRegistry.find(assignment.getLanguage()).orElse(null);
        if (profile == null) {
            reportFailure(jobId, workerId, "language " + assignment.getLanguage() + " is not configured on worker " + workerId);
            return;
        }
        log.info("job {} started on worker {}: language={}, testCases={}, attempt={}", jobId, workerId,
                profile.getLanguage(), assignment.getTestCases().size(), assignment.getAttempt());
        File workspace = null;
        try {
            workspace = prepareWorkspace(assignment, profile);
            if (profile.compiles() && !compile(workerId, assignment, profile, workspace)) {
                return;
            }
            report(jobId, () -> masterClient.reportStatus(jobId,
                    new JobStatusUpdate(workerId, JobStatusEnum.RUNNING, null)));
            runTestCases(workerId, assignment, profile, workspace);
        } catch (RuntimeException e) {
            log.error("job {} aborted on worker {}", jobId, workerId, e);
            reportFailure(jobId, workerId, "worker error: " + e.getMessage());
        } finally {
            if (workspace != null) {
                deleteWorkspace(jobId, workspace);
            }
        }
    }

    public void shutdown() {
        jobPool.shutdownNow();
        casePool.shutdownNow();
    }

    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        return jobPool.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)
                && casePool.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 编译一次，编译失败时为所有用例上报 compile_error
     *
     * @return 编译成功返回 true
     */
    private boolean compile(String workerId, JobAssignment assignment, LanguageProfile profile, File workspace) {
        String jobId = assignment.getJobId();
        report(jobId, () -> masterClient.reportStatus(jobId,
                new JobStatusUpdate(workerId, JobStatusEnum.COMPILING, null)));
        SandboxResult result = sandboxRunner.run(SandboxRequest.builder()
                .image(profile.getCompileImage())
                .command(compileCommand(profile.getCompileCmd(), assignment.getCompilerFlags()))
                .workspace(workspace.toPath())
                .writableWorkspace(true)
                .timeLimitMs(workerProperties.getCompileTimeLimitMs())
                .memoryLimitMb(workerProperties.getCompileMemoryLimitMb())
                .label(jobId + "-compile")
                .build());
        if (result.isInternalError()) {
            reportFailure(jobId, workerId, "compile sandbox error: " + result.getInternalErrorMessage());
            return false;
        }
        if (result.isSuccessful()) {
            return true;
        }
        String compilerOutput = sanitize(compilerOutput(result), workspace.toPath());
        log.info("job {} compilation failed: {}", jobId, StrUtil.brief(compilerOutput, 200));
        report(jobId, () -> masterClient.reportStatus(jobId,
                new JobStatusUpdate(workerId, JobStatusEnum.COMPILING, compilerOutput)));
        for (TestCase testCase : assignment.getTestCases()) {
            Verdict verdict = VerdictClassifier.compileError(testCase, compilerOutput);
            report(jobId, () -> masterClient.reportVerdict(jobId, workerId, verdict));
        }
        return false;
    }

    private void runTestCases(String workerId, JobAssignment assignment, LanguageProfile profile, File workspace) {
        String jobId = assignment.getJobId();
        AtomicBoolean failed = new AtomicBoolean();
        List<Future<?>> futures = new ArrayList<>();
        List<TestCase> testCases = assignment.getTestCases();
        for (int i = 0; i < testCases.size(); i++) {
            if (failed.get()) {
                break;
            }
            TestCase testCase = testCases.get(i);
            String stdinFile = "input-" + i + ".txt";
            FileUtil.writeUtf8String(StrUtil.nullToEmpty(testCase.getInput()), new File(workspace, stdinFile));
            SandboxRequest request = SandboxRequest.builder()
                    .image(profile.getRunImage())
                    .command(profile.getRunCmd())
                    .workspace(workspace.toPath())
                    .writableWorkspace(false)
                    .timeLimitMs(assignment.getTimeLimitMs())
                    .memoryLimitMb(assignment.getMemoryLimitMb())
                    .stdinFile(stdinFile)
                    .expectedOutput(StrUtil.nullToEmpty(testCase.getExpectedOutput()))
                    .label(jobId + "-" + i)
                    .build();
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reportFailure(jobId, workerId, "worker interrupted");
                failed.set(true);
                break;
            }
            activeTasks.incrementAndGet();
            futures.add(casePool.submit(() -> {
                try {
                    runTestCase(workerId, jobId, testCase, request, failed);
                } finally {
                    activeTasks.decrementAndGet();
                    slots.release();
                }
            }));
        }
        awaitAll(workerId, jobId, futures, failed);
    }

    private void runTestCase(String workerId, String jobId, TestCase testCase, SandboxRequest request,
                             AtomicBoolean failed) {
        if (failed.get()) {
            return;
        }
        SandboxResult result = sandboxRunner.run(request);
        if (result.isInternalError()) {
            if (failed.compareAndSet(false, true)) {
                reportFailure(jobId, workerId, "sandbox error on test case " + testCase.getId()
                        + ": " + result.getInternalErrorMessage());
            }
            return;
        }
        Verdict verdict = VerdictClassifier.toVerdict(testCase, result);
        log.debug("job {} test case {}: {} in {} ms", jobId, testCase.getId(),
                verdict.getOutcome().getValue(), verdict.getDurationMs());
        report(jobId, () -> masterClient.reportVerdict(jobId, workerId, verdict));
    }

    /**
     * 等待所有用例结束；用例线程抛出异常时没有判定结果，按节点故障上报
     */
    private void awaitAll(String workerId, String jobId, List<Future<?>> futures, AtomicBoolean failed) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("job {} interrupted while waiting for test cases", jobId);
                return;
            } catch (ExecutionException e) {
                log.error("job {} test case execution failed", jobId, e.getCause());
                if (failed.compareAndSet(false, true)) {
                    reportFailure(jobId, workerId, "test case execution failed: " + e.getCause());
                }
            }
        }
    }

    private void reportFailure(String jobId, String workerId, String reason) {
        log.warn("job {} failed on worker {}: {}", jobId, workerId, reason);
        report(jobId, () -> masterClient.reportFailure(jobId, workerId, reason));
    }

    /**
     * 上报失败时重试，仍失败则交给 Master 的超时机制
     */
    private void report(String jobId, Runnable action) {
        int attempts = Math.max(1, workerProperties.getReportAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                action.run();
                return;
            } catch (RuntimeException e) {
                log.warn("report for job {} failed (attempt {}/{}): {}", jobId, attempt, attempts, e.getMessage());
                if (attempt == attempts) {
                    log.error("giving up reporting for job {}", jobId, e);
                    return;
                }
            }
            try {
                Thread.sleep(REPORT_BACKOFF_MS * attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("report for job {} interrupted", jobId);
                return;
            }
        }
    }

    private File prepareWorkspace(JobAssignment assignment, LanguageProfile profile) {
        File workspace = FileUtil.mkdir(new File(workerProperties.getWorkspaceDir(),
                assignment.getJobId() + "-" + IdUtil.fastSimpleUUID()));
        FileUtil.writeUtf8String(assignment.getSourceCode(), new File(workspace, profile.getSourceFile()));
        return workspace;
    }

    private static void deleteWorkspace(String jobId, File workspace) {
        try {
            FileUtil.del(workspace);
        } catch (RuntimeException e) {
            log.error("error cleaning workspace of job {}: {}", jobId, e.getMessage());
        }
    }

    private static String compilerOutput(SandboxResult result) {
        String output;
        if (StrUtil.isNotEmpty(result.getErrorOutput()) && StrUtil.isNotEmpty(result.getOutput())) {
            output = result.getOutput() + result.getErrorOutput();
        } else {
            output = StrUtil.isNotEmpty(result.getErrorOutput()) ? result.getErrorOutput() : result.getOutput();
        }
        if (result.isTimeout()) {
            return StrUtil.isEmpty(output) ? "compilation timed out" : output + "\ncompilation timed out";
        }
        if (result.isMemoryOverflow()) {
            return StrUtil.isEmpty(output) ? "compilation exceeded memory limit" : output + "\ncompilation exceeded memory limit";
        }
        return output;
    }

    /**
     * 拼接编译参数：命令中有 {flags} 占位符时替换，否则追加到末尾；每个参数单独加引号
     */
    static String compileCommand(String compileCmd, List<String> compilerFlags) {
        List<String> quoted = new ArrayList<>();
        if (compilerFlags != null) {
            for (String flag : compilerFlags) {
                quoted.add("'" + StrUtil.replace(flag, "'", "'\\''") + "'");
            }
        }
        String flags = String.join(" ", quoted);
        if (StrUtil.contains(compileCmd, FLAGS_PLACEHOLDER)) {
            return StrUtil.replace(compileCmd, FLAGS_PLACEHOLDER, flags);
        }
        return quoted.isEmpty() ? compileCmd : compileCmd + " " + flags;
    }

    /**
     * 去掉编译输出中的沙箱目录和宿主机目录
     */
    static String sanitize(String output, Path workspace) {
        if (output == null) {
            return "";
        }
        String hostPrefix = ReUtil.escape(workspace.toAbsolutePath().toString() + File.separator);
        String sanitized = ReUtil.replaceAll(output, hostPrefix, "");
        return ReUtil.replaceAll(sanitized, ReUtil.escape(SANDBOX_PATH_PREFIX), "");
    }
}
