package com.yanweiyi.micodeexecutor.sandbox.docker;

import cn.hutool.core.util.ReUtil;
import cn.hutool.core.util.StrUtil;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.RemoveContainerCmd;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Statistics;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import com.yanweiyi.micodeexecutor.sandbox.ExpectedOutputMatcher;
import com.yanweiyi.micodeexecutor.sandbox.SandboxRequest;
import com.yanweiyi.micodeexecutor.sandbox.SandboxResult;
import com.yanweiyi.micodeexecutor.sandbox.SandboxRunner;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringEscapeUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * 基于 Docker 的沙箱：每次执行创建一个新容器，执行结束后强制删除
 * <p>
 * 内存上限由容器 cgroup 限制（memory == memory-swap，不使用交换分区），
 * 超时由等待容器退出的时限控制，超时后 kill 容器。
 *
 * @author yanweiyi
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "micode.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DockerSandboxRunner implements SandboxRunner {

    // 容器内工作目录
    static final String SANDBOX_DIRECTORY = "/sandbox";

    // 被 SIGKILL 结束的退出码（128 + 9）
    private static final int SIGKILL_EXIT_CODE = 137;

    // 运行时自身报告的内存不足（JVM 堆、Python、Node、Ruby），按运行时的输出格式锚定
    private static final List<Pattern> OUT_OF_MEMORY_PATTERNS = Arrays.asList(
            Pattern.compile("(^|\\s)java\\.lang\\.OutOfMemoryError\\b", Pattern.MULTILINE),
            Pattern.compile("^MemoryError(: .*)?$", Pattern.MULTILINE),
            Pattern.compile("^FATAL ERROR: .*JavaScript heap out of memory", Pattern.MULTILINE),
            Pattern.compile("failed to allocate memory \\(NoMemoryError\\)"));

    private static final long PIDS_LIMIT = 64L;

    private static final long NANO_CPUS = 1_000_000_000L;

    // 容器退出后读取日志的等待时长（ms）
    private static final long LOG_TIMEOUT_MILLISECONDS = 5000L;

    private final DockerClient dockerClient;

    private final int maxOutputBytes;

    public DockerSandboxRunner(DockerClient dockerClient, MicodeProperties properties) {
        this.dockerClient = dockerClient;
        this.maxOutputBytes = properties.getWorker().getMaxOutputBytes();
    }

    @Override
    public SandboxResult run(SandboxRequest request) {
        String containerId;
        try {
            containerId = createContainer(request);
        } catch (RuntimeException e) {
            log.error("{}: docker container create failed, image: {}, error: {}",
                    request.getLabel(), request.getImage(), e.getMessage());
            return SandboxResult.internalError("failed to create sandbox from image " + request.getImage()
                    + ": " + e.getMessage());
        }

        SandboxResult result = new SandboxResult();
        AtomicLong peakMemoryKb = new AtomicLong(0L);
        ResultCallback.Adapter<Statistics> statisticsResultCallback = null;
        WaitContainerResultCallback waitCallback = null;
        try {
            // 开启定时器
            StopWatch stopWatch = new StopWatch();
            stopWatch.start();
            dockerClient.startContainerCmd(containerId).exec();
            log.debug("{}: docker container {} started", request.getLabel(), containerId);
            statisticsResultCallback = watchMemory(containerId, peakMemoryKb);

            // 阻塞等待容器退出, 并且设置超时时间
            waitCallback = dockerClient.waitContainerCmd(containerId)
                    .exec(new WaitContainerResultCallback());
            boolean exited = waitCallback.awaitCompletion(request.getTimeLimitMs(), TimeUnit.MILLISECONDS);
            stopWatch.stop();
            result.setTimeUsed(stopWatch.getLastTaskTimeMillis());
            if (!exited) {
                log.info("{}: time limit {} ms exceeded, killing container", request.getLabel(), request.getTimeLimitMs());
                result.setTimeout(true);
                killContainer(containerId);
            }

            InspectContainerResponse.ContainerState state = dockerClient.inspectContainerCmd(containerId).exec().getState();
            Long exitCode = state.getExitCodeLong();
            result.setExitCode(exitCode == null ? null : exitCode.intValue());
            collectOutput(containerId, request, result);
            result.setMemoryUsed(peakMemoryKb.get());
            result.setMemoryOverflow(isMemoryOverflow(state, result));

            if (log.isDebugEnabled()) {
                log.debug("{}: exit code {}, time {} ms, output: {}", request.getLabel(), result.getExitCode(),
                        result.getTimeUsed(), StringEscapeUtils.escapeJava(StringUtils.abbreviate(result.getOutput(), 200)));
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("{}: interrupted while waiting for container {}", request.getLabel(), containerId);
            return SandboxResult.internalError("interrupted while waiting for sandbox");
        } catch (RuntimeException e) {
            log.error("{}: docker container {} failed: {}", request.getLabel(), containerId, e.getMessage());
            return SandboxResult.internalError("sandbox failure: " + e.getMessage());
        } finally {
            closeCallback(waitCallback, containerId);
            closeCallback(statisticsResultCallback, containerId);
            removeContainer(containerId);
        }
    }

    private String createContainer(SandboxRequest request) {
        HostConfig hostConfig = HostConfig.newHostConfig();
        AccessMode accessMode = request.isWritableWorkspace() ? AccessMode.rw : AccessMode.ro;
        hostConfig.withBinds(new Bind(request.getWorkspace().toAbsolutePath().toString(),
                new Volume(SANDBOX_DIRECTORY), accessMode));
        long memoryBytes = request.getMemoryLimitMb() * 1024L * 1024L;
        hostConfig.withMemory(memoryBytes);
        hostConfig.withMemorySwap(memoryBytes);
        hostConfig.withNanoCPUs(NANO_CPUS);
        hostConfig.withPidsLimit(PIDS_LIMIT);
        // 禁用网络，防止被刷带宽等
        hostConfig.withNetworkMode("none");
        if (!request.isWritableWorkspace()) {
            // 运行阶段根目录只读，/tmp 使用内存文件系统
            hostConfig.withReadonlyRootfs(true);
            hostConfig.withTmpFs(Collections.singletonMap("/tmp", "rw,size=64m"));
        }

        Map<String, String> labels = new HashMap<>();
        labels.put("micode.sandbox", StrUtil.nullToDefault(request.getLabel(), "run"));

        CreateContainerCmd containerCommand = dockerClient.createContainerCmd(request.getImage());
        containerCommand.withCmd("sh", "-c", buildShellCommand(request));
        containerCommand.withWorkingDir(SANDBOX_DIRECTORY);
        containerCommand.withNetworkDisabled(true);
        // 不开启终端，标准输出与错误输出分开返回
        containerCommand.withTty(false);
        containerCommand.withAttachStdout(true);
        containerCommand.withAttachStderr(true);
        containerCommand.withLabels(labels);
        containerCommand.withHostConfig(hostConfig);
        CreateContainerResponse createContainerResponse = containerCommand.exec();
        return createContainerResponse.getId();
    }

    static String buildShellCommand(SandboxRequest request) {
        String stdin = StrUtil.isBlank(request.getStdinFile())
                ? "/dev/null"
                : SANDBOX_DIRECTORY + "/" + request.getStdinFile();
        return request.getCommand() + " < " + stdin;
    }

    /**
     * 开启内存监控，获取程序运行期间的最大内存占用量（kb）
     */
    private ResultCallback.Adapter<Statistics> watchMemory(String containerId, AtomicLong peakMemoryKb) {
        ResultCallback.Adapter<Statistics> statisticsResultCallback = new ResultCallback.Adapter<Statistics>() {
            @Override
            public void onNext(Statistics statistics) {
                if (statistics.getMemoryStats() != null && statistics.getMemoryStats().getUsage() != null) {
                    long currentMemoryKb = statistics.getMemoryStats().getUsage() / 1024;
                    peakMemoryKb.accumulateAndGet(currentMemoryKb, Math::max);
                }
                super.onNext(statistics);
            }
        };
        try {
            dockerClient.statsCmd(containerId).exec(statisticsResultCallback);
        } catch (RuntimeException e) {
            log.debug("memory monitoring unavailable for container {}: {}", containerId, e.getMessage());
        }
        return statisticsResultCallback;
    }

    /**
     * 读取容器输出；期望输出不为空时在读取完整输出流的同时逐字节比对，只截断保存下来的输出
     */
    private void collectOutput(String containerId, SandboxRequest request, SandboxResult result)
            throws InterruptedException {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        ExpectedOutputMatcher matcher = request.getExpectedOutput() == null
                ? null
                : new ExpectedOutputMatcher(request.getExpectedOutput());
        ResultCallback.Adapter<Frame> logCallback = new ResultCallback.Adapter<Frame>() {
            @Override
            public void onNext(Frame frame) {
                if (StreamType.STDERR.equals(frame.getStreamType())) {
                    append(stderr, frame.getPayload());
                } else {
                    append(stdout, frame.getPayload());
                    if (matcher != null) {
                        matcher.accept(frame.getPayload());
                    }
                }
                super.onNext(frame);
            }
        };
        try {
            dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .exec(logCallback)
                    .awaitCompletion(LOG_TIMEOUT_MILLISECONDS, TimeUnit.MILLISECONDS);
        } finally {
            closeCallback(logCallback, containerId);
        }
        result.setOutputBytes(stdout.toByteArray());
        result.setErrorOutput(new String(stderr.toByteArray(), StandardCharsets.UTF_8));
        if (matcher != null) {
            result.setOutputMatched(matcher.matches());
        }
    }

    private void append(ByteArrayOutputStream target, byte[] payload) {
        if (payload == null) {
            return;
        }
        synchronized (target) {
            int remaining = maxOutputBytes - target.size();
            if (remaining > 0) {
                target.write(payload, 0, Math.min(remaining, payload.length));
            }
        }
    }

    static boolean isMemoryOverflow(InspectContainerResponse.ContainerState state, SandboxResult result) {
        if (Boolean.TRUE.equals(state.getOOMKilled())) {
            return true;
        }
        Integer exitCode = result.getExitCode();
        if (exitCode == null || exitCode == 0) {
            return false;
        }
        // 未超时却被 SIGKILL 结束，只可能是 cgroup 的 OOM killer
        if (exitCode == SIGKILL_EXIT_CODE && !result.isTimeout()) {
            return true;
        }
        String errorOutput = result.getErrorOutput();
        for (Pattern pattern : OUT_OF_MEMORY_PATTERNS) {
            if (ReUtil.contains(pattern, errorOutput)) {
                return true;
            }
        }
        return false;
    }

    private void killContainer(String containerId) {
        try {
            dockerClient.killContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            // 容器可能在超时的同时退出
            log.debug("kill container {} failed: {}", containerId, e.getMessage());
        }
    }

    private static void closeCallback(Closeable callback, String containerId) {
        if (callback == null) {
            return;
        }
        try {
            callback.close();
        } catch (IOException e) {
            log.warn("error closing docker callback of container {}: {}", containerId, e.getMessage());
        }
    }

    /**
     * 清理执行环境，任何退出路径都会执行
     */
    private void removeContainer(String containerId) {
        try {
            RemoveContainerCmd removeContainerCmd = dockerClient.removeContainerCmd(containerId);
            removeContainerCmd.withForce(true);
            removeContainerCmd.withRemoveVolumes(true);
            removeContainerCmd.exec();
            log.debug("docker container {} removed", containerId);
        } catch (RuntimeException e) {
            log.error("error removing docker container {}: {}", containerId, e.getMessage());
        }
    }
}
