package com.yanweiyi.micodeexecutor.worker;

import cn.hutool.core.net.NetUtil;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import com.yanweiyi.micodeexecutor.model.JobAssignment;
import com.yanweiyi.micodeexecutor.model.WorkerRegistration;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.util.List;

/**
 * 工作节点代理：向 Master 注册、定时心跳、拉取任务交给 {@link JobExecutor}
 * <p>
 * Master 不可达时只记录日志，下一次定时任务再重试。
 *
 * @author yanweiyi
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "micode.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerAgent {

    private static final long SHUTDOWN_TIMEOUT_MS = 5_000L;

    private final MasterClient masterClient;

    private final JobExecutor jobExecutor;

    @Getter
    private final String workerId;

    private final String address;

    private final int capacity;

    private volatile boolean registered;

    private volatile boolean stopped;

    public WorkerAgent(MasterClient masterClient, JobExecutor jobExecutor, MicodeProperties properties) {
        this.masterClient = masterClient;
        this.jobExecutor = jobExecutor;
        MicodeProperties.Worker worker = properties.getWorker();
        this.workerId = StrUtil.isNotBlank(worker.getId()) ? worker.getId()
                : "worker-" + IdUtil.fastSimpleUUID().substring(0, 8);
        this.address = StrUtil.isNotBlank(worker.getAddress()) ? worker.getAddress() : NetUtil.getLocalhostStr();
        this.capacity = worker.resolveCapacity();
    }

    public boolean isRegistered() {
        return registered;
    }

    /**
     * 未注册时先注册，否则发送心跳；Master 不认识本节点时重新注册
     */
    @Scheduled(initialDelay = 0, fixedDelayString = "${micode.worker.heartbeat-interval-ms:2000}")
    public void heartbeat() {
        if (stopped) {
            return;
        }
        try {
            if (!registered) {
                register();
                return;
            }
            if (!masterClient.heartbeat(workerId, jobExecutor.getActiveTasks())) {
                log.warn("master does not know worker {}, registering again", workerId);
                registered = false;
                register();
            }
        } catch (RuntimeException e) {
            log.warn("heartbeat of worker {} failed: {}", workerId, e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${micode.worker.poll-interval-ms:200}")
    public void poll() {
        pollOnce();
    }

    /**
     * 拉取已分配的任务并异步执行
     *
     * @return 本次拉取的任务数
     */
    public int pollOnce() {
        if (stopped || !registered) {
            return 0;
        }
        List<JobAssignment> assignments;
        try {
            assignments = masterClient.pollAssignments(workerId);
        } catch (RuntimeException e) {
            log.warn("worker {} failed to poll assignments: {}", workerId, e.getMessage());
            return 0;
        }
        for (JobAssignment assignment : assignments) {
            jobExecutor.submit(workerId, assignment);
        }
        return assignments.size();
    }

    /**
     * 停止拉取任务并从 Master 注销，未完成的任务由 Master 重新调度
     */
    @PreDestroy
    public void stop() {
        stopped = true;
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(SHUTDOWN_TIMEOUT_MS)) {
                log.warn("worker {} stopped with jobs still running", workerId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("worker {} interrupted during shutdown", workerId);
        }
        if (!registered) {
            return;
        }
        try {
            masterClient.deregister(workerId);
            log.info("worker {} deregistered", workerId);
        } catch (RuntimeException e) {
            log.warn("worker {} failed to deregister: {}", workerId, e.getMessage());
        }
        registered = false;
    }

    private void register() {
        masterClient.register(new WorkerRegistration(workerId, address, capacity));
        registered = true;
        log.info("worker {} registered with capacity {}", workerId, capacity);
    }
}
