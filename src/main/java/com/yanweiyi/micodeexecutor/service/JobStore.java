package com.yanweiyi.micodeexecutor.service;

import com.yanweiyi.micodeexecutor.model.JobRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存中的任务存储，按任务 id 索引
 * <p>
 * 任务内部状态由 {@link JobRecord} 自身加锁，这里只负责索引。
 *
 * @author yanweiyi
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "micode.master", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobStore {

    private final Map<String, JobRecord> jobs = new ConcurrentHashMap<>();

    public void save(JobRecord job) {
        if (jobs.putIfAbsent(job.getId(), job) != null) {
            throw new IllegalStateException("duplicate job id " + job.getId());
        }
    }

    public Optional<JobRecord> findById(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * 未结束的任务
     */
    public List<JobRecord> findActive() {
        List<JobRecord> active = new ArrayList<>();
        for (JobRecord job : jobs.values()) {
            if (!job.getStatus().isTerminal()) {
                active.add(job);
            }
        }
        return active;
    }

    public List<JobRecord> findActiveByWorker(String workerId) {
        List<JobRecord> active = new ArrayList<>();
        for (JobRecord job : findActive()) {
            if (workerId.equals(job.getAssignedWorkerId())) {
                active.add(job);
            }
        }
        return active;
    }

    /**
     * 删除在 cutoff 之前结束的任务
     *
     * @return 删除数量
     */
    public int evictFinishedBefore(Instant cutoff) {
        int evicted = 0;
        Iterator<JobRecord> iterator = jobs.values().iterator();
        while (iterator.hasNext()) {
            JobRecord job = iterator.next();
            if (job.getStatus().isTerminal() && job.getUpdatedAt().isBefore(cutoff)) {
                iterator.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("evicted {} finished jobs", evicted);
        }
        return evicted;
    }

    public int size() {
        return jobs.size();
    }
}
