package com.yanweiyi.micodeexecutor.worker;

import com.yanweiyi.micodeexecutor.model.FailureReport;
import com.yanweiyi.micodeexecutor.model.JobAssignment;
import com.yanweiyi.micodeexecutor.model.JobStatusUpdate;
import com.yanweiyi.micodeexecutor.model.Verdict;
import com.yanweiyi.micodeexecutor.model.VerdictReport;
import com.yanweiyi.micodeexecutor.model.WorkerRegistration;
import com.yanweiyi.micodeexecutor.service.JobScheduler;

import java.util.List;

/**
 * Master 与工作节点部署在同一进程时直接调用调度器
 *
 * @author yanweiyi
 */
public class LocalMasterClient implements MasterClient {

    private final JobScheduler jobScheduler;

    public LocalMasterClient(JobScheduler jobScheduler) {
        this.jobScheduler = jobScheduler;
    }

    @Override
    public void register(WorkerRegistration registration) {
        jobScheduler.registerWorker(registration);
    }

    @Override
    public boolean heartbeat(String workerId, int activeTasks) {
        return jobScheduler.heartbeat(workerId, activeTasks);
    }

    @Override
    public List<JobAssignment> pollAssignments(String workerId) {
        return jobScheduler.pollAssignments(workerId);
    }

    @Override
    public void reportStatus(String jobId, JobStatusUpdate update) {
        jobScheduler.updateStatus(jobId, update);
    }

    @Override
    public void reportVerdict(String jobId, String workerId, Verdict verdict) {
        jobScheduler.recordVerdict(jobId, new VerdictReport(workerId, verdict));
    }

    @Override
    public void reportFailure(String jobId, String workerId, String reason) {
        jobScheduler.reportFailure(jobId, new FailureReport(workerId, reason));
    }

    @Override
    public void deregister(String workerId) {
        jobScheduler.deregisterWorker(workerId);
    }
}
