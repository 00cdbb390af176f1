package com.yanweiyi.micodeexecutor.worker;

import com.yanweiyi.micodeexecutor.model.JobAssignment;
import com.yanweiyi.micodeexecutor.model.JobStatusUpdate;
import com.yanweiyi.micodeexecutor.model.Verdict;
import com.yanweiyi.micodeexecutor.model.WorkerRegistration;

import java.util.List;

/**
 * 工作节点到 Master 的通道
 *
 * @author yanweiyi
 */
public interface MasterClient {

    void register(WorkerRegistration registration);

    /**
     * @return Master 不认识该节点时返回 false
     */
    boolean heartbeat(String workerId, int activeTasks);

    List<JobAssignment> pollAssignments(String workerId);

    void reportStatus(String jobId, JobStatusUpdate update);

    void reportVerdict(String jobId, String workerId, Verdict verdict);

    void reportFailure(String jobId, String workerId, String reason);

    void deregister(String workerId);
}
