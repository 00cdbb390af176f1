package com.yanweiyi.micodeexecutor.controller;

import cn.hutool.core.util.StrUtil;
import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import com.yanweiyi.micodeexecutor.exception.BusinessException;
import com.yanweiyi.micodeexecutor.model.FailureReport;
import com.yanweiyi.micodeexecutor.model.HeartbeatRequest;
import com.yanweiyi.micodeexecutor.model.JobAssignment;
import com.yanweiyi.micodeexecutor.model.JobStatusUpdate;
import com.yanweiyi.micodeexecutor.model.VerdictReport;
import com.yanweiyi.micodeexecutor.model.WorkerRegistration;
import com.yanweiyi.micodeexecutor.model.enums.ErrorCodeEnum;
import com.yanweiyi.micodeexecutor.service.JobScheduler;
import com.yanweiyi.micodeexecutor.worker.HttpMasterClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.annotation.Resource;
import java.util.List;

/**
 * 工作节点与 Master 之间的内部接口，请求头需携带集群密钥
 *
 * @author yanweiyi
 */
@RestController
@RequestMapping("/internal")
@ConditionalOnProperty(prefix = "micode.master", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerChannelController {

    @Resource
    private JobScheduler jobScheduler;

    @Resource
    private MicodeProperties micodeProperties;

    @PostMapping("/workers/register")
    public ResponseEntity<Void> register(@RequestBody(required = false) WorkerRegistration registration,
                                         @RequestHeader(value = HttpMasterClient.AUTH_REQUEST_HEADER, required = false) String secret) {
        authenticate(secret);
        jobScheduler.registerWorker(registration);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/workers/{workerId}/heartbeat")
    public ResponseEntity<Void> heartbeat(@PathVariable String workerId,
                                          @RequestBody(required = false) HeartbeatRequest heartbeatRequest,
                                          @RequestHeader(value = HttpMasterClient.AUTH_REQUEST_HEADER, required = false) String secret) {
        authenticate(secret);
        int activeTasks = heartbeatRequest == null || heartbeatRequest.getActiveTasks() == null
                ? 0 : heartbeatRequest.getActiveTasks();
        if (!jobScheduler.heartbeat(workerId, activeTasks)) {
            throw new BusinessException(ErrorCodeEnum.UNKNOWN_WORKER, "worker " + workerId + " is not registered");
        }
        return ResponseEntity.ok().build();
    }

    @PostMapping("/workers/{workerId}/assignments")
    public List<JobAssignment> pollAssignments(@PathVariable String workerId,
                                               @RequestHeader(value = HttpMasterClient.AUTH_REQUEST_HEADER, required = false) String secret) {
        authenticate(secret);
        return jobScheduler.pollAssignments(workerId);
    }

    @DeleteMapping("/workers/{workerId}")
    public ResponseEntity<Void> deregister(@PathVariable String workerId,
                                           @RequestHeader(value = HttpMasterClient.AUTH_REQUEST_HEADER, required = false) String secret) {
        authenticate(secret);
        jobScheduler.deregisterWorker(workerId);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/jobs/{jobId}/status")
    public ResponseEntity<Void> updateStatus(@PathVariable String jobId,
                                             @RequestBody(required = false) JobStatusUpdate update,
                                             @RequestHeader(value = HttpMasterClient.AUTH_REQUEST_HEADER, required = false) String secret) {
        authenticate(secret);
        jobScheduler.updateStatus(jobId, update);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/jobs/{jobId}/verdicts")
    public ResponseEntity<Void> recordVerdict(@PathVariable String jobId,
                                              @RequestBody(required = false) VerdictReport report,
                                              @RequestHeader(value = HttpMasterClient.AUTH_REQUEST_HEADER, required = false) String secret) {
        authenticate(secret);
        jobScheduler.recordVerdict(jobId, report);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/jobs/{jobId}/failure")
    public ResponseEntity<Void> reportFailure(@PathVariable String jobId,
                                              @RequestBody(required = false) FailureReport report,
                                              @RequestHeader(value = HttpMasterClient.AUTH_REQUEST_HEADER, required = false) String secret) {
        authenticate(secret);
        jobScheduler.reportFailure(jobId, report);
        return ResponseEntity.ok().build();
    }

    /**
     * 权限认证，未配置密钥时不校验
     */
    private void authenticate(String secret) {
        String expected = micodeProperties.getCluster().getSecret();
        if (StrUtil.isNotEmpty(expected) && !expected.equals(secret)) {
            throw new BusinessException(ErrorCodeEnum.FORBIDDEN, "invalid cluster secret");
        }
    }
}
