package com.yanweiyi.micodeexecutor.controller;

import com.yanweiyi.micodeexecutor.model.JobStatusResponse;
import com.yanweiyi.micodeexecutor.model.SubmitRequest;
import com.yanweiyi.micodeexecutor.model.SubmitResponse;
import com.yanweiyi.micodeexecutor.model.WorkerView;
import com.yanweiyi.micodeexecutor.service.JobScheduler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import javax.annotation.Resource;
import java.util.List;

/**
 * 对外接口：提交任务、查询任务、查看节点
 *
 * @author yanweiyi
 */
@RestController
@ConditionalOnProperty(prefix = "micode.master", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MainController {

    @Resource
    private JobScheduler jobScheduler;

    @GetMapping("/health")
    public String healthCheck() {
        return "ok";
    }

    /**
     * 接收任务后立即返回任务 id，执行结果通过 /status 查询
     */
    @PostMapping("/submit")
    public SubmitResponse submit(@RequestBody(required = false) SubmitRequest submitRequest) {
        String jobId = jobScheduler.submit(submitRequest);
        return new SubmitResponse(jobId, "job accepted");
    }

    @GetMapping("/status/{jobId}")
    public JobStatusResponse getStatus(@PathVariable String jobId) {
        return jobScheduler.getStatus(jobId);
    }

    @GetMapping("/workers")
    public List<WorkerView> listWorkers() {
        return jobScheduler.listWorkers();
    }
}
