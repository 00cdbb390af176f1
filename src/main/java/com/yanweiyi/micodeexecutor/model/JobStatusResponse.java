package com.yanweiyi.micodeexecutor.model;

import com.yanweiyi.micodeexecutor.model.enums.JobStatusEnum;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * /status 接口返回的任务快照
 *
 * @author yanweiyi
 */
@Data
public class JobStatusResponse {

    private String jobId;

    private JobStatusEnum status;

    private String language;

    private Integer attempts;

    private Instant createdAt;

    private Instant updatedAt;

    private String compilerOutput;

    /**
     * 基础设施故障原因（仅 failed 状态）
     */
    private String error;

    /**
     * 已产生的判定结果，按提交的用例顺序排列
     */
    private List<Verdict> verdicts;
}
