package com.yanweiyi.micodeexecutor.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 工作节点上报的基础设施故障
 *
 * @author yanweiyi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FailureReport {

    private String workerId;

    private String reason;
}
