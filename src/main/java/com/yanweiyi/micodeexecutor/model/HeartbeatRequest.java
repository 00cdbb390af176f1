package com.yanweiyi.micodeexecutor.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author yanweiyi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatRequest {

    /**
     * 正在执行的用例数
     */
    private Integer activeTasks;
}
