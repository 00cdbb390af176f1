package com.yanweiyi.micodeexecutor.model;

import lombok.Data;

import java.util.List;

/**
 * 下发给工作节点的任务
 *
 * @author yanweiyi
 */
@Data
public class JobAssignment {

    private String jobId;

    private String language;

    private String sourceCode;

    /**
     * 尚未产生判定结果的用例
     */
    private List<TestCase> testCases;

    /**
     * 附加到编译命令的编译参数，解释型语言忽略
     */
    private List<String> compilerFlags;

    private Integer timeLimitMs;

    private Integer memoryLimitMb;

    /**
     * 第几次分配，从 1 开始
     */
    private Integer attempt;
}
