package com.yanweiyi.micodeexecutor.model;

import com.yanweiyi.micodeexecutor.model.enums.VerdictOutcomeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个测试用例的判定结果，每个用例只写入一次
 *
 * @author yanweiyi
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Verdict {

    private String testCaseId;

    private VerdictOutcomeEnum outcome;

    /**
     * 程序标准输出
     */
    private String actualOutput;

    /**
     * 程序错误输出（编译失败时为编译器输出）
     */
    private String errorOutput;

    private Integer exitCode;

    /**
     * 执行耗时，单位为 ms
     */
    private Long durationMs;

    /**
     * 内存峰值，单位为 MB
     */
    private Long peakMemoryMb;
}
