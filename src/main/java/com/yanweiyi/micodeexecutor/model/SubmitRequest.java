package com.yanweiyi.micodeexecutor.model;

import lombok.Data;

import java.util.List;

/**
 * @author yanweiyi
 */
@Data
public class SubmitRequest {

    /**
     * 代码语言
     */
    private String language;

    /**
     * 待执行代码
     */
    private String sourceCode;

    /**
     * 测试用例
     */
    private List<TestCase> testCases;

    /**
     * 编译参数（如 -O2、-std=c++17），可选，只对需要编译的语言生效
     */
    private List<String> compilerFlags;

    /**
     * 单个用例的时间限制（ms），为空时使用默认值
     */
    private Integer timeLimitMs;

    /**
     * 单个用例的内存限制（MB），为空时使用默认值
     */
    private Integer memoryLimitMb;
}
