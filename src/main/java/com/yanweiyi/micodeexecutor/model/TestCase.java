package com.yanweiyi.micodeexecutor.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 测试用例，提交后不再修改
 *
 * @author yanweiyi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TestCase {

    /**
     * 用例 id，同一任务内唯一，用于关联判定结果
     */
    private String id;

    /**
     * 标准输入
     */
    private String input;

    /**
     * 期望输出（逐字节比较，包括末尾换行）
     */
    private String expectedOutput;
}
