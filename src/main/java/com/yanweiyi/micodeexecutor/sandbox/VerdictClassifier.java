package com.yanweiyi.micodeexecutor.sandbox;

import com.yanweiyi.micodeexecutor.model.TestCase;
import com.yanweiyi.micodeexecutor.model.Verdict;
import com.yanweiyi.micodeexecutor.model.enums.VerdictOutcomeEnum;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 根据沙箱执行结果判定用例结果
 * <p>
 * 判定顺序：内存超限 > 超时 > 非零退出 > 输出不一致 > 正确。
 * 编译失败在编译阶段单独处理，沙箱内部错误不产生判定结果。
 *
 * @author yanweiyi
 */
public final class VerdictClassifier {

    private static final long KB_PER_MB = 1024L;

    private VerdictClassifier() {
    }

    public static VerdictOutcomeEnum classify(SandboxResult result, String expectedOutput) {
        if (result.isInternalError()) {
            return VerdictOutcomeEnum.INTERNAL_ERROR;
        }
        if (result.isMemoryOverflow()) {
            return VerdictOutcomeEnum.MEMORY_LIMIT_EXCEEDED;
        }
        if (result.isTimeout()) {
            return VerdictOutcomeEnum.TIME_LIMIT_EXCEEDED;
        }
        if (result.getExitCode() == null || result.getExitCode() != 0) {
            return VerdictOutcomeEnum.RUNTIME_ERROR;
        }
        return outputMatches(result, expectedOutput) ? VerdictOutcomeEnum.ACCEPTED : VerdictOutcomeEnum.WRONG_ANSWER;
    }

    /**
     * 按字节比较；沙箱已在读取完整输出时比对过的，以沙箱结果为准
     */
    private static boolean outputMatches(SandboxResult result, String expectedOutput) {
        if (result.getOutputMatched() != null) {
            return result.getOutputMatched();
        }
        byte[] expected = (expectedOutput == null ? "" : expectedOutput).getBytes(StandardCharsets.UTF_8);
        return Arrays.equals(expected, result.getOutputBytes());
    }

    public static Verdict toVerdict(TestCase testCase, SandboxResult result) {
        return Verdict.builder()
                .testCaseId(testCase.getId())
                .outcome(classify(result, testCase.getExpectedOutput()))
                .actualOutput(result.getOutput())
                .errorOutput(result.getErrorOutput())
                .exitCode(result.getExitCode())
                .durationMs(result.getTimeUsed())
                .peakMemoryMb(result.getMemoryUsed() / KB_PER_MB)
                .build();
    }

    /**
     * 编译失败时为每个用例生成 compile_error
     */
    public static Verdict compileError(TestCase testCase, String compilerOutput) {
        return Verdict.builder()
                .testCaseId(testCase.getId())
                .outcome(VerdictOutcomeEnum.COMPILE_ERROR)
                .actualOutput("")
                .errorOutput(compilerOutput)
                .durationMs(0L)
                .peakMemoryMb(0L)
                .build();
    }
}
