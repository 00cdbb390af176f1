package com.yanweiyi.micodeexecutor.sandbox;

import java.nio.charset.StandardCharsets;

/**
 * 在读取标准输出的同时逐字节比对期望输出
 * <p>
 * 比对针对完整输出流，不受展示用输出截断的影响；输出超出期望长度时立即判为不一致。
 *
 * @author yanweiyi
 */
public class ExpectedOutputMatcher {

    private final byte[] expected;

    private int position;

    private boolean mismatched;

    public ExpectedOutputMatcher(String expectedOutput) {
        this.expected = (expectedOutput == null ? "" : expectedOutput).getBytes(StandardCharsets.UTF_8);
    }

    public synchronized void accept(byte[] payload) {
        if (payload == null || mismatched) {
            return;
        }
        for (byte b : payload) {
            if (position >= expected.length || expected[position] != b) {
                mismatched = true;
                return;
            }
            position++;
        }
    }

    /**
     * 输出与期望输出逐字节相同
     */
    public synchronized boolean matches() {
        return !mismatched && position == expected.length;
    }
}
