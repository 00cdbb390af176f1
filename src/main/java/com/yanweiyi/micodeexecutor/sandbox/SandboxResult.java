package com.yanweiyi.micodeexecutor.sandbox;

import lombok.Data;

import java.nio.charset.StandardCharsets;

/**
 * 封装一次沙箱执行返回的信息
 *
 * @author yanweiyi
 */
@Data
public class SandboxResult {

    /**
     * 程序输出，按 UTF-8 解码，仅用于展示
     */
    private String output = "";

    /**
     * 程序输出的原始字节，超过输出上限的部分被截掉
     */
    private byte[] outputBytes = new byte[0];

    /**
     * 读取完整输出流时与期望输出逐字节比对的结果，未比对时为 null
     */
    private Boolean outputMatched;

    /**
     * 程序执行过程中的错误输出
     */
    private String errorOutput = "";

    private Integer exitCode;

    /**
     * 程序执行消耗的时间，单位为 ms
     */
    private long timeUsed;

    /**
     * 程序执行消耗的内存峰值，单位为 kb（采样值，仅用于展示）
     */
    private long memoryUsed;

    /**
     * 程序是否执行超时
     */
    private boolean timeout;

    /**
     * 程序是否超出内存限制
     */
    private boolean memoryOverflow;

    /**
     * 沙箱本身是否出错（无法创建或启动容器等）
     */
    private boolean internalError;

    private String internalErrorMessage;

    public void setOutput(String output) {
        this.output = output == null ? "" : output;
        this.outputBytes = this.output.getBytes(StandardCharsets.UTF_8);
    }

    public void setOutputBytes(byte[] outputBytes) {
        this.outputBytes = outputBytes == null ? new byte[0] : outputBytes;
        this.output = new String(this.outputBytes, StandardCharsets.UTF_8);
    }

    public static SandboxResult internalError(String message) {
        SandboxResult result = new SandboxResult();
        result.setInternalError(true);
        result.setInternalErrorMessage(message);
        return result;
    }

    /**
     * 是否正常退出（未超时、未超内存、退出码为 0）
     */
    public boolean isSuccessful() {
        return !internalError && !timeout && !memoryOverflow && exitCode != null && exitCode == 0;
    }
}
