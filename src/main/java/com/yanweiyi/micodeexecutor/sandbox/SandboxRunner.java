package com.yanweiyi.micodeexecutor.sandbox;

/**
 * @author yanweiyi
 */
public interface SandboxRunner {

    /**
     * 在全新的隔离环境中执行一条命令（编译或运行），执行结束后销毁环境
     * <p>
     * 不抛出异常：环境无法启动时返回 {@link SandboxResult#isInternalError()} 为 true 的结果。
     */
    SandboxResult run(SandboxRequest request);
}
