package com.yanweiyi.micodeexecutor.sandbox;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * @author yanweiyi
 */
@Value
@Builder
public class SandboxRequest {

    /**
     * 容器镜像
     */
    String image;

    /**
     * 在容器内以 sh -c 执行的命令
     */
    String command;

    /**
     * 宿主机工作目录，挂载到容器的 /sandbox
     */
    Path workspace;

    /**
     * 是否以读写方式挂载工作目录（编译需要写入产物）
     */
    boolean writableWorkspace;

    long timeLimitMs;

    int memoryLimitMb;

    /**
     * 工作目录下作为标准输入的文件名，为空时标准输入为空
     */
    String stdinFile;

    /**
     * 期望输出，不为 null 时沙箱在读取输出时逐字节比对
     */
    String expectedOutput;

    /**
     * 日志与容器标签使用
     */
    String label;
}
