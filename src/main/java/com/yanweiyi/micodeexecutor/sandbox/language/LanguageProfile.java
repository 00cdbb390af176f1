package com.yanweiyi.micodeexecutor.sandbox.language;

import lombok.Value;

import java.util.List;

/**
 * 语言配置：编译命令（可选）、运行命令及对应镜像
 * <p>
 * 命令在容器内以 sh -c 执行，工作目录挂载在 /sandbox。
 *
 * @author yanweiyi
 */
@Value
public class LanguageProfile {

    String language;

    List<String> aliases;

    String sourceFile;

    String compileImage;

    String compileCmd;

    String runImage;

    String runCmd;

    public boolean compiles() {
        return compileCmd != null;
    }
}
