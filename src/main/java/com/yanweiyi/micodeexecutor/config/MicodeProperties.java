package com.yanweiyi.micodeexecutor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * application.yml 中 micode.* 配置
 *
 * @author yanweiyi
 */
@Data
@ConfigurationProperties(prefix = "micode")
public class MicodeProperties {

    private Master master = new Master();

    private Worker worker = new Worker();

    private Cluster cluster = new Cluster();

    private Limits limits = new Limits();

    private Docker docker = new Docker();

    /**
     * 语言名 -> 语言配置
     */
    private Map<String, Language> languages = new LinkedHashMap<>();

    @Data
    public static class Master {

        private boolean enabled = true;

        /**
         * 分配后等待节点确认的时长
         */
        private long ackTimeoutMs = 10_000L;

        /**
         * 节点确认后任务最长执行时长
         */
        private long jobTimeoutMs = 300_000L;

        private long heartbeatGraceMs = 10_000L;

        private int maxAttempts = 3;

        /**
         * 终态任务保留时长
         */
        private long jobRetentionMs = 3_600_000L;

        /**
         * 超时检查、节点剔除、过期任务清理的执行间隔
         */
        private long maintenanceIntervalMs = 1_000L;
    }

    @Data
    public static class Worker {

        private boolean enabled = true;

        /**
         * 为空时随机生成
         */
        private String id;

        private String address;

        /**
         * 并发执行槽位数，小于等于 0 时取 CPU 核数
         */
        private int capacity = 0;

        /**
         * Master 地址，为空时使用进程内的 Master
         */
        private String masterUrl;

        private long heartbeatIntervalMs = 2_000L;

        private long pollIntervalMs = 200L;

        private String workspaceDir = System.getProperty("user.dir") + File.separator + "tempCode";

        private long compileTimeLimitMs = 30_000L;

        private int compileMemoryLimitMb = 512;

        private int maxOutputBytes = 65_536;

        private int reportAttempts = 3;

        /**
         * 启动时检查语言镜像是否存在
         */
        private boolean verifyImages = true;

        public int resolveCapacity() {
            return capacity > 0 ? capacity : Runtime.getRuntime().availableProcessors();
        }
    }

    @Data
    public static class Cluster {

        /**
         * 节点与 Master 之间的鉴权密钥，为空时不校验
         */
        private String secret;

        private long connectTimeoutMs = 2_000L;

        private long readTimeoutMs = 10_000L;
    }

    @Data
    public static class Limits {

        private int defaultTimeLimitMs = 2000;

        private int minTimeLimitMs = 100;

        private int maxTimeLimitMs = 30_000;

        private int defaultMemoryLimitMb = 128;

        private int minMemoryLimitMb = 16;

        private int maxMemoryLimitMb = 1024;
    }

    @Data
    public static class Docker {

        /**
         * 为空时使用 DOCKER_HOST 环境变量或本地 socket
         */
        private String host;
    }

    @Data
    public static class Language {

        private List<String> aliases = new ArrayList<>();

        /**
         * 源码文件名
         */
        private String sourceFile;

        private String compileImage;

        /**
         * 编译命令；用户的编译参数替换 {flags} 占位符，没有占位符时追加到命令末尾
         */
        private String compileCmd;

        private String runImage;

        private String runCmd;
    }
}
