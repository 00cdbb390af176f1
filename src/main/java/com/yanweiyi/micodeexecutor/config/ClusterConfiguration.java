package com.yanweiyi.micodeexecutor.config;

import cn.hutool.core.util.StrUtil;
import com.yanweiyi.micodeexecutor.service.JobScheduler;
import com.yanweiyi.micodeexecutor.worker.HttpMasterClient;
import com.yanweiyi.micodeexecutor.worker.LocalMasterClient;
import com.yanweiyi.micodeexecutor.worker.MasterClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Master / Worker 之间的通信配置
 *
 * @author yanweiyi
 */
@Slf4j
@Configuration
public class ClusterConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 配置了 master-url 时通过 HTTP 访问 Master，否则直接调用进程内的调度器
     */
    @Bean
    @ConditionalOnProperty(prefix = "micode.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MasterClient masterClient(MicodeProperties properties, RestTemplateBuilder restTemplateBuilder,
                                     ObjectProvider<JobScheduler> jobScheduler) {
        String masterUrl = properties.getWorker().getMasterUrl();
        if (StrUtil.isNotBlank(masterUrl)) {
            MicodeProperties.Cluster cluster = properties.getCluster();
            log.info("worker reports to remote master {}", masterUrl);
            return new HttpMasterClient(restTemplateBuilder
                    .rootUri(StrUtil.removeSuffix(masterUrl, "/"))
                    .setConnectTimeout(Duration.ofMillis(cluster.getConnectTimeoutMs()))
                    .setReadTimeout(Duration.ofMillis(cluster.getReadTimeoutMs()))
                    .build(), cluster.getSecret());
        }
        JobScheduler scheduler = jobScheduler.getIfAvailable();
        if (scheduler == null) {
            throw new IllegalStateException("micode.worker.master-url must be set when the master is disabled");
        }
        log.info("worker reports to the in-process master");
        return new LocalMasterClient(scheduler);
    }
}
