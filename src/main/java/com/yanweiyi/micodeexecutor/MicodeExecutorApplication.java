package com.yanweiyi.micodeexecutor;

import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * @author yanweiyi
 */
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(MicodeProperties.class)
public class MicodeExecutorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MicodeExecutorApplication.class, args);
    }
}
