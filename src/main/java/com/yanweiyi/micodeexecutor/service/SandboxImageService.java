package com.yanweiyi.micodeexecutor.service;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.model.Image;
import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import com.yanweiyi.micodeexecutor.sandbox.language.LanguageProfileRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 检查语言镜像是否已在本机
 * <p>
 * 镜像需要提前准备好，这里只记录缺失的镜像，不负责拉取；缺失镜像的任务会在创建容器时失败并重试。
 *
 * @author yanweiyi
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "micode.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SandboxImageService {

    private static final String DEFAULT_TAG = ":latest";

    private final DockerClient dockerClient;

    private final LanguageProfileRegistry languageProfileRegistry;

    private final boolean verifyImages;

    public SandboxImageService(DockerClient dockerClient, LanguageProfileRegistry languageProfileRegistry,
                               MicodeProperties properties) {
        this.dockerClient = dockerClient;
        this.languageProfileRegistry = languageProfileRegistry;
        this.verifyImages = properties.getWorker().isVerifyImages();
    }

    /**
     * Bean 初始化后检查镜像，Docker 不可用时只记录日志
     */
    @PostConstruct
    public void verifyImagesOnStartup() {
        if (!verifyImages) {
            return;
        }
        try {
            Set<String> missing = findMissingImages();
            if (missing.isEmpty()) {
                log.info("all {} sandbox images are present", languageProfileRegistry.images().size());
            } else {
                log.warn("sandbox images not found locally, jobs using them will fail: {}", missing);
            }
        } catch (RuntimeException e) {
            log.warn("unable to list docker images: {}", e.getMessage());
        }
    }

    public Set<String> findMissingImages() {
        List<Image> images = dockerClient.listImagesCmd().exec();
        Set<String> localTags = new HashSet<>();
        for (Image image : images) {
            if (image.getRepoTags() != null) {
                localTags.addAll(Arrays.asList(image.getRepoTags()));
            }
        }
        Set<String> missing = new TreeSet<>();
        for (String image : languageProfileRegistry.images()) {
            if (!localTags.contains(withTag(image))) {
                missing.add(image);
            }
        }
        return missing;
    }

    static String withTag(String image) {
        int slash = image.lastIndexOf('/');
        return image.indexOf(':', slash + 1) >= 0 ? image : image + DEFAULT_TAG;
    }
}
