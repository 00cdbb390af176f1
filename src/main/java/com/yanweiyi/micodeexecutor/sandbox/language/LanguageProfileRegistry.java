package com.yanweiyi.micodeexecutor.sandbox.language;

import cn.hutool.core.util.StrUtil;
import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import com.yanweiyi.micodeexecutor.exception.BusinessException;
import com.yanweiyi.micodeexecutor.model.enums.ErrorCodeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 语言配置表，启动时从配置加载，之后只读
 *
 * @author yanweiyi
 */
@Slf4j
@Component
public class LanguageProfileRegistry {

    /**
     * 语言名及别名（小写） -> 配置
     */
    private final Map<String, LanguageProfile> lookup;

    private final List<LanguageProfile> profiles;

    @Autowired
    public LanguageProfileRegistry(MicodeProperties properties) {
        this(properties.getLanguages());
    }

    public LanguageProfileRegistry(Map<String, MicodeProperties.Language> languages) {
        Map<String, LanguageProfile> lookup = new LinkedHashMap<>();
        List<LanguageProfile> profiles = new ArrayList<>();
        for (Map.Entry<String, MicodeProperties.Language> entry : languages.entrySet()) {
            LanguageProfile profile = toProfile(entry.getKey(), entry.getValue());
            profiles.add(profile);
            register(lookup, profile.getLanguage(), profile);
            for (String alias : profile.getAliases()) {
                register(lookup, alias, profile);
            }
        }
        this.lookup = Collections.unmodifiableMap(lookup);
        this.profiles = Collections.unmodifiableList(profiles);
        log.info("loaded {} language profiles: {}", profiles.size(), lookup.keySet());
    }

    public Optional<LanguageProfile> find(String language) {
        if (StrUtil.isBlank(language)) {
            return Optional.empty();
        }
        return Optional.ofNullable(lookup.get(language.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * 获取语言配置，不存在时抛出 unknown_language
     */
    public LanguageProfile require(String language) {
        return find(language).orElseThrow(() ->
                new BusinessException(ErrorCodeEnum.UNKNOWN_LANGUAGE, "unsupported language: " + language));
    }

    public Collection<LanguageProfile> profiles() {
        return profiles;
    }

    /**
     * 所有语言需要的镜像（编译与运行）
     */
    public Set<String> images() {
        Set<String> images = new LinkedHashSet<>();
        for (LanguageProfile profile : profiles) {
            if (profile.compiles()) {
                images.add(profile.getCompileImage());
            }
            images.add(profile.getRunImage());
        }
        return images;
    }

    private static LanguageProfile toProfile(String name, MicodeProperties.Language language) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (StrUtil.isBlank(language.getSourceFile())) {
            throw new IllegalStateException("language " + key + ": source-file is required");
        }
        if (StrUtil.isBlank(language.getRunImage()) || StrUtil.isBlank(language.getRunCmd())) {
            throw new IllegalStateException("language " + key + ": run-image and run-cmd are required");
        }
        boolean hasCompileCmd = StrUtil.isNotBlank(language.getCompileCmd());
        boolean hasCompileImage = StrUtil.isNotBlank(language.getCompileImage());
        if (hasCompileCmd != hasCompileImage) {
            throw new IllegalStateException("language " + key + ": compile-image and compile-cmd must be set together");
        }
        List<String> aliases = new ArrayList<>();
        for (String alias : language.getAliases()) {
            aliases.add(alias.trim().toLowerCase(Locale.ROOT));
        }
        return new LanguageProfile(key, Collections.unmodifiableList(aliases), language.getSourceFile(),
                hasCompileImage ? language.getCompileImage() : null,
                hasCompileCmd ? language.getCompileCmd() : null,
                language.getRunImage(), language.getRunCmd());
    }

    private static void register(Map<String, LanguageProfile> lookup, String name, LanguageProfile profile) {
        LanguageProfile existing = lookup.putIfAbsent(name, profile);
        if (existing != null) {
            throw new IllegalStateException("language name " + name + " is mapped to both "
                    + existing.getLanguage() + " and " + profile.getLanguage());
        }
    }
}
