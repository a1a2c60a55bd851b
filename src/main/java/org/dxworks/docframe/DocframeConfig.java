package org.dxworks.docframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.docframe.model.MessageLevel;
import org.dxworks.docframe.render.PrettyPrintRenderer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

public class DocframeConfig {

    private static final String CONFIG_FILE_NAME = "docframe-config.yml";
    private static final String DEFAULT_TITLE = "";
    private static final int DEFAULT_MAX_TEXT_WIDTH = PrettyPrintRenderer.DEFAULT_MAX_TEXT_WIDTH;

    private final MessageLevel messageLevel;
    private final String defaultTitle;
    private final int maxTextWidth;

    private DocframeConfig(MessageLevel messageLevel, String defaultTitle, int maxTextWidth) {
        this.messageLevel = messageLevel;
        this.defaultTitle = defaultTitle;
        this.maxTextWidth = maxTextWidth;
    }

    /**
     * The minimum level of system messages written to the output, empty when messages are suppressed.
     */
    public Optional<MessageLevel> getMessageLevel() {
        return Optional.ofNullable(messageLevel);
    }

    public String getDefaultTitle() {
        return defaultTitle;
    }

    public int getMaxTextWidth() {
        return maxTextWidth;
    }

    public static DocframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static DocframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                MessageLevel messageLevel = MessageLevel.fromName(yamlConfig.messageLevel).orElse(null);
                String defaultTitle = yamlConfig.defaultTitle != null ? yamlConfig.defaultTitle : DEFAULT_TITLE;
                Integer maxTextWidth = yamlConfig.maxTextWidth;
                int effectiveMaxTextWidth = (maxTextWidth != null && maxTextWidth > 0)
                        ? maxTextWidth
                        : DEFAULT_MAX_TEXT_WIDTH;

                return new DocframeConfig(messageLevel, defaultTitle, effectiveMaxTextWidth);
            }
        } catch (IOException e) {
            // Fall through to default
        }

        return defaults();
    }

    public static DocframeConfig with(MessageLevel messageLevel, String defaultTitle, int maxTextWidth) {
        int effectiveMaxTextWidth = maxTextWidth > 0 ? maxTextWidth : DEFAULT_MAX_TEXT_WIDTH;
        return new DocframeConfig(messageLevel, defaultTitle != null ? defaultTitle : DEFAULT_TITLE, effectiveMaxTextWidth);
    }

    private static DocframeConfig defaults() {
        return new DocframeConfig(null, DEFAULT_TITLE, DEFAULT_MAX_TEXT_WIDTH);
    }

    private static class YamlConfig {
        public String messageLevel;
        public String defaultTitle;
        public Integer maxTextWidth;
    }
}
