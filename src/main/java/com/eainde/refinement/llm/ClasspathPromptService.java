package com.eainde.refinement.llm;

import com.eainde.refinement.config.RefinementConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt templates from the classpath:
 * <pre>
 * {basePath}/{promptName}.system.txt
 * {basePath}/{promptName}.user.txt
 * </pre>
 * Templates are read once and cached.
 */
public class ClasspathPromptService implements PromptService {

    private static final Logger log = LoggerFactory.getLogger(ClasspathPromptService.class);

    public static final String DEFAULT_BASE_PATH = "prompts";

    private final String basePath;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public ClasspathPromptService() {
        this(DEFAULT_BASE_PATH);
    }

    public ClasspathPromptService(String basePath) {
        this.basePath = basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
    }

    @Override
    public String getSystemPrompt(String promptName) {
        return load(promptName + ".system.txt");
    }

    @Override
    public String getUserPrompt(String promptName) {
        return load(promptName + ".user.txt");
    }

    private String load(String fileName) {
        return cache.computeIfAbsent(basePath + "/" + fileName, this::read);
    }

    private String read(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new RefinementConfigurationException("Prompt template not found on classpath: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            String template = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            log.debug("Loaded prompt template {} ({} chars)", path, template.length());
            return template;
        } catch (IOException e) {
            throw new RefinementConfigurationException("Could not read prompt template " + path, e);
        }
    }
}
