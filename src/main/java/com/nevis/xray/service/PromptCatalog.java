package com.nevis.xray.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.xray.config.AnalysisProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Prompt templates and placeholder strings for one language, read from
 * {@code classpath:prompts/<lang>.json}.
 */
@Component
@Slf4j
public class PromptCatalog {

    static final String DEFAULT_LANGUAGE = "zh";

    private final String language;
    private final Prompts prompts;

    @Autowired
    public PromptCatalog(ObjectMapper objectMapper, AnalysisProperties properties) {
        this(objectMapper, properties.language());
    }

    public PromptCatalog(ObjectMapper objectMapper, String language) {
        String requested = language == null ? DEFAULT_LANGUAGE : language.trim().toLowerCase(Locale.ROOT);
        Prompts loaded = read(objectMapper, requested);
        if (loaded == null && !DEFAULT_LANGUAGE.equals(requested)) {
            log.warn("No prompts for language '{}', falling back to '{}'", requested, DEFAULT_LANGUAGE);
            requested = DEFAULT_LANGUAGE;
            loaded = read(objectMapper, requested);
        }
        if (loaded == null) {
            log.warn("Prompt resources missing, using built-in prompts");
            loaded = Prompts.builtIn();
        }
        this.language = requested;
        this.prompts = loaded.withDefaults(Prompts.builtIn());
        log.info("Loaded prompts for language '{}'", this.language);
    }

    public String language() {
        return language;
    }

    public String systemInstruction() {
        return prompts.systemInstruction();
    }

    public String textBased(String title, String author, String text) {
        return String.format(prompts.textBased(), title, authorOrFallback(author), text);
    }

    public String incremental(String title, String author, String snapshotJson, String text) {
        return String.format(prompts.incremental(), title, authorOrFallback(author), snapshotJson, text);
    }

    public Fallback fallback() {
        return prompts.fallback();
    }

    private String authorOrFallback(String author) {
        return author == null || author.isBlank() ? prompts.fallback().unknownAuthor() : author;
    }

    private static Prompts read(ObjectMapper objectMapper, String language) {
        ClassPathResource resource = new ClassPathResource("prompts/" + language + ".json");
        if (!resource.exists()) {
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, Prompts.class);
        } catch (IOException e) {
            log.error("Failed to read prompts for language '{}'", language, e);
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Prompts(
        @JsonProperty("system_instruction") String systemInstruction,
        @JsonProperty("text_based") String textBased,
        String incremental,
        Fallback fallback
    ) {
        static Prompts builtIn() {
            return new Prompts(
                "你是一位专业的文学评论家。你的回复必须仅使用有效的JSON格式。",
                "请分析书籍文本。\n\n书名：《%s》\n作者：%s\n\n<书籍内容>\n%s\n</书籍内容>",
                "请更新分析。\n\n书名：《%s》\n作者：%s\n\n<已有分析>\n%s\n</已有分析>\n\n<本段文字>\n%s\n</本段文字>",
                Fallback.builtIn()
            );
        }

        Prompts withDefaults(Prompts defaults) {
            return new Prompts(
                blank(systemInstruction) ? defaults.systemInstruction() : systemInstruction,
                blank(textBased) ? defaults.textBased() : textBased,
                blank(incremental) ? defaults.incremental() : incremental,
                fallback == null ? defaults.fallback() : fallback.withDefaults(defaults.fallback())
            );
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Fallback(
        @JsonProperty("unknown_book") String unknownBook,
        @JsonProperty("unknown_author") String unknownAuthor,
        @JsonProperty("not_specified") String notSpecified
    ) {
        static Fallback builtIn() {
            return new Fallback("未知书籍", "未知作者", "未指定");
        }

        Fallback withDefaults(Fallback defaults) {
            return new Fallback(
                blank(unknownBook) ? defaults.unknownBook() : unknownBook,
                blank(unknownAuthor) ? defaults.unknownAuthor() : unknownAuthor,
                blank(notSpecified) ? defaults.notSpecified() : notSpecified
            );
        }
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
