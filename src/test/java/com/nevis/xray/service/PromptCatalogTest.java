package com.nevis.xray.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PromptCatalogTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldFillTextBasedTemplate() {
        PromptCatalog catalog = new PromptCatalog(objectMapper, "zh");

        String prompt = catalog.textBased("红楼梦", "曹雪芹", "第一回正文");

        assertThat(catalog.language()).isEqualTo("zh");
        assertThat(prompt).contains("红楼梦", "曹雪芹", "第一回正文");
    }

    @Test
    void shouldEmbedExistingAnalysisInIncrementalPrompt() {
        PromptCatalog catalog = new PromptCatalog(objectMapper, "en");

        String prompt = catalog.incremental("Dune", "Frank Herbert", "{\"themes\":[\"power\"]}", "Chapter two");

        assertThat(catalog.language()).isEqualTo("en");
        assertThat(prompt).contains("Dune", "Frank Herbert", "{\"themes\":[\"power\"]}", "Chapter two");
    }

    @Test
    void shouldUseFallbackAuthorWhenMissing() {
        PromptCatalog catalog = new PromptCatalog(objectMapper, "zh");

        assertThat(catalog.textBased("书名", " ", "正文")).contains(catalog.fallback().unknownAuthor());
    }

    @Test
    void shouldFallBackToChineseForUnknownLanguage() {
        PromptCatalog catalog = new PromptCatalog(objectMapper, "xx");

        assertThat(catalog.language()).isEqualTo("zh");
        assertThat(catalog.systemInstruction()).isNotBlank();
        assertThat(catalog.fallback().notSpecified()).isEqualTo("未指定");
    }
}
