package com.nevis.xray.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.xray.exception.ProviderException;
import com.nevis.xray.model.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser(new ObjectMapper());

    @Test
    void shouldParsePlainJsonObject() {
        JsonNode node = parser.parse("{\"characters\": [{\"name\": \"Anna\"}]}");

        assertThat(node.path("characters").get(0).path("name").asText()).isEqualTo("Anna");
    }

    @Test
    void shouldStripMarkdownFences() {
        JsonNode node = parser.parse("```json\n{\"themes\": [\"love\"]}\n```");

        assertThat(node.path("themes").get(0).asText()).isEqualTo("love");
    }

    @Test
    void shouldRecoverObjectSurroundedByProse() {
        JsonNode node = parser.parse("Here is the analysis: {\"summary\": \"A {short} story\"} Hope it helps!");

        assertThat(node.path("summary").asText()).isEqualTo("A {short} story");
    }

    @Test
    void shouldRejectNonObjectReply() {
        assertThatThrownBy(() -> parser.parse("[1, 2, 3]"))
            .isInstanceOf(ProviderException.class)
            .extracting("kind")
            .isEqualTo(ErrorKind.MALFORMED_RESPONSE);
    }

    @Test
    void shouldRejectProse() {
        assertThatThrownBy(() -> parser.parse("I cannot help with that."))
            .isInstanceOf(ProviderException.class)
            .extracting("kind")
            .isEqualTo(ErrorKind.MALFORMED_RESPONSE);
    }

    @Test
    void shouldRejectBlankReply() {
        assertThatThrownBy(() -> parser.parse("  "))
            .isInstanceOf(ProviderException.class)
            .extracting("kind")
            .isEqualTo(ErrorKind.MALFORMED_RESPONSE);
    }
}
