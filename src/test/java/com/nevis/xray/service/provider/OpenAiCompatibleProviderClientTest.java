package com.nevis.xray.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.xray.exception.ProviderException;
import com.nevis.xray.infra.NetworkProbe;
import com.nevis.xray.infra.RateLimiter;
import com.nevis.xray.model.ErrorKind;
import com.nevis.xray.model.ExtractionPayload;
import com.nevis.xray.model.ProviderConfig;
import com.nevis.xray.model.ProviderType;
import com.nevis.xray.service.PromptCatalog;
import com.nevis.xray.service.ResponseParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;

import static com.nevis.xray.service.provider.ProviderTestSupport.LOCAL_URL;
import static com.nevis.xray.service.provider.ProviderTestSupport.OPENAI_URL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiCompatibleProviderClientTest {

    private static final String ANALYSIS_REPLY = """
        {"choices": [{"finish_reason": "stop",
          "message": {"role": "assistant", "content": "```json\\n{\\"themes\\": [\\"ambition\\"]}\\n```"}}]}
        """;

    private final ProviderConfig chatGptConfig = new ProviderConfig(ProviderType.CHATGPT, "test-key",
        "gpt-4o-mini", OPENAI_URL);

    private MockRestServiceServer server;
    private NetworkProbe networkProbe;
    private ChatGptProviderClient chatGpt;
    private LocalAiProviderClient localAi;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        RestClient restClient = builder.build();
        networkProbe = mock(NetworkProbe.class);
        when(networkProbe.isOnline()).thenReturn(true);
        RateLimiter limiter = key -> { };

        ObjectMapper objectMapper = new ObjectMapper();
        ResponseParser parser = new ResponseParser(objectMapper);
        PromptCatalog prompts = new PromptCatalog(objectMapper, "en");
        chatGpt = new ChatGptProviderClient(restClient, parser, objectMapper, networkProbe, limiter, prompts,
            ProviderTestSupport.properties());
        localAi = new LocalAiProviderClient(restClient, parser, objectMapper, networkProbe, limiter, prompts,
            ProviderTestSupport.properties());
    }

    @Test
    void shouldSendChatCompletionRequest() {
        server.expect(requestTo(OPENAI_URL))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
            .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
            .andExpect(jsonPath("$.messages[0].role").value("system"))
            .andExpect(jsonPath("$.messages[1].role").value("user"))
            .andExpect(jsonPath("$.messages[1].content").value("prompt"))
            .andExpect(jsonPath("$.max_tokens").value(8192))
            .andExpect(jsonPath("$.top_p").value(0.95))
            .andExpect(jsonPath("$.response_format.type").value("json_object"))
            .andRespond(withSuccess(ANALYSIS_REPLY, MediaType.APPLICATION_JSON));

        ExtractionPayload payload = chatGpt.analyze("prompt", chatGptConfig);

        server.verify();
        assertThat(payload.json().path("themes").get(0).asText()).isEqualTo("ambition");
    }

    @Test
    void shouldRetryOnceAfterRateLimit() {
        server.expect(requestTo(OPENAI_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo(OPENAI_URL)).andRespond(withSuccess(ANALYSIS_REPLY, MediaType.APPLICATION_JSON));

        ExtractionPayload payload = chatGpt.analyze("prompt", chatGptConfig);

        server.verify();
        assertThat(payload.blocked()).isFalse();
    }

    @Test
    void shouldTimeOutWhenStillRateLimited() {
        server.expect(ExpectedCount.times(2), requestTo(OPENAI_URL))
            .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> chatGpt.analyze("prompt", chatGptConfig))
            .isInstanceOf(ProviderException.class)
            .extracting("kind")
            .isEqualTo(ErrorKind.TIMEOUT);
        server.verify();
    }

    @Test
    void shouldNotRetryTransportFailure() {
        server.expect(ExpectedCount.once(), requestTo(OPENAI_URL))
            .andRespond(request -> {
                throw new ConnectException("Connection refused");
            });

        assertThatThrownBy(() -> chatGpt.analyze("prompt", chatGptConfig))
            .isInstanceOf(ProviderException.class)
            .extracting("kind")
            .isEqualTo(ErrorKind.TIMEOUT);
        server.verify();
    }

    @Test
    void shouldTreatContentFilterAsBlocked() {
        server.expect(requestTo(OPENAI_URL))
            .andRespond(withSuccess("{\"choices\": [{\"finish_reason\": \"content_filter\", \"message\": {}}]}",
                MediaType.APPLICATION_JSON));

        assertThat(chatGpt.analyze("prompt", chatGptConfig).blocked()).isTrue();
    }

    @Test
    void shouldTreatRefusalAsBlocked() {
        server.expect(requestTo(OPENAI_URL))
            .andRespond(withSuccess(
                "{\"choices\": [{\"finish_reason\": \"stop\", \"message\": {\"content\": null, \"refusal\": \"I can't help\"}}]}",
                MediaType.APPLICATION_JSON));

        assertThat(chatGpt.analyze("prompt", chatGptConfig).blocked()).isTrue();
    }

    @Test
    void shouldSurfaceErrorObject() {
        server.expect(requestTo(OPENAI_URL))
            .andRespond(withSuccess("{\"error\": {\"message\": \"model not found\"}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> chatGpt.analyze("prompt", chatGptConfig))
            .isInstanceOfSatisfying(ProviderException.class, ex -> {
                assertThat(ex.getKind()).isEqualTo(ErrorKind.PROVIDER_ERROR);
                assertThat(ex.getMessage()).isEqualTo("model not found");
            });
    }

    @Test
    void shouldReportUnauthorizedAsProviderError() {
        server.expect(ExpectedCount.once(), requestTo(OPENAI_URL))
            .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> chatGpt.analyze("prompt", chatGptConfig))
            .isInstanceOfSatisfying(ProviderException.class, ex -> {
                assertThat(ex.getKind()).isEqualTo(ErrorKind.PROVIDER_ERROR);
                assertThat(ex.getStatusCode()).isEqualTo(401);
            });
        server.verify();
    }

    @Test
    void shouldRequireApiKeyForChatGpt() {
        ProviderConfig noKey = new ProviderConfig(ProviderType.CHATGPT, "", "gpt-4o-mini", OPENAI_URL);

        assertThatThrownBy(() -> chatGpt.analyze("prompt", noKey))
            .isInstanceOf(ProviderException.class)
            .extracting("kind")
            .isEqualTo(ErrorKind.NO_API_KEY);
    }

    @Test
    void shouldCallLocalServerWithoutKeyOrConnectivityCheck() {
        ProviderConfig local = new ProviderConfig(ProviderType.LOCAL, null, "local-model", LOCAL_URL);
        server.expect(requestTo(LOCAL_URL))
            .andExpect(headerDoesNotExist(HttpHeaders.AUTHORIZATION))
            .andExpect(jsonPath("$.model").value("local-model"))
            .andRespond(withSuccess(ANALYSIS_REPLY, MediaType.APPLICATION_JSON));

        ExtractionPayload payload = localAi.analyze("prompt", local);

        server.verify();
        assertThat(payload.isEmpty()).isFalse();
        verifyNoInteractions(networkProbe);
    }

    @Test
    void shouldRecognisePrivateEndpoints() {
        assertThat(AbstractProviderClient.isPrivateEndpoint("http://localhost:1234/v1")).isTrue();
        assertThat(AbstractProviderClient.isPrivateEndpoint("http://127.0.0.1:8080")).isTrue();
        assertThat(AbstractProviderClient.isPrivateEndpoint("http://192.168.1.20:11434/v1")).isTrue();
        assertThat(AbstractProviderClient.isPrivateEndpoint("http://10.0.0.5/v1")).isTrue();
        assertThat(AbstractProviderClient.isPrivateEndpoint("https://api.openai.com/v1/chat/completions")).isFalse();
        assertThat(AbstractProviderClient.isPrivateEndpoint("https://api10.example.com")).isFalse();
    }
}
