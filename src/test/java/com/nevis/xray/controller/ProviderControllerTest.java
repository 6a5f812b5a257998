package com.nevis.xray.controller;

import com.nevis.xray.exception.ProviderException;
import com.nevis.xray.model.ConnectionTestResult;
import com.nevis.xray.model.ProviderConfig;
import com.nevis.xray.model.ProviderType;
import com.nevis.xray.service.provider.ProviderClient;
import com.nevis.xray.service.provider.ProviderClientRegistry;
import com.nevis.xray.service.provider.ProviderConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProviderController.class)
class ProviderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProviderConfigFactory providerConfigFactory;

    @MockitoBean
    private ProviderClientRegistry providerClients;

    @Test
    @DisplayName("POST /providers/{provider}/test should report a working connection")
    void testConnection_ShouldReturnSuccess() throws Exception {
        ProviderConfig config = new ProviderConfig(ProviderType.GEMINI, "key", "gemini-2.5-flash", "https://example.test");
        ProviderClient client = mock(ProviderClient.class);
        when(providerConfigFactory.create("gemini", "gemini-2.5-flash")).thenReturn(config);
        when(providerClients.get(ProviderType.GEMINI)).thenReturn(client);
        when(client.testConnection(config)).thenReturn(ConnectionTestResult.success(ProviderType.GEMINI));

        mockMvc.perform(post("/providers/{provider}/test", "gemini").param("model", "gemini-2.5-flash"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.provider").value("GEMINI"))
            .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    @DisplayName("POST /providers/{provider}/test should carry the failure kind")
    void testConnection_ShouldReturnFailureKind() throws Exception {
        ProviderConfig config = new ProviderConfig(ProviderType.CHATGPT, null, "gpt-4o-mini", "https://example.test");
        ProviderClient client = mock(ProviderClient.class);
        when(providerConfigFactory.create("chatgpt", null)).thenReturn(config);
        when(providerClients.get(ProviderType.CHATGPT)).thenReturn(client);
        when(client.testConnection(config)).thenReturn(
            ConnectionTestResult.failure(ProviderType.CHATGPT, ProviderException.noApiKey("ChatGPT")));

        mockMvc.perform(post("/providers/{provider}/test", "chatgpt"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.errorKind").value("NO_API_KEY"))
            .andExpect(jsonPath("$.message").value("API key not set for ChatGPT"));
    }

    @Test
    @DisplayName("POST /providers/{provider}/test should return 400 for an unknown provider")
    void testConnection_ShouldReturn400_WhenProviderUnknown() throws Exception {
        when(providerConfigFactory.create("claude", null)).thenThrow(new IllegalArgumentException("Unknown provider: claude"));

        mockMvc.perform(post("/providers/{provider}/test", "claude"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
    }
}
