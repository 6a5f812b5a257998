package com.nevis.xray.controller;

import com.nevis.xray.model.ConnectionTestResult;
import com.nevis.xray.model.ProviderConfig;
import com.nevis.xray.service.provider.ProviderClientRegistry;
import com.nevis.xray.service.provider.ProviderConfigFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ProviderController {

    private final ProviderConfigFactory providerConfigFactory;
    private final ProviderClientRegistry providerClients;

    @PostMapping("/providers/{provider}/test")
    public ResponseEntity<ConnectionTestResult> testConnection(
        @PathVariable String provider,
        @RequestParam(name = "model", required = false) String model) {

        ProviderConfig config = providerConfigFactory.create(provider, model);
        return ResponseEntity.ok(providerClients.get(config.type()).testConnection(config));
    }
}
