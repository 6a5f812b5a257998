package com.nevis.xray.service.provider;

import com.nevis.xray.model.ConnectionTestResult;
import com.nevis.xray.model.ExtractionPayload;
import com.nevis.xray.model.ProviderConfig;
import com.nevis.xray.model.ProviderType;

public interface ProviderClient {
    ProviderType type();

    /**
     * Sends one prompt and returns the extracted JSON. A safety refusal comes back as
     * {@link ExtractionPayload#blockedBySafetyFilter()}; every other failure is thrown
     * as a {@link com.nevis.xray.exception.ProviderException}.
     */
    ExtractionPayload analyze(String prompt, ProviderConfig config);

    ConnectionTestResult testConnection(ProviderConfig config);
}
