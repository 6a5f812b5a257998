package com.nevis.xray.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.providers")
public record ProviderProperties(
	@NotBlank String defaultProvider,
	@NotNull Duration connectTimeout,
	@NotNull Duration readTimeout,
	@NotNull @Min(1) Integer rpmLimit,
	@Valid @NotNull Retry retry,
	@Valid @NotNull Connectivity connectivity,
	@Valid @NotNull Endpoint gemini,
	@Valid @NotNull Endpoint chatgpt,
	@Valid @NotNull Endpoint local
) {

	public record Retry(
		@NotNull @Min(1) Integer transientMaxAttempts,
		@NotNull Duration transientDelay,
		@NotNull @Min(1) Integer rateLimitMaxAttempts,
		@NotNull Duration rateLimitDelay
	) {}

	public record Connectivity(
		@NotBlank String host,
		@NotNull Integer port,
		@NotNull Duration timeout
	) {}

	public record Endpoint(
		String apiKey,
		@NotBlank String model,
		@NotBlank String endpoint
	) {}
}
