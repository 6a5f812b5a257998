package com.nevis.xray.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.analysis")
public record AnalysisProperties(
	@NotNull @Min(1024) Integer chunkSize,
	@NotNull Duration chunkDelay,
	@NotBlank String language,
	@NotNull Duration taskRetention
) {}
