package com.nevis.xray.config;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Validated
@ConfigurationProperties(prefix = "app.sync")
public record SyncProperties(
	boolean autoUpload,
	@NotNull Path remoteRoot,
	String folder
) {}
