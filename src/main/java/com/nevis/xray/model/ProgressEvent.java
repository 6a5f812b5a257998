package com.nevis.xray.model;

public record ProgressEvent(int chunkIndex, int totalChunks) {}
