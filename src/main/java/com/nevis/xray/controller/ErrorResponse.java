package com.nevis.xray.controller;

public record ErrorResponse(
    String message,
    String errorCode,
    int status,
    long timestamp
) {}
