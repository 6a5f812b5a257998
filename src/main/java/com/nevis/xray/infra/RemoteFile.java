package com.nevis.xray.infra;

public record RemoteFile(String name, String path) {}
