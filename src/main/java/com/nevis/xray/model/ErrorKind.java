package com.nevis.xray.model;

public enum ErrorKind {
    NO_NETWORK,
    NO_API_KEY,
    TIMEOUT,
    PROVIDER_ERROR,
    MALFORMED_RESPONSE,
    ABORTED,
    CACHE_VERSION_MISMATCH,
    INVALID_CACHE_CONTENT,
    NO_TEXT,
    INTERNAL
}
