package com.nevis.xray.exception;

import lombok.experimental.StandardException;

@StandardException
public class CacheStorageException extends RuntimeException {
}
