package com.nevis.xray.exception;

import com.nevis.xray.model.ErrorKind;

/**
 * Transient failure worth another attempt: transport errors, 503/504 and 429.
 */
public class RetryableProviderException extends ProviderException {

    public RetryableProviderException(Integer statusCode, String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, statusCode, message, cause);
    }
}
