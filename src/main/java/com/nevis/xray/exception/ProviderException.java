package com.nevis.xray.exception;

import com.nevis.xray.model.ErrorKind;
import lombok.Getter;

@Getter
public class ProviderException extends RuntimeException {
    private final ErrorKind kind;
    private final Integer statusCode;

    public ProviderException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public ProviderException(ErrorKind kind, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static ProviderException noApiKey(String provider) {
        return new ProviderException(ErrorKind.NO_API_KEY, "API key not set for " + provider);
    }

    public static ProviderException noNetwork() {
        return new ProviderException(ErrorKind.NO_NETWORK, "No internet connection");
    }

    public static ProviderException timeout(String detail, Throwable cause) {
        return new ProviderException(ErrorKind.TIMEOUT, null, detail, cause);
    }

    public static ProviderException status(int code) {
        return new ProviderException(ErrorKind.PROVIDER_ERROR, code, "Error Code: " + code, null);
    }

    public static ProviderException malformed(String detail) {
        return new ProviderException(ErrorKind.MALFORMED_RESPONSE, detail);
    }
}
