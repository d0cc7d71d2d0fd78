package com.elssolution.hydromonitor.integration.remote;

import lombok.Getter;

/** Terminal failure of one remote fetch call, after retries and the auth fallback. */
@Getter
public class RemoteFetchException extends Exception {

    public enum Kind {
        /** Every attempt timed out. */
        TIMEOUT,
        /** Connection refused, reset, DNS... Not retried. */
        TRANSPORT,
        /** 401/403 after the query-key fallback (or with fallback disabled). */
        AUTH,
        /** Any other non-2xx status. */
        HTTP_STATUS,
        /** 2xx without a JSON content type. */
        BAD_CONTENT
    }

    private final Kind kind;
    private final int statusCode; // -1 when no response was received

    public RemoteFetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = -1;
    }

    public RemoteFetchException(Kind kind, int statusCode, String message) {
        super(message);
        this.kind = kind;
        this.statusCode = statusCode;
    }
}
