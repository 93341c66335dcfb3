package com.ledgerpilot.budget.remote;

/**
 * Failure reported by (or while reaching) the remote budget API. Status 0 means the request never
 * produced an HTTP response.
 */
public class RemoteApiException extends RuntimeException {

    public static final int NO_RESPONSE = 0;

    private final int status;
    private final String detail;
    private final String rawBody;

    public RemoteApiException(int status, String detail, String rawBody) {
        this(status, detail, rawBody, null);
    }

    public RemoteApiException(int status, String detail, String rawBody, Throwable cause) {
        super(status == NO_RESPONSE ? detail : "Remote API error " + status + ": " + detail, cause);
        this.status = status;
        this.detail = detail;
        this.rawBody = rawBody;
    }

    public int status() {
        return status;
    }

    public String detail() {
        return detail;
    }

    public String rawBody() {
        return rawBody;
    }
}
