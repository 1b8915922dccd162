package com.mimecast.lodestar.http;

/**
 * HTTP response container.
 * <p>Immutable status code and fully read body.
 */
public final class HttpResult {

    private final int code;
    private final String body;

    /**
     * Constructs a new HttpResult instance.
     *
     * @param code Status code.
     * @param body Body string, null is stored as empty.
     */
    public HttpResult(int code, String body) {
        this.code = code;
        this.body = body != null ? body : "";
    }

    /**
     * Gets status code.
     *
     * @return Integer.
     */
    public int getCode() {
        return code;
    }

    /**
     * Gets body.
     *
     * @return Body string, never null.
     */
    public String getBody() {
        return body;
    }

    /**
     * Is status code in the 2xx range.
     *
     * @return Boolean.
     */
    public boolean isSuccessful() {
        return code >= 200 && code < 300;
    }

    @Override
    public String toString() {
        return "HttpResult{code=" + code + ", body=" + body.length() + " bytes}";
    }
}
