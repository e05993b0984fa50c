package com.motif.integration.service.client;

/**
 * Raw status and body of a downstream HTTP exchange.
 */
public record DownstreamResponse(int status, String body) {

    private static final int MAX_BODY_IN_MESSAGE = 500;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    /**
     * Body shortened for inclusion in error messages and logs.
     */
    public String abbreviatedBody() {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
