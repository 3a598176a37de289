package com.econlens.dataclient;

import java.io.IOException;

/**
 * The explorer backend answered with a non-2xx status.
 */
public class ExplorerApiException extends IOException {

    private final int statusCode;
    private final String path;
    private final String responseBody;

    public ExplorerApiException(int statusCode, String path, String responseBody) {
        super("GET " + path + " failed with HTTP " + statusCode + bodySuffix(responseBody));
        this.statusCode = statusCode;
        this.path = path;
        this.responseBody = responseBody;
    }

    private static String bodySuffix(String body) {
        if (body == null || body.isBlank()) return "";
        String trimmed = body.length() > 200 ? body.substring(0, 200) + "..." : body;
        return ": " + trimmed;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getPath() {
        return path;
    }

    public String getResponseBody() {
        return responseBody;
    }

    /**
     * True for 404, i.e. the series or survey does not exist.
     */
    public boolean isNotFound() {
        return statusCode == 404;
    }
}
