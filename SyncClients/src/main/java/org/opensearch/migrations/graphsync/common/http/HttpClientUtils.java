package org.opensearch.migrations.graphsync.common.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Utility methods for HTTP clients.
 */
public class HttpClientUtils {
    private static final String TRUNCATION_MARKER = "... [truncated] ...";

    private HttpClientUtils() {
        // Utility class, no instances
    }

    /**
     * Builds a Basic Authorization header value.
     *
     * @param username The user name
     * @param password The password
     * @return The header value, e.g. {@code Basic YWRtaW46YWRtaW4=}
     */
    public static String basicAuthorization(String username, String password) {
        var credentials = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Shortens a response body for logging, keeping its head and tail.
     *
     * @param input The text to shorten, may be null
     * @param maxCharacters The maximum length to keep
     * @return The input unchanged if short enough, else its head and tail around a marker
     */
    public static String truncate(String input, int maxCharacters) {
        if (input == null || input.length() <= maxCharacters) {
            return input;
        }
        int partLength = maxCharacters / 2;
        return input.substring(0, partLength) + TRUNCATION_MARKER + input.substring(input.length() - partLength);
    }
}
