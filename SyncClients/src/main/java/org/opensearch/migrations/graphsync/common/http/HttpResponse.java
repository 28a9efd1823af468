package org.opensearch.migrations.graphsync.common.http;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.ToString;

/** A fully read response from the cluster; the body is null when there was none. */
@AllArgsConstructor
@ToString
public class HttpResponse {
    public final int statusCode;
    public final String statusText;
    @ToString.Exclude
    public final Map<String, String> headers;
    @ToString.Exclude
    public final String body;
}
