package api.impl;

import api.interfaces.http.HttpRequest;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String query;
    private final String version;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final byte[] body;

    /** @param target request target as sent, may include a query string */
    public MinimalHttpRequest(String method, String target, String version,
                              Map<String, String> headers, byte[] body) {
        this.method = method == null ? "" : method.toUpperCase();
        int q = target == null ? -1 : target.indexOf('?');
        this.path = target == null || target.isEmpty() ? "/" : (q >= 0 ? target.substring(0, q) : target);
        this.query = q >= 0 ? target.substring(q + 1) : null;
        this.version = version;
        if (headers != null) this.headers.putAll(headers);
        this.body = body == null ? new byte[0] : body;
    }

    public static MinimalHttpRequest of(String method, String target, String body) {
        byte[] b = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        return new MinimalHttpRequest(method, target, "HTTP/1.1",
                Map.of("Content-Length", String.valueOf(b.length)), b);
    }

    @Override public String method() { return method; }
    @Override public String path() { return path; }
    @Override public String query() { return query; }
    @Override public String version() { return version; }

    @Override
    public String header(String name) {
        if (name == null) return null;
        return headers.get(name);
    }

    @Override public byte[] body() { return body; }
}
