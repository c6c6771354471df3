package api.impl;

import api.interfaces.http.HttpResponse;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/** Buffers status, headers and body until {@link HttpResponseWriter} puts them on the wire. */
public class HttpResponseImpl implements HttpResponse {
    private int status = HttpStatus.OK;
    private String reason = HttpStatus.reason(HttpStatus.OK);
    private final Map<String, String> headers = new LinkedHashMap<>();
    private byte[] body = new byte[0];

    @Override
    public void status(int code, String reason) {
        this.status = code;
        this.reason = reason == null ? HttpStatus.reason(code) : reason;
    }

    @Override
    public void header(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public void body(String text) {
        this.body = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    public int status() { return status; }
    public String reason() { return reason; }
    public Map<String, String> headers() { return headers; }
    public String header(String name) { return headers.get(name); }
    public byte[] body() { return body; }
    public String bodyText() { return new String(body, StandardCharsets.UTF_8); }
}
