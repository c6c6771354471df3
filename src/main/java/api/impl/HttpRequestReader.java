package api.impl;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads one HTTP/1.1 request (request line, headers, Content-Length body) from a stream.
 * Chunked transfer encoding is not supported.
 */
public final class HttpRequestReader {

    /** Upper bound on accepted bodies; items are small. */
    public static final int MAX_BODY_BYTES = 1 << 20;

    private HttpRequestReader() {}

    /**
     * @param out used only to answer {@code Expect: 100-continue}
     * @return the parsed request, or null when the connection sent no request line
     * @throws MalformedRequestException when the request line or Content-Length is unusable
     */
    public static MinimalHttpRequest read(InputStream in, OutputStream out) throws IOException {
        String start = readLineAscii(in); // e.g. "POST /items HTTP/1.1"
        if (start == null || start.isBlank()) return null;

        String[] p = start.trim().split(" ", 3);
        if (p.length < 2) throw new MalformedRequestException("bad request line: " + start);
        String method = p[0];
        String target = p[1];
        String version = p.length > 2 ? p[2] : "HTTP/1.1";

        Map<String, String> headers = new LinkedHashMap<>();
        String line;
        while ((line = readLineAscii(in)) != null && !line.isEmpty()) {
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.put(line.substring(0, idx).trim(), line.substring(idx + 1).trim());
            }
        }

        String expect = find(headers, "Expect");
        if (expect != null && expect.equalsIgnoreCase("100-continue")) {
            out.write("HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();
        }

        int len = contentLength(find(headers, "Content-Length"));
        byte[] body = new byte[len];
        int total = 0;
        while (total < len) {
            int n = in.read(body, total, len - total);
            if (n < 0) throw new MalformedRequestException("body shorter than Content-Length " + len);
            total += n;
        }
        return new MinimalHttpRequest(method, target, version, headers, body);
    }

    static int contentLength(String value) throws MalformedRequestException {
        if (value == null || value.isBlank()) return 0;
        int len;
        try {
            len = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRequestException("bad Content-Length: " + value);
        }
        if (len < 0 || len > MAX_BODY_BYTES) throw new MalformedRequestException("Content-Length out of range: " + len);
        return len;
    }

    private static String find(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    static String readLineAscii(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = Math.max(0, bytes.length - 1);
                return new String(bytes, 0, len, StandardCharsets.US_ASCII);
            }
            if (b == '\n') {
                return buf.toString(StandardCharsets.US_ASCII);
            }
            buf.write(b);
            prev = b;
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.US_ASCII);
    }

    /** The bytes on the wire are not a usable HTTP request. Answered with 400. */
    public static class MalformedRequestException extends IOException {
        public MalformedRequestException(String message) {
            super(message);
        }
    }
}
