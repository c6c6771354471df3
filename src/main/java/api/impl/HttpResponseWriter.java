package api.impl;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class HttpResponseWriter {

    private HttpResponseWriter() {}

    public static void write(OutputStream out, HttpResponseImpl res) throws IOException {
        // 204 carries no body
        byte[] body = res.status() == HttpStatus.NO_CONTENT ? new byte[0] : res.body();

        if (!res.headers().containsKey("Connection")) {
            res.header("Connection", "close");
        }
        if (res.status() != HttpStatus.NO_CONTENT) {
            res.header("Content-Length", String.valueOf(body.length));
        }

        OutputStreamWriter w = new OutputStreamWriter(out, StandardCharsets.US_ASCII);
        w.write("HTTP/1.1 " + res.status() + " " + res.reason() + "\r\n");
        for (Map.Entry<String, String> e : res.headers().entrySet()) {
            w.write(e.getKey() + ": " + e.getValue() + "\r\n");
        }
        w.write("\r\n");
        w.flush();

        out.write(body);
        out.flush();
    }

    public static void writePlain(OutputStream out, int code, String text) throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(code, HttpStatus.reason(code));
        res.header("Content-Type", "text/plain; charset=utf-8");
        res.body(text);
        write(out, res);
    }
}
