package api.impl;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpRequestReaderTest {

    private static InputStream in(String raw) {
        return new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void readsRequestLineHeadersAndBody() throws IOException {
        String raw = "PUT /items/3?verbose=1 HTTP/1.1\r\n" +
                "Host: localhost\r\n" +
                "content-type: application/json\r\n" +
                "Content-Length: 14\r\n\r\n" +
                "{\"price\":12.5}";
        MinimalHttpRequest req = HttpRequestReader.read(in(raw), new ByteArrayOutputStream());

        assertNotNull(req);
        assertEquals("PUT", req.method());
        assertEquals("/items/3", req.path());
        assertEquals("verbose=1", req.query());
        assertEquals("HTTP/1.1", req.version());
        assertEquals("application/json", req.header("Content-Type"));
        assertEquals("{\"price\":12.5}", req.bodyText());
    }

    @Test
    void noContentLengthMeansEmptyBody() throws IOException {
        MinimalHttpRequest req = HttpRequestReader.read(in("GET /items HTTP/1.1\r\n\r\n"), new ByteArrayOutputStream());
        assertNotNull(req);
        assertEquals(0, req.body().length);
        assertNull(req.query());
    }

    @Test
    void emptyStreamGivesNull() throws IOException {
        assertNull(HttpRequestReader.read(in(""), new ByteArrayOutputStream()));
        assertNull(HttpRequestReader.read(in("\r\n\r\n"), new ByteArrayOutputStream()));
    }

    @Test
    void answersExpectContinue() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String raw = "POST /items HTTP/1.1\r\nExpect: 100-continue\r\nContent-Length: 2\r\n\r\n{}";
        MinimalHttpRequest req = HttpRequestReader.read(in(raw), out);
        assertEquals("{}", req.bodyText());
        assertEquals("HTTP/1.1 100 Continue\r\n\r\n", out.toString(StandardCharsets.US_ASCII));
    }

    @Test
    void rejectsBrokenFraming() {
        assertThrows(HttpRequestReader.MalformedRequestException.class,
                () -> HttpRequestReader.read(in("GARBAGE\r\n\r\n"), new ByteArrayOutputStream()));
        assertThrows(HttpRequestReader.MalformedRequestException.class,
                () -> HttpRequestReader.read(in("POST /items HTTP/1.1\r\nContent-Length: x\r\n\r\n"),
                        new ByteArrayOutputStream()));
        assertThrows(HttpRequestReader.MalformedRequestException.class,
                () -> HttpRequestReader.read(in("POST /items HTTP/1.1\r\nContent-Length: 10\r\n\r\n{}"),
                        new ByteArrayOutputStream()));
    }

    @Test
    void responseWriterOmitsBodyFor204() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(HttpStatus.NO_CONTENT, "No Content");
        res.body("ignored");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res);
        String wire = out.toString(StandardCharsets.UTF_8);
        assertTrue(wire.startsWith("HTTP/1.1 204 No Content\r\n"));
        assertTrue(wire.endsWith("\r\n\r\n"));
        assertFalse(wire.contains("ignored"));
    }
}
