package api.interfaces.http;

import java.nio.charset.StandardCharsets;

/** Minimal request contract */
public interface HttpRequest {
    String method();

    /** Request target without the query string, e.g. {@code /items/3}. */
    String path();

    /** Raw query string without '?', or null. */
    String query();

    String version();
    String header(String name); // case-insensitive
    byte[] body();

    default String bodyText() {
        byte[] b = body();
        return b == null ? "" : new String(b, StandardCharsets.UTF_8);
    }
}
