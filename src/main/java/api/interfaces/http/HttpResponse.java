package api.interfaces.http;

/** Minimal response contract */
public interface HttpResponse {
    void status(int code, String reason);
    void header(String name, String value);
    void body(String text);

    /** Status, JSON content type and body in one call. */
    default void json(int code, String reason, String json) {
        status(code, reason);
        header("Content-Type", "application/json; charset=utf-8");
        body(json);
    }
}
