package api.interfaces;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/**
 * Handles one request. Expected failures are written into {@code res};
 * anything thrown is answered by the server with a 500.
 */
public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
