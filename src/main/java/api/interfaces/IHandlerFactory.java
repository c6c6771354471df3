package api.interfaces;

import api.interfaces.http.HttpRequest;

/** Picks the handler for a request by method and path. Never returns null. */
public interface IHandlerFactory {
    IHttpHandler create(HttpRequest req);
}
