package api.impl.handlers;

import api.impl.HttpStatus;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/** Known path, unsupported verb. */
public class MethodNotAllowedHandler implements IHttpHandler {
    private final String allow;

    public MethodNotAllowedHandler(String allow) { this.allow = allow; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        res.header("Allow", allow);
        res.json(HttpStatus.METHOD_NOT_ALLOWED, HttpStatus.reason(HttpStatus.METHOD_NOT_ALLOWED),
                AbstractItemHandler.detail("Method Not Allowed").toString());
    }
}
