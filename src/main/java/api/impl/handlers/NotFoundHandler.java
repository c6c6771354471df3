package api.impl.handlers;

import api.impl.HttpStatus;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

public class NotFoundHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        res.json(HttpStatus.NOT_FOUND, HttpStatus.reason(HttpStatus.NOT_FOUND),
                AbstractItemHandler.detail("Not Found").toString());
    }
}
