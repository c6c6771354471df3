package api.impl.handlers;

import api.impl.HttpStatus;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.JsonObject;

public class RootHandler implements IHttpHandler {
    public static final String VERSION = "1.0.0";

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonObject body = new JsonObject();
        body.addProperty("message", "Welcome to CRUD Service API");
        body.addProperty("version", VERSION);
        body.addProperty("items", "/items");
        res.json(HttpStatus.OK, HttpStatus.reason(HttpStatus.OK), body.toString());
    }
}
