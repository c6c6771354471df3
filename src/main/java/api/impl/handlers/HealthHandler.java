package api.impl.handlers;

import api.impl.HttpStatus;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.JsonObject;
import domain.interfaces.IItemService;

/** GET /health: reports the number of stored items, which also proves the store is readable. */
public class HealthHandler extends AbstractItemHandler {

    public HealthHandler(IItemService service) { super(service); }

    @Override
    protected void doHandle(HttpRequest req, HttpResponse res) {
        JsonObject body = new JsonObject();
        body.addProperty("status", "ok");
        body.addProperty("items", service.list().size());
        json(res, HttpStatus.OK, body);
    }
}
