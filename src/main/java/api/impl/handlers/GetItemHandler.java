package api.impl.handlers;

import api.impl.HttpStatus;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import domain.interfaces.IItemService;

/** GET /items/{id} */
public class GetItemHandler extends AbstractItemHandler {

    public GetItemHandler(IItemService service) { super(service); }

    @Override
    protected void doHandle(HttpRequest req, HttpResponse res) {
        json(res, HttpStatus.OK, service.get(itemId(req)));
    }
}
