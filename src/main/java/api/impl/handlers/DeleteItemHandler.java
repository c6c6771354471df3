package api.impl.handlers;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import domain.interfaces.IItemService;

/** DELETE /items/{id} */
public class DeleteItemHandler extends AbstractItemHandler {

    public DeleteItemHandler(IItemService service) { super(service); }

    @Override
    protected void doHandle(HttpRequest req, HttpResponse res) {
        service.delete(itemId(req));
        noContent(res);
    }
}
