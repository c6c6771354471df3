package api.impl.handlers;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import domain.interfaces.IItemService;

/** DELETE /items, unconditional. */
public class DeleteAllItemsHandler extends AbstractItemHandler {

    public DeleteAllItemsHandler(IItemService service) { super(service); }

    @Override
    protected void doHandle(HttpRequest req, HttpResponse res) {
        service.deleteAll();
        noContent(res);
    }
}
