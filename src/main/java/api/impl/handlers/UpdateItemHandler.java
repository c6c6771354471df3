package api.impl.handlers;

import api.impl.HttpStatus;
import api.impl.ItemRequestParser;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import domain.interfaces.IItemService;
import domain.model.ItemUpdate;

/** PUT /items/{id}, partial: only the keys present in the body are applied. */
public class UpdateItemHandler extends AbstractItemHandler {
    private final ItemRequestParser parser;

    public UpdateItemHandler(IItemService service, ItemRequestParser parser) {
        super(service);
        this.parser = parser;
    }

    @Override
    protected void doHandle(HttpRequest req, HttpResponse res) {
        ItemUpdate update = parser.parseUpdate(req.bodyText());
        int id = itemId(req);
        json(res, HttpStatus.OK, service.update(id, update));
    }
}
