package api.impl.handlers;

import api.impl.HttpStatus;
import api.impl.ItemRequestParser;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import domain.interfaces.IItemService;
import domain.model.Item;

/** POST /items */
public class CreateItemHandler extends AbstractItemHandler {
    private final ItemRequestParser parser;

    public CreateItemHandler(IItemService service, ItemRequestParser parser) {
        super(service);
        this.parser = parser;
    }

    @Override
    protected void doHandle(HttpRequest req, HttpResponse res) {
        Item created = service.create(parser.parseCreate(req.bodyText()));
        res.header("Location", "/items/" + created.getId());
        json(res, HttpStatus.CREATED, created);
    }
}
