package api.impl.handlers;

import api.impl.ItemRequestParser;
import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import domain.interfaces.IItemService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes:
 * <pre>
 *   GET    /              root info
 *   GET    /health        health
 *   POST   /items         create
 *   GET    /items         list
 *   DELETE /items         delete all
 *   GET    /items/{id}    get
 *   PUT    /items/{id}    partial update
 *   DELETE /items/{id}    delete
 * </pre>
 * Unknown paths get 404, known paths with another verb get 405.
 */
public class HandlerFactory implements IHandlerFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(HandlerFactory.class);

    private static final String ITEMS = "/items";

    private final IItemService service;
    private final ItemRequestParser parser;

    public HandlerFactory(IItemService service) {
        this(service, new ItemRequestParser());
    }

    public HandlerFactory(IItemService service, ItemRequestParser parser) {
        this.service = service;
        this.parser = parser;
    }

    @Override
    public IHttpHandler create(HttpRequest req) {
        String m = req.method().toUpperCase();
        String p = normalize(req.path());
        LOGGER.debug("route {} {}", m, p);

        if ("/".equals(p)) {
            return "GET".equals(m) ? new RootHandler() : new MethodNotAllowedHandler("GET");
        }
        if ("/health".equals(p)) {
            return "GET".equals(m) ? new HealthHandler(service) : new MethodNotAllowedHandler("GET");
        }
        if (ITEMS.equals(p)) {
            switch (m) {
                case "GET": return new ListItemsHandler(service);
                case "POST": return new CreateItemHandler(service, parser);
                case "DELETE": return new DeleteAllItemsHandler(service);
                default: return new MethodNotAllowedHandler("GET, POST, DELETE");
            }
        }
        if (p.startsWith(ITEMS + "/") && p.indexOf('/', ITEMS.length() + 1) < 0) {
            switch (m) {
                case "GET": return new GetItemHandler(service);
                case "PUT": return new UpdateItemHandler(service, parser);
                case "DELETE": return new DeleteItemHandler(service);
                default: return new MethodNotAllowedHandler("GET, PUT, DELETE");
            }
        }
        return new NotFoundHandler();
    }

    // "/items/" and "/items" are the same resource
    static String normalize(String path) {
        if (path == null || path.isEmpty()) return "/";
        String p = path;
        while (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }
}
