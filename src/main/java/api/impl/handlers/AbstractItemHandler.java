package api.impl.handlers;

import api.impl.HttpStatus;
import api.impl.ItemRequestParser;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import domain.exception.ItemNotFoundException;
import domain.exception.StorageException;
import domain.interfaces.IItemService;
import domain.validation.FieldError;
import domain.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for the item handlers. Subclasses do the work in {@link #doHandle}; the
 * expected failures are mapped here:
 * <ul>
 *   <li>{@link ValidationException} to 422 with the rejected fields</li>
 *   <li>{@link ItemNotFoundException} to 404 naming the id</li>
 *   <li>{@link StorageException} to 500, logged</li>
 * </ul>
 */
public abstract class AbstractItemHandler implements IHttpHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractItemHandler.class);

    protected static final Gson GSON = new GsonBuilder().serializeNulls().create();

    protected final IItemService service;

    protected AbstractItemHandler(IItemService service) {
        this.service = service;
    }

    @Override
    public final void handle(HttpRequest req, HttpResponse res) {
        try {
            doHandle(req, res);
        } catch (ValidationException e) {
            LOGGER.debug("{} {} rejected: {}", req.method(), req.path(), e.getMessage());
            json(res, HttpStatus.UNPROCESSABLE_ENTITY, validationBody(e));
        } catch (ItemNotFoundException e) {
            json(res, HttpStatus.NOT_FOUND, detail(e.getMessage()));
        } catch (StorageException e) {
            LOGGER.error("{} {} failed on storage", req.method(), req.path(), e);
            json(res, HttpStatus.INTERNAL_SERVER_ERROR, detail("Internal Server Error"));
        }
    }

    protected abstract void doHandle(HttpRequest req, HttpResponse res);

    protected static void json(HttpResponse res, int code, Object body) {
        res.json(code, HttpStatus.reason(code), GSON.toJson(body));
    }

    protected static void noContent(HttpResponse res) {
        res.status(HttpStatus.NO_CONTENT, HttpStatus.reason(HttpStatus.NO_CONTENT));
        res.body("");
    }

    /** @return the id from the last path segment of {@code /items/{id}}. */
    protected static int itemId(HttpRequest req) {
        String path = HandlerFactory.normalize(req.path());
        return ItemRequestParser.parseId(path.substring(path.lastIndexOf('/') + 1));
    }

    static JsonObject detail(String message) {
        JsonObject o = new JsonObject();
        o.addProperty("detail", message);
        return o;
    }

    static JsonObject validationBody(ValidationException e) {
        JsonArray details = new JsonArray();
        for (FieldError fe : e.errors()) {
            JsonObject d = new JsonObject();
            JsonArray loc = new JsonArray();
            fe.loc().forEach(loc::add);
            d.add("loc", loc);
            d.addProperty("msg", fe.msg());
            d.addProperty("type", fe.type());
            details.add(d);
        }
        JsonObject o = new JsonObject();
        o.add("detail", details);
        return o;
    }
}
