package app;

import api.impl.ItemHttpServer;
import api.impl.handlers.HandlerFactory;
import api.interfaces.IHttpServer;
import domain.interfaces.IItemService;
import domain.interfaces.IRecordStore;
import domain.validation.ItemValidator;
import infrastructure.config.ServerConfig;
import infrastructure.impl.ItemServiceImpl;
import infrastructure.impl.JsonFileRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Entry point: {@code CrudServer [port] [dataFile]}.
 * Other settings come from {@link ServerConfig}.
 */
public class CrudServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrudServer.class);

    public static void main(String[] args) throws Exception {
        ServerConfig config = ServerConfig.load(args);
        IHttpServer server = create(config);
        server.start(config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                LOGGER.warn("shutdown failed: {}", e.getMessage());
            }
        }, "shutdown"));

        Thread.currentThread().join();
    }

    /** Wires store, service and routes; the returned server is not started yet. */
    public static IHttpServer create(ServerConfig config) {
        IRecordStore store = new JsonFileRecordStore(config.dataFile());
        IItemService service = new ItemServiceImpl(store, new ItemValidator(), Clock.systemDefaultZone());
        return new ItemHttpServer(new HandlerFactory(service), config.host(), config.workers());
    }
}
