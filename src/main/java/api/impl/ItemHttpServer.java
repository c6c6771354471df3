package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.IHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking socket server: one acceptor thread hands each connection to a fixed
 * worker pool. One request per connection ({@code Connection: close}).
 * <p>
 * A handler that throws is answered with 500 and the server keeps serving.
 */
public class ItemHttpServer implements IHttpServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ItemHttpServer.class);

    private static final int READ_TIMEOUT_MS = 30_000;

    private final IHandlerFactory factory;
    private final String host;
    private final int workers;

    private volatile ServerSocket serverSocket;
    private ExecutorService pool;
    private Thread acceptor;

    public ItemHttpServer(IHandlerFactory factory, String host, int workers) {
        this.factory = factory;
        this.host = host;
        this.workers = workers;
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (serverSocket != null) throw new IllegalStateException("already started");
        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        ss.bind(new InetSocketAddress(InetAddress.getByName(host), port));
        serverSocket = ss;

        AtomicInteger n = new AtomicInteger();
        pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "http-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        acceptor = new Thread(this::acceptLoop, "http-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        LOGGER.info("listening on {}:{}", host, ss.getLocalPort());
    }

    @Override
    public int port() {
        ServerSocket ss = serverSocket;
        if (ss == null) throw new IllegalStateException("not started");
        return ss.getLocalPort();
    }

    private void acceptLoop() {
        ServerSocket ss = serverSocket;
        while (!ss.isClosed()) {
            try {
                Socket client = ss.accept();
                pool.execute(() -> serve(client));
            } catch (SocketException se) {
                if (!ss.isClosed()) LOGGER.error("accept failed", se);
            } catch (IOException e) {
                LOGGER.error("accept failed", e);
            }
        }
    }

    /** Reads one request, routes it, writes the response, closes the connection. */
    void serve(Socket client) {
        try (client;
             InputStream in = new BufferedInputStream(client.getInputStream());
             OutputStream out = client.getOutputStream()) {
            client.setSoTimeout(READ_TIMEOUT_MS);

            MinimalHttpRequest req;
            try {
                req = HttpRequestReader.read(in, out);
            } catch (HttpRequestReader.MalformedRequestException e) {
                LOGGER.debug("bad request: {}", e.getMessage());
                HttpResponseWriter.writePlain(out, HttpStatus.BAD_REQUEST, e.getMessage());
                return;
            }
            if (req == null) {
                HttpResponseWriter.writePlain(out, HttpStatus.BAD_REQUEST, "empty request line");
                return;
            }

            HttpResponseImpl res = dispatch(req);
            HttpResponseWriter.write(out, res);
            LOGGER.debug("{} {} -> {}", req.method(), req.path(), res.status());
        } catch (SocketException se) {
            LOGGER.debug("client went away: {}", se.getMessage());
        } catch (IOException e) {
            LOGGER.warn("connection error: {}", e.getMessage());
        }
    }

    HttpResponseImpl dispatch(MinimalHttpRequest req) {
        HttpResponseImpl res = new HttpResponseImpl();
        IHttpHandler handler = factory.create(req);
        try {
            handler.handle(req, res);
        } catch (Exception e) {
            LOGGER.error("{} {} failed", req.method(), req.path(), e);
            res = new HttpResponseImpl();
            res.json(HttpStatus.INTERNAL_SERVER_ERROR, HttpStatus.reason(HttpStatus.INTERNAL_SERVER_ERROR),
                    "{\"detail\":\"Internal Server Error\"}");
        }
        return res;
    }

    @Override
    public synchronized void close() throws IOException, InterruptedException {
        ServerSocket ss = serverSocket;
        if (ss == null) return;
        ss.close();
        pool.shutdown();
        if (!pool.awaitTermination(5, TimeUnit.SECONDS)) pool.shutdownNow();
        acceptor.join(1_000);
        LOGGER.info("stopped");
    }
}
