package api.interfaces;

/*
AutoCloseable so tests and the shutdown hook can stop the server with try-with-resources
 */
public interface IHttpServer extends AutoCloseable {
    /** Bind and start accepting. Port 0 picks a free port, see {@link #port()}. */
    void start(int port) throws Exception;

    /** @return the bound port once started. */
    int port();

    @Override void close() throws Exception;
}
