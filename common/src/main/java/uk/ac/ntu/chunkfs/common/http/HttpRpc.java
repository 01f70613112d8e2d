package uk.ac.ntu.chunkfs.common.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.chunkfs.common.error.FsException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

public final class HttpRpc {
    private static final Logger log = LoggerFactory.getLogger(HttpRpc.class);

    private HttpRpc() {}

    @FunctionalInterface
    public interface Endpoint {
        void handle(HttpExchange ex) throws FsException, IOException;
    }

    /**
     * Adapts an endpoint: typed failures become {@code ERR} replies with the code's status,
     * bad parameters become 400.
     */
    public static HttpHandler endpoint(Endpoint e) {
        return ex -> {
            try {
                e.handle(ex);
            } catch (FsException fe) {
                reply(ex, fe.code().httpStatus(), Wire.error(fe));
            } catch (IllegalArgumentException bad) {
                reply(ex, 400, "BAD_REQUEST " + bad.getMessage());
            } catch (RuntimeException re) {
                log.warn("Endpoint {} failed", ex.getRequestURI().getPath(), re);
                reply(ex, 500, "INTERNAL_ERROR " + re.getMessage());
            } finally {
                ex.close();
            }
        };
    }

    public static boolean method(HttpExchange ex, String expected) throws IOException {
        if (expected.equalsIgnoreCase(ex.getRequestMethod())) return true;
        reply(ex, 405, "METHOD_NOT_ALLOWED");
        return false;
    }

    public static String param(HttpExchange ex, String key) {
        String v = Wire.queryParam(ex.getRequestURI().getRawQuery(), key);
        if (v == null) throw new IllegalArgumentException("MISSING " + key);
        return v;
    }

    public static String optParam(HttpExchange ex, String key) {
        return Wire.queryParam(ex.getRequestURI().getRawQuery(), key);
    }

    public static long longParam(HttpExchange ex, String key) {
        String v = param(ex, key);
        try { return Long.parseLong(v.trim()); }
        catch (NumberFormatException e) { throw new IllegalArgumentException("BAD " + key + "=" + v); }
    }

    public static void reply(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    public static void replyBytes(HttpExchange ex, byte[] data) throws IOException {
        ex.getResponseHeaders().set("Content-Type", "application/octet-stream");
        // -1 tells HttpServer there is no body at all
        ex.sendResponseHeaders(200, data.length == 0 ? -1 : data.length);
        if (data.length == 0) return;
        try (OutputStream os = ex.getResponseBody()) {
            os.write(data);
        }
    }
}
