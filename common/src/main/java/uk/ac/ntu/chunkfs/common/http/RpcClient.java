package uk.ac.ntu.chunkfs.common.http;

import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static java.net.http.HttpRequest.BodyPublishers;
import static java.net.http.HttpResponse.BodyHandlers;

/**
 * Blocking HTTP calls that report every failure as {@link FsException}: error replies keep
 * their code, transport problems become {@code UNREACHABLE}.
 */
public final class RpcClient {
    private final HttpClient client;
    private final Duration timeout;

    public RpcClient(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(3))
                .build();
    }

    public RpcClient() {
        this(Duration.ofSeconds(30));
    }

    public String get(String url) throws FsException {
        return text(send(request(url).GET().build(), url));
    }

    public String post(String url) throws FsException {
        return text(send(request(url).POST(BodyPublishers.noBody()).build(), url));
    }

    public String post(String url, byte[] body) throws FsException {
        return text(send(request(url).POST(BodyPublishers.ofByteArray(body)).build(), url));
    }

    public String put(String url) throws FsException {
        return text(send(request(url).PUT(BodyPublishers.noBody()).build(), url));
    }

    public byte[] getBytes(String url) throws FsException {
        return send(request(url).GET().build(), url);
    }

    private HttpRequest.Builder request(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout);
    }

    private byte[] send(HttpRequest req, String url) throws FsException {
        HttpResponse<byte[]> resp;
        try {
            resp = client.send(req, BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new FsException(ErrorCode.UNREACHABLE, "call failed " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FsException(ErrorCode.UNREACHABLE, "interrupted calling " + url, e);
        }
        byte[] body = resp.body() == null ? new byte[0] : resp.body();
        if (resp.statusCode() != 200) {
            throw Wire.parseError(resp.statusCode(), new String(body, StandardCharsets.UTF_8));
        }
        return body;
    }

    private static String text(byte[] body) {
        return new String(body, StandardCharsets.UTF_8);
    }
}
