package me.golemcore.desk.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory OkHttp interceptor for adapter tests. Never touches the network:
 * tests queue canned replies or failures and inspect the captured requests.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final Deque<Reply> replies = new ConcurrentLinkedDeque<>();
    private final Deque<CapturedRequest> captured = new ConcurrentLinkedDeque<>();

    /**
     * Client routed through this engine.
     */
    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public void enqueueJson(int code, String body) {
        enqueueText(code, body, "application/json");
    }

    public void enqueueText(int code, String body, String contentType) {
        replies.add(new Reply(code, body != null ? body : "", contentType, null));
    }

    public void enqueueFailure(IOException failure) {
        replies.add(new Reply(0, "", null, failure));
    }

    public CapturedRequest takeRequest() {
        return captured.pollFirst();
    }

    public int getRequestCount() {
        return captured.size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request.method(), request.url().encodedPath(),
                request.header("Authorization"), readBody(request.body())));

        Reply reply = replies.pollFirst();
        if (reply == null) {
            throw new IOException("No canned reply for " + request.method() + " " + request.url());
        }
        if (reply.failure() != null) {
            throw reply.failure();
        }

        MediaType mediaType = reply.contentType() != null ? MediaType.parse(reply.contentType()) : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("mock")
                .body(ResponseBody.create(reply.body(), mediaType))
                .build();
    }

    private static String readBody(RequestBody body) throws IOException {
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Reply(int code, String body, String contentType, IOException failure) {
    }

    public record CapturedRequest(String method, String path, String authorization, String body) {
    }
}
