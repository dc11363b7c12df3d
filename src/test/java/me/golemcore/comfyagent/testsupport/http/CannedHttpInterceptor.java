package me.golemcore.comfyagent.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Serves queued responses to an {@link OkHttpClient} without touching the
 * network, and records every request it sees.
 */
public final class CannedHttpInterceptor implements Interceptor {

    private final Deque<Object> replies = new ArrayDeque<>();
    private final List<Request> requests = new ArrayList<>();

    public static OkHttpClient clientWith(CannedHttpInterceptor interceptor) {
        return new OkHttpClient.Builder().addInterceptor(interceptor).build();
    }

    public synchronized void reply(int code, String body, String contentType) {
        replies.add(new Reply(code, body != null ? body : "", contentType));
    }

    public synchronized void fail(IOException failure) {
        replies.add(failure);
    }

    public synchronized List<Request> requests() {
        return List.copyOf(requests);
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        Object next;
        synchronized (this) {
            requests.add(request);
            next = replies.poll();
        }
        if (next == null) {
            throw new IOException("Nothing queued for " + request.method() + " " + request.url());
        }
        if (next instanceof IOException failure) {
            throw failure;
        }

        Reply reply = (Reply) next;
        MediaType mediaType = reply.contentType() != null ? MediaType.parse(reply.contentType()) : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("canned")
                .body(ResponseBody.create(reply.body().getBytes(StandardCharsets.UTF_8), mediaType))
                .build();
    }

    private record Reply(int code, String body, String contentType) {
    }
}
