package io.mcpcompat.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.mcpcompat.core.ErrorKind;
import io.mcpcompat.core.JsonRpcCodec;
import io.mcpcompat.server.core.ErrorEnvelope;
import io.mcpcompat.server.core.HttpMethod;
import io.mcpcompat.server.core.RequestRouter;
import io.mcpcompat.server.core.ResponseBody;
import io.mcpcompat.server.core.ServerRequest;
import io.mcpcompat.server.core.ServerResponse;
import io.mcpcompat.server.core.SseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;

/**
 * Bridges Javalin requests to the {@link RequestRouter}. SSE bodies are written straight to the servlet output
 * stream and hold the request thread until the stream completes or the client goes away.
 */
final class JavalinAdapter implements Handler {
    private static final Logger log = LoggerFactory.getLogger(JavalinAdapter.class);

    private final RequestRouter router;
    private final JsonRpcCodec codec;

    JavalinAdapter(RequestRouter router, JsonRpcCodec codec) {
        this.router = router;
        this.codec = codec;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        try {
            write(ctx, router.handle(toRequest(ctx)));
        } catch (Exception e) {
            if (ctx.res().isCommitted()) {
                // nothing can be reported to the client once the status line went out
                log.warn("Failure after response was committed for {} {}", ctx.method(), ctx.path(), e);
                return;
            }
            log.error("Error handling {} {}", ctx.method(), ctx.path(), e);
            write(ctx, ErrorEnvelope.of(ErrorKind.INTERNAL_ERROR, codec));
        }
    }

    private static ServerRequest toRequest(Context ctx) {
        return new ServerRequest(
                HttpMethod.valueOf(ctx.method().name()),
                URI.create(ctx.fullUrl()),
                toHeaders(ctx),
                ctx.bodyAsBytes());
    }

    private static Map<String, List<String>> toHeaders(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ctx.headerMap().entrySet()) {
            headers.put(e.getKey(), List.of(e.getValue()));
        }
        return headers;
    }

    private static void write(Context ctx, ServerResponse response) throws IOException {
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.header(e.getKey(), v);
            }
        }

        if (response.body() instanceof ResponseBody.Bytes bytes) {
            ctx.result(bytes.bytes());
        } else if (response.body() instanceof ResponseBody.Sse sse) {
            writeSse(ctx, sse.publisher());
        }
    }

    private static void writeSse(Context ctx, Flow.Publisher<SseFrame> publisher) throws IOException {
        OutputStream out = ctx.res().getOutputStream();
        ctx.res().flushBuffer();
        CountDownLatch done = new CountDownLatch(1);

        publisher.subscribe(new Flow.Subscriber<>() {
            private Flow.Subscription subscription;

            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                this.subscription = subscription;
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(SseFrame item) {
                try {
                    out.write(item.render().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    log.debug("SSE client went away: {}", e.getMessage());
                    subscription.cancel();
                    done.countDown();
                }
            }

            @Override
            public void onError(Throwable throwable) {
                log.debug("SSE stream failed", throwable);
                done.countDown();
            }

            @Override
            public void onComplete() {
                done.countDown();
            }
        });

        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
