package com.qqsuccubus.amqp.jsonrpc;

import com.qqsuccubus.amqp.core.msg.ControlMessages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.qqsuccubus.amqp.jsonrpc.Requests.request;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the server over the consumer engine and an in-memory queue.
 */
class JsonRpcServerTest {

    private JsonRpcServer server(StubQueue queue, JsonRpcHandler handler) {
        return JsonRpcServer.builder()
            .queue(queue)
            .handler(handler)
            .appId("rpc-test-app")
            .idleTimeout(5)
            .consumerTag("rpc-server-test")
            .meterRegistry(new SimpleMeterRegistry())
            .build();
    }

    @Test
    void testEveryDelivery_OneAckOneReplyNoNack() throws Exception {
        StubQueue queue = new StubQueue()
            .deliver(request(1, "req-1", "sum", "[1,2]").build())
            .deliver(request(2, "req-2", "sum", "not json").build())
            .deliver(request(3, null, "sum", "[1,2]").build())
            .deliver(request(4, "req-4", "fail", "[]").build())
            .deliver(request(5, "req-5", "sum", "[3,4]").contentType("text/plain").build());

        server(queue, request -> {
            if ("fail".equals(request.getMethod())) {
                throw new IllegalStateException("boom");
            }
            return request.getParams().get(0).intValue() + request.getParams().get(1).intValue();
        }).consume(0);

        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), queue.acks);
        assertTrue(queue.nacks.isEmpty());

        List<RecordingExchange.Reply> replies = queue.exchange.replies;
        assertEquals(5, replies.size());
        assertEquals(3, replies.get(0).json().get("result").intValue());
        assertEquals(JsonRpcError.PARSE_ERROR, replies.get(1).errorCode());
        assertEquals(JsonRpcError.INVALID_REQUEST, replies.get(2).errorCode());
        assertEquals(JsonRpcError.INTERNAL_ERROR, replies.get(3).errorCode());
        assertEquals(JsonRpcError.INVALID_REQUEST, replies.get(4).errorCode());
    }

    @Test
    void testHandlerError_InternalErrorAndKeepsServing() throws Exception {
        StubQueue queue = new StubQueue()
            .deliver(request(1, "req-1", "boom", "[]").build())
            .deliver(request(2, "req-2", "ping", "[]").build());

        server(queue, request -> {
            if ("boom".equals(request.getMethod())) {
                throw new AssertionError("bad state");
            }
            return JsonRpcServerApp.builtinMethods(request);
        }).consume(0);

        assertEquals(List.of(1L, 2L), queue.acks);
        assertTrue(queue.nacks.isEmpty());
        assertEquals(2, queue.exchange.replies.size());
        assertEquals(JsonRpcError.INTERNAL_ERROR, queue.exchange.replies.get(0).errorCode());
        assertEquals("req-1", queue.exchange.replies.get(0).attributes().getCorrelationId());
        assertEquals("pong", queue.exchange.replies.get(1).json().get("result").textValue());
    }

    @Test
    void testShutdownMessage_RepliesAndStops() throws Exception {
        StubQueue queue = new StubQueue()
            .deliver(request(1, "req-1", "ping", "[]").build())
            .deliver(ControlMessages.shutdown().toBuilder()
                .deliveryTag(2).correlationId("ops-1").replyTo(Requests.REPLY_TO).build())
            .deliver(request(3, "req-3", "ping", "[]").build());

        JsonRpcServer server = server(queue, JsonRpcServerApp::builtinMethods);
        server.consume(0);

        assertFalse(server.isKeepAlive());
        assertEquals(List.of("rpc-server-test"), queue.cancels);
        assertEquals(List.of(1L, 2L), queue.acks);
        assertEquals(2, queue.exchange.replies.size());
        assertEquals("pong", queue.exchange.replies.get(0).json().get("result").textValue());
        assertEquals("OK", queue.exchange.replies.get(1).json().get("result").textValue());
    }

    @Test
    void testReconfigureMessage_AppliesPrefetch() throws Exception {
        ControlMessages.Reconfigure settings = ControlMessages.Reconfigure.builder()
            .idleTimeout(1.5)
            .target(0)
            .prefetchSize(0)
            .prefetchCount(25)
            .build();
        StubQueue queue = new StubQueue()
            .deliver(ControlMessages.reconfigure(settings).toBuilder().deliveryTag(1).replyTo(Requests.REPLY_TO).build());

        server(queue, JsonRpcServerApp::builtinMethods).consume(0);

        assertEquals(25, queue.prefetchCount);
        assertEquals("OK", queue.exchange.only().json().get("result").textValue());
    }

    @Test
    void testTarget_StopsAfterCount() throws Exception {
        StubQueue queue = new StubQueue()
            .deliver(request(1, "req-1", "ping", "[]").build())
            .deliver(request(2, "req-2", "ping", "[]").build())
            .deliver(request(3, "req-3", "ping", "[]").build());

        server(queue, JsonRpcServerApp::builtinMethods).consume(2);

        assertEquals(2, queue.exchange.replies.size());
        assertEquals(List.of("rpc-server-test"), queue.cancels);
    }

    @Test
    void testBuiltinMethods() throws Exception {
        StubQueue queue = new StubQueue()
            .deliver(request(1, "req-1", "echo", "{\"x\":[1,2]}").build())
            .deliver(request(2, "req-2", "launch", "{}").build());

        server(queue, JsonRpcServerApp::builtinMethods).consume(0);

        assertEquals(2, queue.exchange.replies.get(0).json().get("result").get("x").size());
        assertEquals(JsonRpcError.METHOD_NOT_FOUND, queue.exchange.replies.get(1).errorCode());
    }
}
