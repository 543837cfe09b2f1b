package com.qqsuccubus.amqp.consumer.engine;

import com.qqsuccubus.amqp.consumer.engine.StubQueue.Settlement;
import com.qqsuccubus.amqp.core.consumer.DeliveryResult;
import com.qqsuccubus.amqp.core.consumer.FlushResult;
import com.qqsuccubus.amqp.core.metrics.MetricsNames;
import com.qqsuccubus.amqp.core.metrics.MetricsTags;
import com.qqsuccubus.amqp.core.msg.ControlMessages;
import com.qqsuccubus.amqp.core.msg.Envelope;
import com.qqsuccubus.amqp.core.transport.TransportException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Engine tests against an in-memory queue (no broker, no Mockito).
 */
class BatchingConsumerTest {

    private static final String TAG = "test-consumer";

    private MutableClock clock;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new SimpleMeterRegistry();
    }

    private BatchingConsumer.BatchingConsumerBuilder builder(StubQueue queue, DeliveryHandler handler) {
        return BatchingConsumer.builder()
            .queue(queue)
            .strategy(new CallbackDeliveryStrategy(handler))
            .idleTimeout(60)
            .consumerTag(TAG)
            .clock(clock)
            .meterRegistry(registry);
    }

    // ========== Batching ==========

    @Test
    void testDeferredBlock_AckedOnceWhenFull() throws Exception {
        StubQueue queue = new StubQueue(3);
        for (long tag = 1; tag <= 4; tag++) {
            queue.deliver(StubQueue.message(tag));
        }
        List<Integer> acksSeen = new ArrayList<>();

        builder(queue, (envelope, q) -> {
            acksSeen.add(queue.acks.size());
            return DeliveryResult.DEFER;
        }).build().consume(0);

        // Nothing settled before the block of 3 was complete
        assertEquals(List.of(0, 0, 0, 1), acksSeen);
        // Full block, then the remainder once the loop ended
        assertEquals(List.of(new Settlement(3, true, false), new Settlement(4, true, false)), queue.acks);
        assertTrue(queue.nacks.isEmpty());

        double acked = registry.get(MetricsNames.CONSUMER_SETTLED_TOTAL)
            .tag(MetricsTags.OUTCOME, "ack")
            .counter()
            .count();
        assertEquals(4.0, acked);
    }

    @Test
    void testIdleTimeout_FlushesPartialBlock() throws Exception {
        StubQueue queue = new StubQueue(10);
        queue.deliver(StubQueue.message(1)).deliver(StubQueue.message(2)).deliver(StubQueue.message(3));

        builder(queue, (envelope, q) -> {
            if (envelope.getDeliveryTag() == 2) {
                clock.advanceMillis(1500);
            }
            return DeliveryResult.DEFER;
        }).idleTimeout(1.0).build().consume(0);

        assertEquals(List.of(new Settlement(2, true, false), new Settlement(3, true, false)), queue.acks);
    }

    @Test
    void testAckResult_SettlesImmediately() throws Exception {
        StubQueue queue = new StubQueue(10);
        queue.deliver(StubQueue.message(1)).deliver(StubQueue.message(2));

        builder(queue, (envelope, q) -> envelope.getDeliveryTag() == 1 ? DeliveryResult.DEFER : DeliveryResult.ACK)
            .build()
            .consume(0);

        assertEquals(List.of(new Settlement(2, true, false)), queue.acks);
    }

    // ========== Errors ==========

    @Test
    void testHandlerException_NoErrorCallback_Requeues() throws Exception {
        StubQueue queue = new StubQueue(3);
        queue.deliver(StubQueue.message(1));

        BatchingConsumer consumer = builder(queue, (envelope, q) -> {
            throw new IllegalStateException("boom");
        }).build();
        consumer.consume(0);

        assertEquals(List.of(new Settlement(1, false, true)), queue.nacks);
        assertTrue(queue.acks.isEmpty());
        assertEquals(1, consumer.getCountMessagesConsumed());
    }

    @Test
    void testHandlerException_ErrorCallbackFalse_Rejects() throws Exception {
        StubQueue queue = new StubQueue(3);
        queue.deliver(StubQueue.message(1));
        List<Exception> seen = new ArrayList<>();

        builder(queue, (envelope, q) -> {
            throw new IllegalStateException("boom");
        }).errorCallback((error, consumer) -> {
            seen.add(error);
            return false;
        }).build().consume(0);

        assertEquals(List.of(new Settlement(1, false, false)), queue.nacks);
        assertEquals(1, seen.size());
        assertEquals("boom", seen.get(0).getMessage());
    }

    @Test
    void testHandlerException_ErrorCallbackNull_Requeues() throws Exception {
        StubQueue queue = new StubQueue(3);
        queue.deliver(StubQueue.message(1));

        builder(queue, (envelope, q) -> {
            throw new IllegalStateException("boom");
        }).errorCallback((error, consumer) -> null).build().consume(0);

        assertEquals(List.of(new Settlement(1, false, true)), queue.nacks);
    }

    @Test
    void testErrorCallbackFailure_Propagates() {
        StubQueue queue = new StubQueue(3);
        queue.deliver(StubQueue.message(1));

        BatchingConsumer consumer = builder(queue, (envelope, q) -> {
            throw new IllegalStateException("boom");
        }).errorCallback((error, c) -> {
            throw new IllegalArgumentException("policy broken");
        }).build();

        ErrorPolicyException e = assertThrows(ErrorPolicyException.class, () -> consumer.consume(0));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertTrue(queue.nacks.isEmpty());
    }

    @Test
    void testFlushCallbackException_UsesErrorPolicy() throws Exception {
        StubQueue queue = new StubQueue(2);
        queue.deliver(StubQueue.message(1)).deliver(StubQueue.message(2));

        builder(queue, (envelope, q) -> DeliveryResult.DEFER)
            .flushCallback(q -> {
                throw new IllegalStateException("flush failed");
            })
            .errorCallback((error, consumer) -> false)
            .build()
            .consume(0);

        assertEquals(List.of(new Settlement(2, true, false)), queue.nacks);
        assertTrue(queue.acks.isEmpty());
    }

    @Test
    void testFlushCallbackRequeue_NacksWholeBlock() throws Exception {
        StubQueue queue = new StubQueue(2);
        queue.deliver(StubQueue.message(1)).deliver(StubQueue.message(2));

        builder(queue, (envelope, q) -> DeliveryResult.DEFER)
            .flushCallback(q -> FlushResult.REJECT_REQUEUE)
            .build()
            .consume(0);

        assertEquals(List.of(new Settlement(2, true, true)), queue.nacks);
    }

    @Test
    void testFlushCallbackNull_Fails() {
        StubQueue queue = new StubQueue(1);
        queue.deliver(StubQueue.message(1));

        BatchingConsumer consumer = builder(queue, (envelope, q) -> DeliveryResult.DEFER)
            .flushCallback(q -> null)
            .build();

        assertThrows(IllegalStateException.class, () -> consumer.consume(0));
    }

    @Test
    void testTransportFailure_FlushesClosesAndRethrows() {
        StubQueue queue = new StubQueue(10);
        queue.deliver(StubQueue.message(1));
        queue.failAfter = 1;

        BatchingConsumer consumer = builder(queue, (envelope, q) -> DeliveryResult.DEFER).build();

        assertThrows(TransportException.class, () -> consumer.consume(0));
        assertEquals(List.of(new Settlement(1, true, false)), queue.acks);
        assertTrue(queue.channel.closed);
    }

    // ========== Termination ==========

    @Test
    void testTarget_StopsAndCancels() throws Exception {
        StubQueue queue = new StubQueue(10);
        queue.deliver(StubQueue.message(1)).deliver(StubQueue.message(2)).deliver(StubQueue.message(3));
        List<Long> handled = new ArrayList<>();

        BatchingConsumer consumer = builder(queue, (envelope, q) -> {
            handled.add(envelope.getDeliveryTag());
            return DeliveryResult.ACK;
        }).build();
        consumer.consume(2);

        assertEquals(List.of(1L, 2L), handled);
        assertEquals(List.of(new Settlement(1, true, false), new Settlement(2, true, false)), queue.acks);
        assertEquals(List.of(TAG), queue.cancels);
        assertFalse(consumer.isKeepAlive());
    }

    @Test
    void testRejects_CountTowardTargetButNotBlock() throws Exception {
        StubQueue queue = new StubQueue(2);
        queue.deliver(StubQueue.message(1)).deliver(StubQueue.message(2)).deliver(StubQueue.message(3));

        BatchingConsumer consumer = builder(queue, (envelope, q) ->
            envelope.getDeliveryTag() == 1 ? DeliveryResult.REJECT : DeliveryResult.DEFER
        ).build();
        consumer.consume(3);

        assertEquals(List.of(new Settlement(1, false, false)), queue.nacks);
        assertEquals(List.of(new Settlement(3, true, false)), queue.acks);
        assertEquals(3, consumer.getCountMessagesConsumed());
        assertEquals(List.of(TAG), queue.cancels);
    }

    @Test
    void testShutdown_CancelsOnce() {
        StubQueue queue = new StubQueue(3);
        BatchingConsumer consumer = builder(queue, (envelope, q) -> DeliveryResult.ACK).build();

        consumer.shutdown();
        consumer.shutdown();

        assertFalse(consumer.isKeepAlive());
        assertEquals(List.of(TAG), queue.cancels);
    }

    @Test
    void testNegativeTarget_Rejected() {
        StubQueue queue = new StubQueue(3);
        BatchingConsumer consumer = builder(queue, (envelope, q) -> DeliveryResult.ACK).build();

        assertThrows(IllegalArgumentException.class, () -> consumer.consume(-1));
    }

    // ========== Control plane ==========

    @Test
    void testShutdownMessage_FlushesAndStops() throws Exception {
        StubQueue queue = new StubQueue(10);
        queue.deliver(StubQueue.message(1))
            .deliver(ControlMessages.shutdown().toBuilder().deliveryTag(2).build())
            .deliver(StubQueue.message(3));
        List<Long> handled = new ArrayList<>();

        BatchingConsumer consumer = builder(queue, (envelope, q) -> {
            handled.add(envelope.getDeliveryTag());
            return DeliveryResult.DEFER;
        }).build();
        consumer.consume(0);

        assertEquals(List.of(1L), handled);
        assertEquals(List.of(new Settlement(2, true, false)), queue.acks);
        assertEquals(List.of(TAG), queue.cancels);
        assertFalse(consumer.isKeepAlive());
    }

    @Test
    void testReconfigureMessage_AppliesSettings() throws Exception {
        StubQueue queue = new StubQueue(3);
        ControlMessages.Reconfigure settings = ControlMessages.Reconfigure.builder()
            .idleTimeout(5.0)
            .target(10)
            .prefetchSize(0)
            .prefetchCount(20)
            .build();
        queue.deliver(ControlMessages.reconfigure(settings).toBuilder().deliveryTag(1).build());

        BatchingConsumer consumer = builder(queue, (envelope, q) -> DeliveryResult.ACK).build();
        consumer.consume(0);

        assertEquals(1, queue.channel.qosCalls.size());
        assertArrayEquals(new int[]{0, 20}, queue.channel.qosCalls.get(0));
        assertEquals(5.0, consumer.getIdleTimeout());
        assertEquals(10, consumer.getTarget());
        assertEquals(20, consumer.getBlockSize());
        assertEquals(List.of(new Settlement(1, true, false)), queue.acks);
    }

    @Test
    void testReconfigureMessage_NegativeTarget_RejectedAndStateKept() throws Exception {
        StubQueue queue = new StubQueue(3);
        queue.deliver(internal(1, ControlMessages.RECONFIGURE, "[5.0,-1,0,20]"));

        BatchingConsumer consumer = builder(queue, (envelope, q) -> DeliveryResult.ACK).build();
        consumer.consume(0);

        assertEquals(List.of(new Settlement(1, false, false)), queue.nacks);
        assertTrue(queue.channel.qosCalls.isEmpty());
        assertEquals(60.0, consumer.getIdleTimeout());
        assertEquals(0, consumer.getTarget());
        assertEquals(3, consumer.getBlockSize());
    }

    @Test
    void testUnknownControlMessage_Rejected() throws Exception {
        StubQueue queue = new StubQueue(3);
        queue.deliver(internal(1, "restart", ""));
        List<Long> handled = new ArrayList<>();

        BatchingConsumer consumer = builder(queue, (envelope, q) -> {
            handled.add(envelope.getDeliveryTag());
            return DeliveryResult.ACK;
        }).build();
        consumer.consume(0);

        assertTrue(handled.isEmpty());
        assertEquals(List.of(new Settlement(1, false, false)), queue.nacks);
        assertTrue(consumer.isKeepAlive());
    }

    @Test
    void testControlMetrics_UnknownTypesShareOneMeter() throws Exception {
        StubQueue queue = new StubQueue(3);
        for (long tag = 1; tag <= 5; tag++) {
            queue.deliver(internal(tag, "junk-" + tag, ""));
        }
        queue.deliver(ControlMessages.shutdown().toBuilder().deliveryTag(6).build());

        builder(queue, (envelope, q) -> DeliveryResult.ACK).build().consume(0);

        assertEquals(3, registry.find(MetricsNames.CONSUMER_CONTROL_TOTAL).counters().size());
        assertEquals(5.0, registry.get(MetricsNames.CONSUMER_CONTROL_TOTAL)
            .tag(MetricsTags.TYPE, "invalid").counter().count());
        assertEquals(1.0, registry.get(MetricsNames.CONSUMER_CONTROL_TOTAL)
            .tag(MetricsTags.TYPE, ControlMessages.SHUTDOWN).counter().count());
    }

    // ========== Immediate mode ==========

    @Test
    void testImmediateMode_AcksBeforeHandlingAndNeverNacks() throws Exception {
        StubQueue queue = new StubQueue(10);
        queue.deliver(StubQueue.message(1)).deliver(StubQueue.message(2));
        List<Integer> acksSeen = new ArrayList<>();

        DeliveryStrategy strategy = new DeliveryStrategy() {
            @Override
            public DeliveryResult handleDelivery(Envelope envelope, ConsumerContext context) {
                acksSeen.add(queue.acks.size());
                throw new IllegalStateException("handler failed after ack");
            }

            @Override
            public AckMode ackMode() {
                return AckMode.IMMEDIATE;
            }
        };

        BatchingConsumer consumer = BatchingConsumer.builder()
            .queue(queue)
            .strategy(strategy)
            .idleTimeout(60)
            .consumerTag(TAG)
            .clock(clock)
            .meterRegistry(registry)
            .build();
        consumer.consume(0);

        assertEquals(List.of(1, 2), acksSeen);
        assertEquals(List.of(new Settlement(1, true, false), new Settlement(2, true, false)), queue.acks);
        assertTrue(queue.nacks.isEmpty());
        assertEquals(2, consumer.getCountMessagesConsumed());
    }

    private static Envelope internal(long deliveryTag, String type, String body) {
        return Envelope.builder()
            .deliveryTag(deliveryTag)
            .appId(ControlMessages.INTERNAL_APP_ID)
            .type(type)
            .body(body.getBytes(StandardCharsets.UTF_8))
            .build();
    }
}
