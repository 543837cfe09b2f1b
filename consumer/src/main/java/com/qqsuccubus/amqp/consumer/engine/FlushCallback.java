package com.qqsuccubus.amqp.consumer.engine;

import com.qqsuccubus.amqp.core.consumer.FlushResult;
import com.qqsuccubus.amqp.core.transport.IQueue;

/**
 * Invoked before a block of deferred deliveries is settled; decides how the whole block is settled.
 */
@FunctionalInterface
public interface FlushCallback {
    /**
     * @param queue queue the block was consumed from
     * @return block disposition, never null
     * @throws Exception any failure; routed to the consumer's error policy
     */
    FlushResult flush(IQueue queue) throws Exception;
}
