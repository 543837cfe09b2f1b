package com.qqsuccubus.amqp.core.transport;

/**
 * Broker queue as seen by a consumer (Dependency Inversion Principle).
 * <p>
 * Implemented by the transport driver; the consumer engine only calls into it.
 * </p>
 */
public interface IQueue {

    String getName();

    IChannel getChannel();

    /**
     * Subscribes to the queue and blocks inside the receive loop.
     * <p>
     * Returns when the callback answers {@code false} or the subscription was cancelled.
     * Exceptions thrown by the callback propagate to the caller.
     * </p>
     *
     * @param callback    invoked once per delivery, in delivery order
     * @param consumerTag tag identifying this subscription
     * @throws TransportException if receiving fails
     */
    void consume(DeliveryCallback callback, String consumerTag) throws TransportException;

    /**
     * Acknowledges a delivery.
     *
     * @param deliveryTag delivery tag
     * @param multiple    also acknowledge every older unacknowledged delivery on the channel
     * @throws TransportException if the broker call fails
     */
    void ack(long deliveryTag, boolean multiple) throws TransportException;

    /**
     * Negatively acknowledges a delivery.
     *
     * @param deliveryTag delivery tag
     * @param multiple    also reject every older unacknowledged delivery on the channel
     * @param requeue     ask the broker to redeliver
     * @throws TransportException if the broker call fails
     */
    void nack(long deliveryTag, boolean multiple, boolean requeue) throws TransportException;

    /**
     * Cancels the subscription registered under the given consumer tag.
     *
     * @param consumerTag subscription tag
     */
    void cancel(String consumerTag);
}
