package me.ele.jarch.combiner;

/**
 * This class defines the *Service Provider Interface (SPI)* for the destinations a response
 * combiner writes to: the reply stream of the original client, or a local COPY destination.
 * All the abstract methods in this class must be implemented by each provider.
 * <p>
 * A sink is owned by whoever created it. Combiners only write to a sink while it is attached
 * and never open or close it.
 */
public abstract class ResponseSink {
    /**
     * Write bytes to the destination. The bytes are either a complete protocol packet (client
     * stream) or a raw COPY row (copy destination); the sink must not reframe them.
     *
     * @param bytes bytes to write, never null.
     */
    public abstract void write(final byte[] bytes);

    /**
     * Push buffered bytes to the destination.
     * Default implementation does nothing, for sinks that write through.
     */
    public void flush() {
    }
}
