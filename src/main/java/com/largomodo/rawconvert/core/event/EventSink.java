package com.largomodo.rawconvert.core.event;

/**
 * Publish side of the event stream.
 * <p>
 * Implementations must accept calls from any number of threads concurrently and must not
 * block the caller on consumer readiness.
 */
@FunctionalInterface
public interface EventSink {

    void publish(ConversionEvent event);
}
