package com.firehose.infrastructure.system;

/**
 * Source of the process memory figure used for backpressure decisions.
 */
@FunctionalInterface
public interface MemoryProbe {
    
    long residentMegabytes();
}
