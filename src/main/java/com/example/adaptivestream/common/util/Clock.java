package com.example.adaptivestream.common.util;

/**
 * Millisecond time source. Engine components never read the system clock directly.
 */
public interface Clock {

    Clock SYSTEM = new SystemClock();

    long nowMs();
}
