package com.example.adaptivestream.common.util;

public class SystemClock implements Clock {

    @Override
    public long nowMs() {
        return System.currentTimeMillis();
    }
}
