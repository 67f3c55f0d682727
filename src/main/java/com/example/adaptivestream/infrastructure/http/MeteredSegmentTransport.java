package com.example.adaptivestream.infrastructure.http;

import com.example.adaptivestream.application.streaming.FetchCancellation;
import com.example.adaptivestream.application.streaming.FetchException;
import com.example.adaptivestream.application.streaming.SegmentTransport;
import com.example.adaptivestream.domain.model.ByteRange;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Counts fetch outcomes and fetched bytes, and times each fetch, around another transport.
 */
public class MeteredSegmentTransport implements SegmentTransport {

    private static final Logger log = LoggerFactory.getLogger(MeteredSegmentTransport.class);

    private final SegmentTransport delegate;
    private final MeterRegistry meterRegistry;

    public MeteredSegmentTransport(SegmentTransport delegate, ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    @Override
    public byte[] fetch(URI uri, ByteRange range, FetchCancellation cancellation) throws FetchException {
        long startedAtNanos = System.nanoTime();
        String host = uri.getHost() == null ? "unknown" : uri.getHost();
        try {
            byte[] body = delegate.fetch(uri, range, cancellation);
            recordCounter("adaptive.fetch.outcome", 1D, "result", "success", "host", host);
            recordCounter("adaptive.fetch.bytes", body.length, "host", host);
            return body;
        } catch (FetchException e) {
            String result = cancellation.isCancelled() ? "cancelled" : e.getKind().name().toLowerCase(Locale.ROOT);
            recordCounter("adaptive.fetch.outcome", 1D, "result", result, "host", host);
            throw e;
        } finally {
            recordDuration("adaptive.fetch.latency", System.nanoTime() - startedAtNanos, host);
        }
    }

    private void recordCounter(String name, double amount, String... tags) {
        if (meterRegistry == null || amount <= 0D) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(amount);
        } catch (Exception ex) {
            log.debug("Fetch metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(String name, long nanos, String host) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, "host", host).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Fetch metric timer failed, name={}", name, ex);
        }
    }
}
