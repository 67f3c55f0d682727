package com.example.adaptivestream.infrastructure.http;

import com.example.adaptivestream.application.streaming.FetchCancellation;
import com.example.adaptivestream.application.streaming.FetchException;
import com.example.adaptivestream.application.streaming.SegmentTransport;
import com.example.adaptivestream.domain.model.ByteRange;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class MeteredSegmentTransportTest {

    private static final URI URI_ALPHA = URI.create("https://alpha.test/ipfs/QmVideo");

    @Test
    void shouldCountSuccessAndBytes() throws Exception {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        SegmentTransport transport = new MeteredSegmentTransport(
                (uri, range, cancellation) -> new byte[(int) range.length()], beanProvider(meterRegistry));

        transport.fetch(URI_ALPHA, new ByteRange(0L, 99L), new FetchCancellation());

        Assertions.assertEquals(1D, meterRegistry.counter("adaptive.fetch.outcome",
                "result", "success", "host", "alpha.test").count(), 0D);
        Assertions.assertEquals(100D, meterRegistry.counter("adaptive.fetch.bytes", "host", "alpha.test").count(), 0D);
        Assertions.assertEquals(1L, meterRegistry.timer("adaptive.fetch.latency", "host", "alpha.test").count());
    }

    @Test
    void shouldCountFailureKindAndRethrow() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        SegmentTransport transport = new MeteredSegmentTransport((uri, range, cancellation) -> {
            throw new FetchException(FetchException.Kind.FATAL, "gone", 404);
        }, beanProvider(meterRegistry));

        FetchException e = Assertions.assertThrows(FetchException.class,
                () -> transport.fetch(URI_ALPHA, new ByteRange(0L, 9L), new FetchCancellation()));

        Assertions.assertEquals(404, e.getStatusCode());
        Assertions.assertEquals(1D, meterRegistry.counter("adaptive.fetch.outcome",
                "result", "fatal", "host", "alpha.test").count(), 0D);
    }

    @Test
    void shouldReportCancelledFetchSeparately() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        FetchCancellation cancellation = new FetchCancellation();
        SegmentTransport transport = new MeteredSegmentTransport((uri, range, token) -> {
            token.cancel();
            throw new FetchException(FetchException.Kind.TRANSIENT, "fetch aborted", 0);
        }, beanProvider(meterRegistry));

        Assertions.assertThrows(FetchException.class,
                () -> transport.fetch(URI_ALPHA, new ByteRange(0L, 9L), cancellation));

        Assertions.assertEquals(1D, meterRegistry.counter("adaptive.fetch.outcome",
                "result", "cancelled", "host", "alpha.test").count(), 0D);
    }

    @Test
    void shouldWorkWithoutRegistry() throws Exception {
        SegmentTransport transport = new MeteredSegmentTransport(
                (uri, range, cancellation) -> new byte[1], new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class));

        Assertions.assertEquals(1, transport.fetch(URI_ALPHA, new ByteRange(0L, 0L), new FetchCancellation()).length);
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
