package com.example.adaptivestream.infrastructure.http;

import com.example.adaptivestream.application.streaming.FetchCancellation;
import com.example.adaptivestream.application.streaming.FetchException;
import com.example.adaptivestream.application.streaming.SegmentTransport;
import com.example.adaptivestream.domain.model.ByteRange;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Range GET over the shared pooled HttpClient. A cancelled fetch aborts the request, which
 * releases the connection immediately.
 */
public class HttpSegmentTransport implements SegmentTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpSegmentTransport.class);
    private static final int READ_BUFFER_SIZE = 16 * 1024;

    private final CloseableHttpClient httpClient;

    public HttpSegmentTransport(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public byte[] fetch(URI uri, ByteRange range, FetchCancellation cancellation) throws FetchException {
        HttpGet get = new HttpGet(uri);
        get.setHeader(HttpHeaders.RANGE, range.toHeaderValue());
        cancellation.onCancel(get::abort);
        try (CloseableHttpResponse response = httpClient.execute(get)) {
            int status = response.getStatusLine().getStatusCode();
            if (status == 206) {
                return readBody(response.getEntity(), range.length());
            }
            if (status == 200) {
                // Range ignored: the body starts at byte 0, usable only when that is what we asked for.
                if (range.getFirst() != 0L) {
                    throw new FetchException(FetchException.Kind.FATAL,
                            "provider ignored range " + range.toHeaderValue() + " for " + uri, status);
                }
                byte[] body = readBody(response.getEntity(), range.length());
                get.abort();
                return body;
            }
            log.debug("SEGMENT_HTTP_STATUS uri={} range={} status={}", uri, range.toHeaderValue(), status);
            throw FetchException.forStatus(status, uri.toString());
        } catch (IOException e) {
            if (cancellation.isCancelled()) {
                throw new FetchException(FetchException.Kind.TRANSIENT, "fetch aborted", 0, e);
            }
            throw FetchException.transientFailure("I/O error fetching " + uri + ": " + e.getMessage(), e);
        }
    }

    private byte[] readBody(HttpEntity entity, long limit) throws IOException {
        if (entity == null) {
            return new byte[0];
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(limit, 1024L * 1024L));
        try (InputStream in = entity.getContent()) {
            byte[] buffer = new byte[READ_BUFFER_SIZE];
            long remaining = limit;
            while (remaining > 0) {
                int read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
                if (read < 0) {
                    break;
                }
                out.write(buffer, 0, read);
                remaining -= read;
            }
        }
        return out.toByteArray();
    }
}
