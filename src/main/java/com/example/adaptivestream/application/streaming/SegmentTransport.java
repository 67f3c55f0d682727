package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.domain.model.ByteRange;
import java.net.URI;

/**
 * Byte-range GET against a provider URL.
 */
public interface SegmentTransport {

    byte[] fetch(URI uri, ByteRange range, FetchCancellation cancellation) throws FetchException;
}
