package com.example.adaptivestream.domain.model;

public enum ErrorKind {

    /** Content id rejected; no provider can help. */
    VALIDATION,

    FETCH_TRANSIENT,

    /** Content absent at one provider; others are still tried. */
    FETCH_FATAL,

    STALL_TIMEOUT,

    /** Every ranked provider failed within the retry budget. */
    PROVIDER_EXHAUSTED
}
