package com.example.adaptivestream.domain.model;

public enum ChunkStatus {
    PENDING,
    LOADED,
    FAILED,
    ABORTED
}
