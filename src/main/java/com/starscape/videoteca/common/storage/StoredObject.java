package com.starscape.videoteca.common.storage;

public record StoredObject(
    String bucket,
    String key,
    String etag,
    long contentLength
) {}
