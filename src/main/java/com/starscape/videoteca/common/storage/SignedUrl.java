package com.starscape.videoteca.common.storage;

import java.time.Instant;

public record SignedUrl(
    String url,
    Instant expiresAt
) {}
