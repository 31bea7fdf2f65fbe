package com.starscape.videoteca.features.updatevideo.api.dto;

/**
 * Partial metadata update. Absent fields are left unchanged.
 */
public record UpdateVideoRequest(
    String title,
    String description
) {}
