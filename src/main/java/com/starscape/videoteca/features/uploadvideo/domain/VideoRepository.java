package com.starscape.videoteca.features.uploadvideo.domain;

import java.util.List;
import java.util.Optional;

public interface VideoRepository {
    Video saveAndFlush(Video video);
    Optional<Video> findById(String videoId);
    Optional<Video> findByFileKey(String fileKey);
    List<Video> findAllByOrderByCreatedAtDesc();
    void delete(Video video);
}
