package com.starscape.videoteca.features.uploadvideo.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VideoTest {

    private Video newVideo() {
        return new Video("vid_1", "IV Insertion", "", "videos/a.mp4", "procedure1.mp4", 2048, "video/mp4", "etag");
    }

    @Test
    void newVideoHasEqualCreatedAndUpdatedTimestamps() {
        Video video = newVideo();

        assertThat(video.getUpdatedAt()).isEqualTo(video.getCreatedAt());
    }

    @Test
    void nullArgumentsLeaveMetadataUnchanged() {
        Video video = newVideo();
        Instant updatedAt = video.getUpdatedAt();

        assertThat(video.updateMetadata(null, null)).isFalse();
        assertThat(video.getTitle()).isEqualTo("IV Insertion");
        assertThat(video.getUpdatedAt()).isEqualTo(updatedAt);
    }

    @Test
    void changedDescriptionIsApplied() {
        Video video = newVideo();

        assertThat(video.updateMetadata(null, "Step by step")).isTrue();
        assertThat(video.getDescription()).isEqualTo("Step by step");
        assertThat(video.getUpdatedAt()).isAfterOrEqualTo(video.getCreatedAt());
    }

    @Test
    void blankTitleIsRefused() {
        Video video = newVideo();

        assertThatThrownBy(() -> video.updateMetadata(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonPositiveSizeIsRefused() {
        assertThatThrownBy(() -> new Video("vid_1", "T", null, "k", "f.mp4", 0, "video/mp4", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
