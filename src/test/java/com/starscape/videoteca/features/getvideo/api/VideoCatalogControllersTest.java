package com.starscape.videoteca.features.getvideo.api;

import com.starscape.videoteca.common.exception.NotFoundException;
import com.starscape.videoteca.common.storage.SignedUrl;
import com.starscape.videoteca.features.deletevideo.api.DeleteVideoController;
import com.starscape.videoteca.features.deletevideo.app.DeleteVideoHandler;
import com.starscape.videoteca.features.getvideo.app.GetVideoHandler;
import com.starscape.videoteca.features.getvideo.app.IssueSignedUrlHandler;
import com.starscape.videoteca.features.listvideos.api.VideoListController;
import com.starscape.videoteca.features.listvideos.app.ListVideosHandler;
import com.starscape.videoteca.features.updatevideo.api.UpdateVideoController;
import com.starscape.videoteca.features.updatevideo.api.dto.UpdateVideoRequest;
import com.starscape.videoteca.features.updatevideo.app.UpdateVideoHandler;
import com.starscape.videoteca.features.uploadvideo.api.dto.VideoResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({
        VideoQueryController.class,
        SignedUrlController.class,
        VideoListController.class,
        UpdateVideoController.class,
        DeleteVideoController.class
})
@AutoConfigureMockMvc(addFilters = false)
class VideoCatalogControllersTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GetVideoHandler getVideoHandler;

    @MockitoBean
    private IssueSignedUrlHandler issueSignedUrlHandler;

    @MockitoBean
    private ListVideosHandler listVideosHandler;

    @MockitoBean
    private UpdateVideoHandler updateVideoHandler;

    @MockitoBean
    private DeleteVideoHandler deleteVideoHandler;

    private static VideoResponse response(String id, String title) {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");
        return new VideoResponse(id, title, "", "videos/" + id + ".mp4", "procedure.mp4",
                2048, "video/mp4", "\"etag\"", now, now);
    }

    @Test
    void listReturnsAllVideos() throws Exception {
        when(listVideosHandler.handle()).thenReturn(List.of(response("vid_2", "Newest"), response("vid_1", "Oldest")));

        mockMvc.perform(get("/api/v1/videos"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statusCode").value(200))
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].id").value("vid_2"))
                .andExpect(jsonPath("$.data[0].createdAt").value("2024-03-01T10:00:00Z"));
    }

    @Test
    void getExistingVideo() throws Exception {
        when(getVideoHandler.handle("vid_1")).thenReturn(Optional.of(response("vid_1", "IV Insertion")));

        mockMvc.perform(get("/api/v1/videos/vid_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.title").value("IV Insertion"));
    }

    @Test
    void getMissingVideoIsSuccessfulWithoutData() throws Exception {
        when(getVideoHandler.handle("nonexistent")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/videos/nonexistent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statusCode").value(200))
                .andExpect(jsonPath("$.message").value("Video not found"))
                .andExpect(jsonPath("$.data").value(nullValue()));
    }

    @Test
    void signedUrlIsReturnedAsData() throws Exception {
        String url = "https://videoteca.s3.amazonaws.com/videos/vid_1.mp4?X-Amz-Expires=3600";
        when(issueSignedUrlHandler.handle("vid_1")).thenReturn(new SignedUrl(url, Instant.now().plusSeconds(3600)));

        mockMvc.perform(get("/api/v1/videos/vid_1/signed-url"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Signed URL generated successfully"))
                .andExpect(jsonPath("$.data").value(url));
    }

    @Test
    void signedUrlForMissingVideoIsNotFound() throws Exception {
        when(issueSignedUrlHandler.handle("nonexistent")).thenThrow(new NotFoundException("Video not found"));

        mockMvc.perform(get("/api/v1/videos/nonexistent/signed-url"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.statusCode").value(404))
                .andExpect(jsonPath("$.message").value("Video not found"));
    }

    @Test
    void patchUpdatesMetadata() throws Exception {
        when(updateVideoHandler.handle(eq("vid_1"), any(UpdateVideoRequest.class)))
                .thenReturn(Optional.of(response("vid_1", "Central line care")));

        mockMvc.perform(patch("/api/v1/videos/vid_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Central line care\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Video updated successfully"))
                .andExpect(jsonPath("$.data.title").value("Central line care"));
    }

    @Test
    void patchOfMissingVideoIsSuccessfulWithoutData() throws Exception {
        when(updateVideoHandler.handle(eq("nonexistent"), any(UpdateVideoRequest.class))).thenReturn(Optional.empty());

        mockMvc.perform(patch("/api/v1/videos/nonexistent")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"x\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Video not found"))
                .andExpect(jsonPath("$.data").value(nullValue()));
    }

    @Test
    void patchCannotTouchStorageFields() throws Exception {
        mockMvc.perform(patch("/api/v1/videos/vid_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileKey\":\"videos/other.mp4\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.statusCode").value(400));

        verifyNoInteractions(updateVideoHandler);
    }

    @Test
    void deleteExistingVideo() throws Exception {
        when(deleteVideoHandler.handle("vid_1")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/videos/vid_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Video deleted successfully"))
                .andExpect(jsonPath("$.data").value(nullValue()));
    }

    @Test
    void deleteMissingVideo() throws Exception {
        when(deleteVideoHandler.handle("nonexistent")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/videos/nonexistent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Video not found"));
    }
}
