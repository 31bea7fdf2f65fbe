package com.starscape.videoteca.features.uploadvideo.api;

import com.starscape.videoteca.common.exception.ConflictException;
import com.starscape.videoteca.common.exception.StorageException;
import com.starscape.videoteca.common.exception.ValidationException;
import com.starscape.videoteca.features.uploadvideo.app.UploadRequest;
import com.starscape.videoteca.features.uploadvideo.app.UploadVideoHandler;
import com.starscape.videoteca.features.uploadvideo.domain.Video;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UploadVideoController.class)
@AutoConfigureMockMvc(addFilters = false)
class UploadVideoControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private UploadVideoHandler uploadVideoHandler;

    @Test
    void uploadReturnsCreatedEnvelope() throws Exception {
        Video video = new Video("vid_1", "IV Insertion", "", "videos/abc.mp4", "procedure1.mp4",
                10240, "video/mp4", "\"etag\"");
        when(uploadVideoHandler.handle(any(UploadRequest.class))).thenReturn(video);
        MockMultipartFile file = new MockMultipartFile("file", "procedure1.mp4", "video/mp4", new byte[10240]);

        mockMvc.perform(multipart("/api/v1/videos/upload")
                        .file(file)
                        .param("title", "IV Insertion")
                        .param("description", ""))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.statusCode").value(201))
                .andExpect(jsonPath("$.message").value("Video uploaded successfully"))
                .andExpect(jsonPath("$.data.id").value("vid_1"))
                .andExpect(jsonPath("$.data.title").value("IV Insertion"))
                .andExpect(jsonPath("$.data.fileKey").value("videos/abc.mp4"))
                .andExpect(jsonPath("$.data.size").value(10240))
                .andExpect(jsonPath("$.data.contentType").value("video/mp4"));

        ArgumentCaptor<UploadRequest> captor = ArgumentCaptor.forClass(UploadRequest.class);
        verify(uploadVideoHandler).handle(captor.capture());
        assertThat(captor.getValue().originalFilename()).isEqualTo("procedure1.mp4");
        assertThat(captor.getValue().size()).isEqualTo(10240);
        assertThat(captor.getValue().title()).isEqualTo("IV Insertion");
    }

    @Test
    void validationFailureIsUnprocessable() throws Exception {
        when(uploadVideoHandler.handle(any(UploadRequest.class)))
                .thenThrow(new ValidationException("File validation failed: content type 'application/pdf' is not a video type"));
        MockMultipartFile file = new MockMultipartFile("file", "notes.pdf", "application/pdf", new byte[16]);

        mockMvc.perform(multipart("/api/v1/videos/upload").file(file).param("title", "Notes"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.statusCode").value(422))
                .andExpect(jsonPath("$.message").value("File validation failed: content type 'application/pdf' is not a video type"))
                .andExpect(jsonPath("$.data").value(nullValue()));
    }

    @Test
    void duplicateFileKeyIsConflict() throws Exception {
        when(uploadVideoHandler.handle(any(UploadRequest.class)))
                .thenThrow(new ConflictException("File key already in use: videos/abc.mp4"));
        MockMultipartFile file = new MockMultipartFile("file", "procedure1.mp4", "video/mp4", new byte[16]);

        mockMvc.perform(multipart("/api/v1/videos/upload").file(file).param("title", "IV Insertion"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.statusCode").value(409))
                .andExpect(jsonPath("$.message").value("File key already in use: videos/abc.mp4"));
    }

    @Test
    void integrityFailureOtherThanDuplicateKeyIsInternalError() throws Exception {
        when(uploadVideoHandler.handle(any(UploadRequest.class)))
                .thenThrow(new DataIntegrityViolationException("value too long"));
        MockMultipartFile file = new MockMultipartFile("file", "procedure1.mp4", "video/mp4", new byte[16]);

        mockMvc.perform(multipart("/api/v1/videos/upload").file(file).param("title", "IV Insertion"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.statusCode").value(500));
    }

    @Test
    void storageFailureIsBadGateway() throws Exception {
        when(uploadVideoHandler.handle(any(UploadRequest.class)))
                .thenThrow(new StorageException("Failed to upload object", null));
        MockMultipartFile file = new MockMultipartFile("file", "procedure1.mp4", "video/mp4", new byte[16]);

        mockMvc.perform(multipart("/api/v1/videos/upload").file(file).param("title", "IV Insertion"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.statusCode").value(502));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(uploadVideoHandler.handle(any(UploadRequest.class)))
                .thenThrow(new IllegalStateException("database unavailable"));
        MockMultipartFile file = new MockMultipartFile("file", "procedure1.mp4", "video/mp4", new byte[16]);

        mockMvc.perform(multipart("/api/v1/videos/upload").file(file).param("title", "IV Insertion"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.statusCode").value(500))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
