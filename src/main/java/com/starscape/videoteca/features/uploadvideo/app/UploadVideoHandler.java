package com.starscape.videoteca.features.uploadvideo.app;

import com.starscape.videoteca.common.exception.ValidationException;
import com.starscape.videoteca.common.storage.ObjectStorageGateway;
import com.starscape.videoteca.common.storage.StoredObject;
import com.starscape.videoteca.features.uploadvideo.domain.Video;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;

/**
 * Upload workflow: validate, store the file, then persist the record.
 *
 * <p>The object is written before the record so that every persisted record has a backing object.
 * If persisting fails the freshly written object is deleted once, best-effort; a failure of that
 * cleanup is logged and attached as suppressed, the original error is what the caller sees.
 */
@Service
public class UploadVideoHandler {

    private static final Logger log = LoggerFactory.getLogger(UploadVideoHandler.class);

    private final UploadValidator uploadValidator;
    private final StorageKeyGenerator storageKeyGenerator;
    private final ObjectStorageGateway storageGateway;
    private final VideoRecordStore videoRecordStore;

    public UploadVideoHandler(
            UploadValidator uploadValidator,
            StorageKeyGenerator storageKeyGenerator,
            ObjectStorageGateway storageGateway,
            VideoRecordStore videoRecordStore) {
        this.uploadValidator = uploadValidator;
        this.storageKeyGenerator = storageKeyGenerator;
        this.storageGateway = storageGateway;
        this.videoRecordStore = videoRecordStore;
    }

    public Video handle(UploadRequest request) {
        uploadValidator.validate(request).throwIfRejected();

        log.info("Starting upload for file: {}, size: {} bytes", request.originalFilename(), request.size());

        String fileKey = storageKeyGenerator.generate(request.originalFilename());
        StoredObject stored = store(fileKey, request);

        String videoId = "vid_" + UUID.randomUUID().toString().replace("-", "");
        Video video = new Video(
            videoId,
            request.title().trim(),
            request.description(),
            fileKey,
            request.originalFilename(),
            request.size(),
            request.contentType(),
            stored.etag()
        );

        try {
            Video created = videoRecordStore.create(video);
            log.info("Upload completed successfully for video ID: {}, key: {}", created.getId(), fileKey);
            return created;
        } catch (RuntimeException e) {
            compensate(fileKey, e);
            throw e;
        }
    }

    private StoredObject store(String fileKey, UploadRequest request) {
        InputStream content;
        try {
            content = request.content().getInputStream();
        } catch (IOException e) {
            throw new ValidationException("Upload body could not be read", e);
        }
        try {
            return storageGateway.put(fileKey, content, request.size(), request.contentType());
        } finally {
            close(content, fileKey);
        }
    }

    private void close(InputStream content, String fileKey) {
        try {
            content.close();
        } catch (IOException e) {
            log.warn("Failed to close upload stream for key {}: {}", fileKey, e.getMessage());
        }
    }

    private void compensate(String fileKey, RuntimeException cause) {
        log.warn("Persisting record for key {} failed ({}), deleting uploaded object", fileKey, cause.getMessage());
        try {
            storageGateway.delete(fileKey);
        } catch (RuntimeException cleanupError) {
            log.error("Compensating delete failed, object {} is orphaned", fileKey, cleanupError);
            cause.addSuppressed(cleanupError);
        }
    }
}
