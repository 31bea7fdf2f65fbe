package com.starscape.videoteca.features.uploadvideo.app;

import com.starscape.videoteca.common.exception.ConflictException;
import com.starscape.videoteca.common.exception.NotFoundException;
import com.starscape.videoteca.features.uploadvideo.domain.Video;
import com.starscape.videoteca.features.uploadvideo.domain.VideoRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Durable catalog of videos. Enforces that a file key is tracked by at most one record
 * and that only title and description change after creation.
 */
@Service
public class VideoRecordStore {
    
    private static final String FILE_KEY_CONSTRAINT = "uq_videos_file_key";
    
    private final VideoRepository videoRepository;
    
    public VideoRecordStore(VideoRepository videoRepository) {
        this.videoRepository = videoRepository;
    }
    
    @Transactional
    public Video create(Video video) {
        if (videoRepository.findByFileKey(video.getFileKey()).isPresent()) {
            throw new ConflictException("File key already in use: " + video.getFileKey());
        }
        try {
            return videoRepository.saveAndFlush(video);
        } catch (DataIntegrityViolationException e) {
            // Lost a race against a concurrent insert of the same key
            if (violatesFileKeyConstraint(e)) {
                throw new ConflictException("File key already in use: " + video.getFileKey(), e);
            }
            throw e;
        }
    }
    
    /**
     * True only for the unique constraint on the file key. Other integrity failures stay unclassified.
     */
    static boolean violatesFileKeyConstraint(DataIntegrityViolationException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String name = t instanceof ConstraintViolationException
                    ? ((ConstraintViolationException) t).getConstraintName()
                    : t.getMessage();
            if (name != null && name.toLowerCase(Locale.ROOT).contains(FILE_KEY_CONSTRAINT)) {
                return true;
            }
        }
        return false;
    }
    
    @Transactional(readOnly = true)
    public Optional<Video> findById(String videoId) {
        return videoRepository.findById(videoId);
    }
    
    @Transactional(readOnly = true)
    public Optional<Video> findByStorageKey(String fileKey) {
        return videoRepository.findByFileKey(fileKey);
    }
    
    @Transactional(readOnly = true)
    public List<Video> findAll() {
        return videoRepository.findAllByOrderByCreatedAtDesc();
    }
    
    @Transactional
    public Video updateMetadata(String videoId, String title, String description) {
        Video video = videoRepository.findById(videoId)
                .orElseThrow(() -> new NotFoundException("Video not found: " + videoId));
        
        if (video.updateMetadata(title, description)) {
            return videoRepository.saveAndFlush(video);
        }
        return video;
    }
    
    /**
     * Delete the record.
     * @return the deleted record, empty if no record had the identifier
     */
    @Transactional
    public Optional<Video> delete(String videoId) {
        Optional<Video> video = videoRepository.findById(videoId);
        video.ifPresent(videoRepository::delete);
        return video;
    }
}
