package com.starscape.videoteca.features.uploadvideo.infra;

import com.starscape.videoteca.features.uploadvideo.domain.Video;
import com.starscape.videoteca.features.uploadvideo.domain.VideoRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaVideoRepository extends JpaRepository<Video, String>, VideoRepository {
    
    @Override
    Optional<Video> findByFileKey(String fileKey);
    
    @Override
    List<Video> findAllByOrderByCreatedAtDesc();
}
