package com.starscape.videoteca;

import com.starscape.videoteca.common.config.CorsProperties;
import com.starscape.videoteca.common.config.RateLimitProperties;
import com.starscape.videoteca.common.config.StorageProperties;
import com.starscape.videoteca.common.config.UploadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    StorageProperties.class,
    UploadProperties.class,
    CorsProperties.class,
    RateLimitProperties.class
})
public class VideotecaApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideotecaApplication.class, args);
    }
}
