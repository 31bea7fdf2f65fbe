package com.starscape.videoteca.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

@Configuration
public class AwsConfig {
    
    @Value("${aws.region}")
    private String region;
    
    @Value("${aws.profile:}")
    private String profile;
    
    // Static keys, used by MinIO / LocalStack deployments
    @Value("${aws.access-key:}")
    private String accessKey;
    
    @Value("${aws.secret-key:}")
    private String secretKey;
    
    // Set for MinIO / LocalStack, empty for AWS
    @Value("${aws.s3.endpoint:}")
    private String endpoint;
    
    @Value("${aws.s3.path-style-access:false}")
    private boolean pathStyleAccess;
    
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        if (accessKey != null && !accessKey.isBlank()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        // Use profile if specified, otherwise use default credentials chain
        if (profile != null && !profile.isBlank()) {
            return ProfileCredentialsProvider.create(profile);
        }
        return DefaultCredentialsProvider.create();
    }
    
    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider, StorageProperties storageProperties) {
        var builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .serviceConfiguration(s3Configuration())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(storageProperties.getCallTimeout())
                        .build());
        if (hasEndpointOverride()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }
    
    @Bean
    public S3Presigner s3Presigner(AwsCredentialsProvider credentialsProvider) {
        var builder = S3Presigner.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .serviceConfiguration(s3Configuration());
        if (hasEndpointOverride()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }
    
    private S3Configuration s3Configuration() {
        return S3Configuration.builder()
                .pathStyleAccessEnabled(pathStyleAccess)
                .build();
    }
    
    private boolean hasEndpointOverride() {
        return endpoint != null && !endpoint.isBlank();
    }
}
