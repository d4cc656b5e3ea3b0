package com.lidar.storage.impl;

import com.lidar.storage.ObjectStorage;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * S3-compatible object storage (MinIO in deployments). Buckets are created on first use.
 */
@Slf4j
public class S3ObjectStorage implements ObjectStorage, AutoCloseable {

    private static final int DELETE_BATCH_SIZE = 1000;

    private final S3Client s3Client;
    private final String endpoint;
    private final String publicBucket;
    private final String publicUrl;

    private final Set<String> knownBuckets = ConcurrentHashMap.newKeySet();

    public S3ObjectStorage(S3Client s3Client, String endpoint, String publicBucket, String publicUrl) {
        this.s3Client = s3Client;
        this.endpoint = stripSlash(endpoint);
        this.publicBucket = publicBucket;
        this.publicUrl = publicUrl == null ? null : stripSlash(publicUrl);
    }

    /**
     * Client for an endpoint override with path-style addressing
     */
    public static S3Client createClient(String endpoint, String region, String accessKey, String secretKey) {
        return S3Client.builder()
                .endpointOverride(URI.create(endpoint))
                .region(Region.of(region))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKey, secretKey)))
                .forcePathStyle(true)
                .build();
    }

    @Override
    public void putFile(String bucket, String key, Path file, String contentType) throws IOException {
        ensureBucket(bucket);
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentType)
                            .build(),
                    RequestBody.fromFile(file));
            log.debug("Uploaded {} to s3://{}/{}", file.getFileName(), bucket, key);
        } catch (SdkException e) {
            throw new IOException("Upload to " + bucket + "/" + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Path getFile(String bucket, String key, Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        // the file transformer refuses to overwrite
        Files.deleteIfExists(target);
        try {
            s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build(),
                    ResponseTransformer.toFile(target));
            return target;
        } catch (NoSuchKeyException | NoSuchBucketException e) {
            throw new FileNotFoundException("No object " + bucket + "/" + key);
        } catch (SdkException e) {
            Files.deleteIfExists(target);
            throw new IOException("Download of " + bucket + "/" + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String bucket, String key) throws IOException {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException | NoSuchBucketException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new IOException("Lookup of " + bucket + "/" + key + " failed: " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new IOException("Lookup of " + bucket + "/" + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int deletePrefix(String bucket, String prefix) throws IOException {
        try {
            List<ObjectIdentifier> keys = new ArrayList<>();
            for (S3Object object : s3Client.listObjectsV2Paginator(ListObjectsV2Request.builder()
                    .bucket(bucket).prefix(prefix).build()).contents()) {
                keys.add(ObjectIdentifier.builder().key(object.key()).build());
            }
            for (int i = 0; i < keys.size(); i += DELETE_BATCH_SIZE) {
                List<ObjectIdentifier> chunk = keys.subList(i, Math.min(i + DELETE_BATCH_SIZE, keys.size()));
                s3Client.deleteObjects(DeleteObjectsRequest.builder()
                        .bucket(bucket)
                        .delete(Delete.builder().objects(chunk).build())
                        .build());
            }
            log.info("Deleted {} objects under s3://{}/{}", keys.size(), bucket, prefix);
            return keys.size();
        } catch (NoSuchBucketException e) {
            return 0;
        } catch (SdkException e) {
            throw new IOException("Delete of " + bucket + "/" + prefix + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String publicUrl(String bucket, String key) {
        if (publicUrl != null && bucket.equals(publicBucket)) {
            return publicUrl + "/" + key;
        }
        return endpoint + "/" + bucket + "/" + key;
    }

    private void ensureBucket(String bucket) throws IOException {
        if (knownBuckets.contains(bucket)) {
            return;
        }
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (NoSuchBucketException e) {
            log.info("Creating bucket {}", bucket);
            try {
                s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
            } catch (SdkException createFailure) {
                throw new IOException("Could not create bucket " + bucket + ": " + createFailure.getMessage(),
                        createFailure);
            }
        } catch (SdkException e) {
            throw new IOException("Bucket check for " + bucket + " failed: " + e.getMessage(), e);
        }
        knownBuckets.add(bucket);
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
