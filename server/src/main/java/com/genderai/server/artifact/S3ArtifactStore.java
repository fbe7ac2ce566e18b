package com.genderai.server.artifact;

import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.file.Path;

public class S3ArtifactStore extends StagingArtifactStore {

    private final String region;
    private S3Client s3;

    /**
     * The client is built on first use, so a missing region or credentials
     * surface as a fetch failure instead of a startup failure.
     */
    public S3ArtifactStore(String region) {
        this.region = region;
    }

    public S3ArtifactStore(S3Client s3) {
        this.region = null;
        this.s3 = s3;
    }

    private synchronized S3Client client() {
        if (s3 == null) {
            S3ClientBuilder builder = S3Client.builder();
            if (region != null && !region.isBlank()) {
                builder.region(Region.of(region.trim()));
            }
            s3 = builder.build();
        }
        return s3;
    }

    @Override
    protected void download(String bucket, String key, String fileName, Path target) throws FetchException {
        String location = "s3://" + bucket + "/" + key;
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            client().getObject(request, ResponseTransformer.toFile(target));
        } catch (NoSuchKeyException e) {
            throw new FetchException(FetchException.Kind.MISSING_FILE, fileName, location, e);
        } catch (S3Exception e) {
            int status = e.statusCode();
            if (status == 404) {
                throw new FetchException(FetchException.Kind.MISSING_FILE, fileName, location, e);
            }
            if (status == 401 || status == 403) {
                throw new FetchException(FetchException.Kind.PERMISSION_ERROR, fileName,
                        "Access denied for " + location, e);
            }
            throw new FetchException(FetchException.Kind.NETWORK_ERROR, fileName,
                    "S3 returned status " + status + " for " + location, e);
        } catch (SdkClientException e) {
            throw new FetchException(FetchException.Kind.NETWORK_ERROR, fileName, e.getMessage(), e);
        }
    }
}
