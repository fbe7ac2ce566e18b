package com.genderai.server.artifact;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Artifact store backed by a directory tree: the bucket is a root directory and
 * the prefix a path below it.
 */
public class LocalDirectoryArtifactStore extends StagingArtifactStore {

    @Override
    protected void download(String bucket, String key, String fileName, Path target) throws FetchException {
        Path source = Paths.get(bucket).resolve(key);
        if (!Files.isRegularFile(source)) {
            throw new FetchException(FetchException.Kind.MISSING_FILE, fileName, "No such file: " + source);
        }
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (AccessDeniedException e) {
            throw new FetchException(FetchException.Kind.PERMISSION_ERROR, fileName, "Access denied: " + source, e);
        } catch (IOException e) {
            throw new FetchException(FetchException.Kind.NETWORK_ERROR, fileName, "Copy failed: " + source, e);
        }
    }
}
