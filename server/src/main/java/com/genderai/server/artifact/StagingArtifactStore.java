package com.genderai.server.artifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.UUID;

/**
 * Downloads the file set into a sibling staging directory and renames it onto
 * the destination once every file has arrived.
 */
public abstract class StagingArtifactStore implements ArtifactStore {

    private static final Logger logger = LoggerFactory.getLogger(StagingArtifactStore.class);

    /**
     * Copy one object to {@code target}. Implementations map their own
     * failures onto {@link FetchException.Kind}.
     */
    protected abstract void download(String bucket, String key, String fileName, Path target)
            throws FetchException;

    @Override
    public void fetch(String bucket, String prefix, Path destination) throws FetchException {
        Path absolute = destination.toAbsolutePath();
        Path parent = absolute.getParent();
        Path staging = parent.resolve(absolute.getFileName() + ".staging-" + UUID.randomUUID());

        try {
            Files.createDirectories(staging);
        } catch (IOException e) {
            throw new FetchException(FetchException.Kind.PERMISSION_ERROR, RequiredArtifacts.FILES.get(0),
                    "Cannot create staging directory " + staging, e);
        }

        boolean published = false;
        try {
            for (String fileName : RequiredArtifacts.FILES) {
                String key = RequiredArtifacts.objectKey(prefix, fileName);
                download(bucket, key, fileName, staging.resolve(fileName));
                logger.info("Downloaded {} to {}", key, staging.resolve(fileName));
            }
            publish(staging, absolute);
            published = true;
            logger.info("Model artifacts from {}/{} available at {}", bucket, prefix, absolute);
        } finally {
            if (!published) {
                deleteQuietly(staging);
            }
        }
    }

    private void publish(Path staging, Path destination) throws FetchException {
        Path stale = null;
        try {
            if (Files.exists(destination)) {
                // an incomplete leftover from an older layout; move it out of the way first
                stale = destination.resolveSibling(destination.getFileName() + ".stale-" + UUID.randomUUID());
                move(destination, stale);
            }
            move(staging, destination);
        } catch (IOException e) {
            throw new FetchException(FetchException.Kind.PERMISSION_ERROR, RequiredArtifacts.FILES.get(0),
                    "Cannot publish artifacts to " + destination, e);
        }
        if (stale != null) {
            deleteQuietly(stale);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("Atomic rename not supported for {}, falling back to plain move", to);
            Files.move(from, to);
        }
    }

    static void deleteQuietly(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    Files.delete(d);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.warn("Failed to clean up {}", dir, e);
        }
    }
}
