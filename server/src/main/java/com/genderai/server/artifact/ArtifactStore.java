package com.genderai.server.artifact;

import java.nio.file.Path;

public interface ArtifactStore {
    /**
     * Copy every file of {@link RequiredArtifacts#FILES} found under
     * {@code bucket}/{@code prefix} into {@code destination}. The destination
     * either ends up holding the complete set or is left untouched.
     */
    void fetch(String bucket, String prefix, Path destination) throws FetchException;
}
