package com.tierstore.context;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves {@code file:} URIs and plain paths against the local file system.
 */
public class FileSystemContentFetcher implements ContentFetcher {

    @Override
    public byte[] fetchBytes(String uri) throws IOException {
        Path path = uri.startsWith("file:") ? Path.of(URI.create(uri)) : Path.of(uri);
        if (!Files.isRegularFile(path)) {
            throw new IOException("no such file: " + path);
        }
        return Files.readAllBytes(path);
    }
}
