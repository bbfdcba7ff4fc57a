/*
 * Copyright © 2022-2024 StreamNative Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.streamnative.stresser.manifest;

import static java.nio.charset.StandardCharsets.UTF_8;

import io.streamnative.stresser.api.ManifestSink;
import io.streamnative.stresser.api.exceptions.ManifestException;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import lombok.NonNull;

/**
 * Writes created keys to a text file, one key per line. The file is truncated when the sink is
 * opened. Every append is flushed before it returns.
 */
public final class FileManifestSink implements ManifestSink {
    private final Path path;
    private final BufferedWriter writer;
    private boolean closed;

    private FileManifestSink(Path path, BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    public static FileManifestSink open(@NonNull Path path) throws ManifestException {
        try {
            return new FileManifestSink(
                    path,
                    Files.newBufferedWriter(
                            path,
                            UTF_8,
                            StandardOpenOption.CREATE,
                            StandardOpenOption.TRUNCATE_EXISTING,
                            StandardOpenOption.WRITE));
        } catch (IOException ex) {
            throw new ManifestException("failed to create manifest file " + path, ex);
        }
    }

    @Override
    public synchronized void append(@NonNull String key) throws ManifestException {
        if (closed) {
            throw new ManifestException("manifest file " + path + " is already closed");
        }
        try {
            writer.write(key);
            writer.write('\n');
            writer.flush();
        } catch (IOException ex) {
            throw new ManifestException("failed to write key to manifest: " + ex.getMessage(), ex);
        }
    }

    @Override
    public synchronized void close() throws ManifestException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException ex) {
            throw new ManifestException("failed to close manifest file " + path, ex);
        }
    }

    public Path path() {
        return path;
    }
}
