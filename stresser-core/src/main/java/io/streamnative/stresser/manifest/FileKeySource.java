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

import com.google.common.collect.ImmutableList;
import io.streamnative.stresser.api.KeySource;
import io.streamnative.stresser.api.exceptions.ManifestException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Reads object keys from a text file, one key per line. */
@Slf4j
@RequiredArgsConstructor
public final class FileKeySource implements KeySource {
    @NonNull private final Path path;

    @Override
    public List<String> load() throws ManifestException {
        final List<String> keys;
        try (BufferedReader reader = Files.newBufferedReader(path, UTF_8)) {
            keys = parse(reader);
        } catch (NoSuchFileException ex) {
            throw new ManifestException("failed to open manifest file " + path, ex);
        } catch (IOException ex) {
            throw new ManifestException("error reading manifest file " + path + ": " + ex.getMessage(), ex);
        }
        if (keys.isEmpty()) {
            throw new ManifestException("manifest file " + path + " is empty or contains no valid keys");
        }
        log.debug("loaded {} keys from {}", keys.size(), path);
        return keys;
    }

    /**
     * Splits manifest content into keys. Surrounding whitespace is stripped and blank lines are
     * skipped; order and duplicates are kept.
     */
    public static List<String> parse(@NonNull Reader content) throws IOException {
        final BufferedReader reader =
                content instanceof BufferedReader br ? br : new BufferedReader(content);
        final ImmutableList.Builder<String> keys = ImmutableList.builder();
        String line;
        while ((line = reader.readLine()) != null) {
            final String key = line.strip();
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return keys.build();
    }
}
