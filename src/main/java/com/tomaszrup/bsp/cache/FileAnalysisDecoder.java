////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.bsp.cache;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads analysis files from the local file system. A missing file decodes to nothing. */
public class FileAnalysisDecoder implements AnalysisDecoder {

    private static final Logger logger = LoggerFactory.getLogger(FileAnalysisDecoder.class);

    @Override
    public Optional<AnalysisContents> decode(URI location) throws IOException {
        Path path;
        try {
            path = Paths.get(location);
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            throw new IOException("Not a local analysis location: " + location, e);
        }
        if (!Files.isRegularFile(path)) {
            logger.debug("No analysis file at {}", path);
            return Optional.empty();
        }
        return Optional.of(new AnalysisContents(location, Files.readAllBytes(path)));
    }
}
