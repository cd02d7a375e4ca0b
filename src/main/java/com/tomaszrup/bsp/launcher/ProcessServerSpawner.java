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
package com.tomaszrup.bsp.launcher;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.transport.TransportEndpoint;

/**
 * Spawns the configured server command as an OS process, appending the
 * endpoint arguments and {@code --version <token>}. The server's stderr
 * is inherited so its log ends up next to ours.
 */
public class ProcessServerSpawner implements ServerSpawner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessServerSpawner.class);

    private final List<String> serverCommand;
    private final Path workingDirectory;

    public ProcessServerSpawner(List<String> serverCommand, Path workingDirectory) {
        if (serverCommand.isEmpty()) {
            throw new IllegalArgumentException("No server command configured");
        }
        this.serverCommand = new ArrayList<>(serverCommand);
        this.workingDirectory = workingDirectory;
    }

    List<String> command(TransportEndpoint endpoint, String versionToken) {
        List<String> command = new ArrayList<>(serverCommand);
        command.addAll(endpoint.toServerArguments());
        command.add("--version");
        command.add(versionToken);
        return command;
    }

    @Override
    public ServerProcess spawn(TransportEndpoint endpoint, String versionToken) throws IOException {
        List<String> command = command(endpoint, versionToken);
        logger.info("Starting build server: {}", command);
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        return new OsProcess(builder.start());
    }

    private static final class OsProcess implements ServerProcess {
        private final Process process;
        private final CompletableFuture<Integer> exit;

        OsProcess(Process process) {
            this.process = process;
            this.exit = process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public InputStream getStdout() {
            return process.getInputStream();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public void destroy() {
            if (process.isAlive()) {
                logger.debug("Destroying build server process {}", process.pid());
                process.destroyForcibly();
            }
        }

        @Override
        public String describe() {
            return "pid " + process.pid();
        }
    }
}
