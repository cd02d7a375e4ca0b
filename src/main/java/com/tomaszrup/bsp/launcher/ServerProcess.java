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

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/** A spawned build server process, as far as the launcher needs to see it. */
public interface ServerProcess {

    /** The process's standard output, where the readiness sentinel appears. */
    InputStream getStdout();

    boolean isAlive();

    /** Completes with the exit code once the process has exited. */
    CompletableFuture<Integer> onExit();

    /** Kills the process. Safe to call more than once. */
    void destroy();

    /** Human-readable description for logs. */
    String describe();
}
