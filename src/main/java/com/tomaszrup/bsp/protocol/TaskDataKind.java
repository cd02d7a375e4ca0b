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
package com.tomaszrup.bsp.protocol;

/** Values of the {@code dataKind} field of task notifications. */
public final class TaskDataKind {

    public static final String COMPILE_TASK = "compile-task";
    public static final String COMPILE_REPORT = "compile-report";

    /** {@code dataKind} of a {@link BuildTarget} carrying {@link ScalaBuildTarget} data. */
    public static final String SCALA_BUILD_TARGET = "scala";

    private TaskDataKind() {
    }
}
