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

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

/**
 * Typed view of the {@code data} payload of a task notification, chosen
 * by its {@code dataKind}. Kinds this client does not interpret, and
 * payloads that do not match their declared kind, become
 * {@link Unrecognized}.
 */
public abstract class TaskData {

    public enum Kind {
        COMPILE_TASK,
        COMPILE_REPORT,
        UNRECOGNIZED
    }

    TaskData() {
    }

    public abstract Kind getKind();

    public static TaskData decode(String dataKind, JsonElement data) {
        if (dataKind == null) {
            return new Unrecognized(null, data, null);
        }
        try {
            switch (dataKind) {
                case TaskDataKind.COMPILE_TASK:
                    return new OfCompileTask(requireTarget(ProtocolJson.fromJson(data, CompileTask.class).getTarget(),
                            dataKind));
                case TaskDataKind.COMPILE_REPORT:
                    CompileReport report = ProtocolJson.fromJson(data, CompileReport.class);
                    requireTarget(report.getTarget(), dataKind);
                    return new OfCompileReport(report);
                default:
                    return new Unrecognized(dataKind, data, null);
            }
        } catch (JsonParseException e) {
            return new Unrecognized(dataKind, data, e.getMessage());
        }
    }

    private static BuildTargetIdentifier requireTarget(BuildTargetIdentifier target, String dataKind) {
        if (target == null || target.getUri() == null) {
            throw new JsonParseException("Missing target in " + dataKind + " payload");
        }
        return target;
    }

    /** {@code compile-task}: a target's compilation started. */
    public static final class OfCompileTask extends TaskData {
        private final BuildTargetIdentifier target;

        OfCompileTask(BuildTargetIdentifier target) {
            this.target = target;
        }

        public BuildTargetIdentifier getTarget() {
            return target;
        }

        @Override
        public Kind getKind() {
            return Kind.COMPILE_TASK;
        }
    }

    /** {@code compile-report}: a target's compilation finished. */
    public static final class OfCompileReport extends TaskData {
        private final CompileReport report;

        OfCompileReport(CompileReport report) {
            this.report = report;
        }

        public CompileReport getReport() {
            return report;
        }

        @Override
        public Kind getKind() {
            return Kind.COMPILE_REPORT;
        }
    }

    public static final class Unrecognized extends TaskData {
        private final String dataKind;
        private final JsonElement data;
        private final String problem;

        Unrecognized(String dataKind, JsonElement data, String problem) {
            this.dataKind = dataKind;
            this.data = data;
            this.problem = problem;
        }

        public String getDataKind() {
            return dataKind;
        }

        public JsonElement getData() {
            return data;
        }

        /** Why a known kind could not be decoded, or {@code null} if the kind is simply unknown. */
        public String getProblem() {
            return problem;
        }

        @Override
        public Kind getKind() {
            return Kind.UNRECOGNIZED;
        }
    }
}
