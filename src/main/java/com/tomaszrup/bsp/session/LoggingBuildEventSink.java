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
package com.tomaszrup.bsp.session;

import org.eclipse.lsp4j.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.protocol.DidChangeBuildTarget;
import com.tomaszrup.bsp.protocol.LogMessageParams;
import com.tomaszrup.bsp.protocol.PublishDiagnosticsParams;
import com.tomaszrup.bsp.protocol.ShowMessageParams;

/**
 * Writes server messages to the {@code bsp.server} logger, mapping BSP
 * message types onto SLF4J levels.
 */
public class LoggingBuildEventSink implements BuildEventSink {

    private static final Logger serverLog = LoggerFactory.getLogger("bsp.server");

    @Override
    public void onShowMessage(ShowMessageParams params) {
        log(params.getType(), params.getMessage());
    }

    @Override
    public void onLogMessage(LogMessageParams params) {
        log(params.getType(), params.getMessage());
    }

    @Override
    public void onDiagnostics(PublishDiagnosticsParams params) {
        if (serverLog.isDebugEnabled()) {
            serverLog.debug("{} diagnostic(s) for {} in {}",
                    params.getDiagnostics() != null ? params.getDiagnostics().size() : 0,
                    params.getTextDocument() != null ? params.getTextDocument().getUri() : null,
                    params.getBuildTarget());
        }
    }

    @Override
    public void onTargetsChanged(DidChangeBuildTarget params) {
        serverLog.info("Build targets changed: {}",
                params.getChanges() != null ? params.getChanges().size() : 0);
    }

    static void log(MessageType type, String message) {
        if (type == null) {
            serverLog.info(message);
            return;
        }
        switch (type) {
            case Error:
                serverLog.error(message);
                break;
            case Warning:
                serverLog.warn(message);
                break;
            case Info:
                serverLog.info(message);
                break;
            default:
                serverLog.debug(message);
                break;
        }
    }
}
