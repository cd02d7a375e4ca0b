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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.bsp.server;

import java.nio.file.Paths;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.bsp.launcher.BuildServerLauncher;
import com.tomaszrup.bsp.transport.TransportEndpoint;

class BuildServerMainTests {

	@Test
	void testParsesTcpEndpoint() {
		BuildServerMain.Arguments arguments = BuildServerMain.Arguments.parse(
				new String[] {"--tcp", "127.0.0.1", "5010", "--version", "2.1.0"});

		Assertions.assertEquals(TransportEndpoint.tcp("127.0.0.1", 5010), arguments.endpoint);
		Assertions.assertEquals("2.1.0", arguments.version);
		Assertions.assertEquals(Paths.get(BuildServerMain.DEFAULT_CONFIG_DIR), arguments.configDir);
	}

	@Test
	void testParsesSocketAndConfig() {
		BuildServerMain.Arguments arguments = BuildServerMain.Arguments.parse(
				new String[] {"--config", "/ws/.bsp-engine", "--socket", "/tmp/bsp.sock"});

		Assertions.assertEquals(TransportEndpoint.localSocket(Paths.get("/tmp/bsp.sock")), arguments.endpoint);
		Assertions.assertEquals(Paths.get("/ws/.bsp-engine"), arguments.configDir);
	}

	@Test
	void testPipeArgumentsAreSeenFromTheClientSide() {
		BuildServerMain.Arguments arguments = BuildServerMain.Arguments.parse(
				new String[] {"--pipe", "/tmp/to-server", "/tmp/to-client"});

		Assertions.assertEquals(TransportEndpoint.pipe("/tmp/to-client", "/tmp/to-server"), arguments.endpoint);
	}

	@Test
	void testServerArgumentsRoundTripThroughParse() {
		TransportEndpoint endpoint = TransportEndpoint.pipe("/tmp/read", "/tmp/write");
		String[] args = endpoint.toServerArguments().toArray(new String[0]);

		Assertions.assertEquals(endpoint, BuildServerMain.Arguments.parse(args).endpoint);
	}

	@Test
	void testRejectsMissingEndpoint() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> BuildServerMain.Arguments.parse(new String[] {"--version", "1.0.0"}));
	}

	@Test
	void testRejectsBadPortAndUnknownFlag() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> BuildServerMain.Arguments.parse(new String[] {"--tcp", "localhost", "http"}));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> BuildServerMain.Arguments.parse(new String[] {"--udp", "localhost", "1"}));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> BuildServerMain.Arguments.parse(new String[] {"--socket"}));
	}

	@Test
	void testSentinelCarriesEndpointAndVersion() {
		String line = BuildServerMain.sentinel(TransportEndpoint.tcp("127.0.0.1", 5010), "1.4.2");

		Assertions.assertTrue(line.startsWith(BuildServerLauncher.SENTINEL_PREFIX));
		Assertions.assertTrue(line.endsWith("version=1.4.2"));
	}
}
