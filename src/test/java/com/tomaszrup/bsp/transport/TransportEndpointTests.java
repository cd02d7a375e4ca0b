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
package com.tomaszrup.bsp.transport;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.bsp.ErrorCode;

class TransportEndpointTests {

	@Test
	void testParseTcp() throws Exception {
		TransportEndpoint endpoint = TransportEndpoint.parse("tcp://127.0.0.1:5101");
		Assertions.assertEquals(TransportEndpoint.tcp("127.0.0.1", 5101), endpoint);
		Assertions.assertEquals(Arrays.asList("--tcp", "127.0.0.1", "5101"), endpoint.toServerArguments());
	}

	@Test
	void testParseLocalSocketNormalizesPath() throws Exception {
		Path path = Paths.get("/tmp/a/../bsp.sock");
		TransportEndpoint endpoint = TransportEndpoint.parse("local:" + path);
		Assertions.assertEquals(TransportEndpoint.localSocket(Paths.get("/tmp/bsp.sock")), endpoint);
		Assertions.assertEquals("bsp.sock", endpoint.label());
	}

	@Test
	void testParsePipe() throws Exception {
		TransportEndpoint.Pipe endpoint = (TransportEndpoint.Pipe) TransportEndpoint.parse("pipe:/tmp/in|/tmp/out");
		Assertions.assertEquals("/tmp/in", endpoint.getReadPipe());
		Assertions.assertEquals("/tmp/out", endpoint.getWritePipe());
		Assertions.assertEquals("pipe:in", endpoint.label());
	}

	@Test
	void testPipeServerArgumentsSwapDirections() {
		TransportEndpoint.Pipe endpoint = TransportEndpoint.pipe("/tmp/in", "/tmp/out");
		Assertions.assertEquals(Arrays.asList("--pipe", "/tmp/out", "/tmp/in"), endpoint.toServerArguments());
		Assertions.assertEquals(TransportEndpoint.pipe("/tmp/out", "/tmp/in"), endpoint.reversed());
	}

	@Test
	void testToStringRoundTripsThroughParse() throws Exception {
		for (TransportEndpoint endpoint : Arrays.asList(
				TransportEndpoint.tcp("localhost", 0),
				TransportEndpoint.localSocket(Paths.get("/var/run/bsp.sock")),
				TransportEndpoint.pipe("/tmp/r", "/tmp/w"))) {
			Assertions.assertEquals(endpoint, TransportEndpoint.parse(endpoint.toString()));
		}
	}

	@Test
	void testEndpointsAreUsableAsKeys() {
		Set<TransportEndpoint> keys = new HashSet<>();
		keys.add(TransportEndpoint.tcp("localhost", 5101));
		keys.add(TransportEndpoint.tcp("localhost", 5101));
		keys.add(TransportEndpoint.tcp("localhost", 5102));
		Assertions.assertEquals(2, keys.size());
	}

	@Test
	void testMalformedAddresses() {
		for (String text : Arrays.asList(null, "", "tcp://nohost", "tcp://:80", "tcp://host:notaport",
				"tcp://host:70000", "pipe:onlyone", "pipe:same|same", "ftp://x")) {
			TransportException e = Assertions.assertThrows(TransportException.class,
					() -> TransportEndpoint.parse(text), "expected rejection of " + text);
			Assertions.assertEquals(TransportException.Kind.MALFORMED_ADDRESS, e.getKind());
			Assertions.assertEquals(ErrorCode.MALFORMED_ADDRESS, e.getCode());
		}
	}
}
