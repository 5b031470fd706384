/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with this
 * work for additional information regarding copyright ownership. The ASF
 * licenses this file to You under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package io.tilt.tandem.sampler;

import java.io.File;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.Server;

/**
 * Runs a standalone coordinator until the VM is stopped.
 * Takes an optional JSON config file, otherwise defaults and system properties apply,
 * like: <code>-Dbootstrap.webServerHostPort=0.0.0.0:57580</code>
 *
 * @author Cristian Gonzalez
 */
public class CoordinatorApp {

	private static final Logger logger = LoggerFactory.getLogger(CoordinatorApp.class);

	public static void main(String[] args) throws Exception {
		final Config config = args != null && args.length > 0
				? Config.fromJsonFile(new File(args[0]))
				: new Config();
		final Server server = new Server(config);
		final CountDownLatch latch = new CountDownLatch(1);
		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			server.shutdown();
			latch.countDown();
		}));
		logger.info("{}: Coordinator ready at {}", CoordinatorApp.class.getSimpleName(), server.getBaseUri());
		latch.await();
	}

}
