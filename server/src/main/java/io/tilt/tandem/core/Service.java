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
package io.tilt.tandem.core;

import java.io.Closeable;

/**
 * Lifecycle of the coordinator's moving parts, started and stopped by the context.
 * 
 * @author Cristian Gonzalez
 * @since Dec 3, 2015
 */
public interface Service extends Closeable {

	void init();

	void destroy();

	/* callable from init only */
	void start();

	/* callable from destroy only */
	void stop();

	@Override
	default void close() {
		destroy();
	}

	boolean inService();

	State getState();

	enum State {
		INITIALIZING,
		INIT_ERROR,
		STARTING,
		STARTED,
		STOPPING,
		STOPPED,
		DESTROYED,
		DESTROY_ERROR
	}

}
