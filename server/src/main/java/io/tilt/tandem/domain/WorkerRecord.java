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
package io.tilt.tandem.domain;

import java.io.Serializable;

import org.apache.commons.lang.Validate;
import org.joda.time.DateTime;

/**
 * A worker admitted by the registry. Its rank doesn't change while it stays registered.
 */
public class WorkerRecord implements Serializable, Comparable<WorkerRecord> {

	private static final long serialVersionUID = 2916480062337401186L;

	private final WorkerInfo info;
	private final int rank;
	private final DateTime registeredAt;

	public WorkerRecord(final WorkerInfo info, final int rank, final DateTime registeredAt) {
		Validate.notNull(info);
		Validate.isTrue(rank >= 0);
		Validate.notNull(registeredAt);
		this.info = info;
		this.rank = rank;
		this.registeredAt = registeredAt;
	}

	public String getWorkerId() {
		return info.getWorkerId();
	}
	public WorkerInfo getInfo() {
		return info;
	}
	public int getRank() {
		return rank;
	}
	public DateTime getRegisteredAt() {
		return registeredAt;
	}

	@Override
	public int compareTo(final WorkerRecord o) {
		return Integer.compare(rank, o.rank);
	}

	@Override
	public String toString() {
		return info.getWorkerId() + "#" + rank;
	}
}
