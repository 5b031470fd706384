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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Release of a complete barrier: every participant gets the same count 
 * and its own 1-indexed arrival position.
 */
public class BarrierReply {

	private final String barrierId;
	private final long step;
	private final int arrivalOrder;
	private final int participants;

	@JsonCreator
	public BarrierReply(
			@JsonProperty("barrierId") final String barrierId,
			@JsonProperty("step") final long step,
			@JsonProperty("arrivalOrder") final int arrivalOrder,
			@JsonProperty("participants") final int participants) {
		this.barrierId = barrierId;
		this.step = step;
		this.arrivalOrder = arrivalOrder;
		this.participants = participants;
	}

	public String getBarrierId() {
		return barrierId;
	}
	public long getStep() {
		return step;
	}
	public int getArrivalOrder() {
		return arrivalOrder;
	}
	public int getParticipants() {
		return participants;
	}

	@Override
	public String toString() {
		return barrierId + "@" + step + " " + arrivalOrder + "/" + participants;
	}
}
