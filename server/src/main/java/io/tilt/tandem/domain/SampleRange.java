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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Half open range of sample indices: [start, end) */
public class SampleRange implements Serializable {

	private static final long serialVersionUID = -4019937265818211304L;

	private final long start;
	private final long end;

	@JsonCreator
	public SampleRange(@JsonProperty("start") final long start, @JsonProperty("end") final long end) {
		Validate.isTrue(start >= 0 && end >= start, "invalid range: " + start + "," + end);
		this.start = start;
		this.end = end;
	}

	public long getStart() {
		return start;
	}
	public long getEnd() {
		return end;
	}
	@JsonIgnore
	public long size() {
		return end - start;
	}
	public boolean contains(final long index) {
		return index >= start && index < end;
	}

	@Override
	public boolean equals(final Object obj) {
		if (obj instanceof SampleRange) {
			final SampleRange o = (SampleRange) obj;
			return start == o.start && end == o.end;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(start) * 31 + Long.hashCode(end);
	}

	@Override
	public String toString() {
		return "[" + start + "," + end + ")";
	}
}
