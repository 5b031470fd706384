package io.tilt.tandem.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class AcceleratorUsage {

	private final int deviceId;
	private final double utilizationPercent;
	private final long memoryUsedBytes;
	private final long memoryTotalBytes;
	private final double temperatureCelsius;

	@JsonCreator
	public AcceleratorUsage(
			@JsonProperty("deviceId") final int deviceId,
			@JsonProperty("utilizationPercent") final double utilizationPercent,
			@JsonProperty("memoryUsedBytes") final long memoryUsedBytes,
			@JsonProperty("memoryTotalBytes") final long memoryTotalBytes,
			@JsonProperty("temperatureCelsius") final double temperatureCelsius) {
		this.deviceId = deviceId;
		this.utilizationPercent = utilizationPercent;
		this.memoryUsedBytes = memoryUsedBytes;
		this.memoryTotalBytes = memoryTotalBytes;
		this.temperatureCelsius = temperatureCelsius;
	}

	public int getDeviceId() {
		return deviceId;
	}
	public double getUtilizationPercent() {
		return utilizationPercent;
	}
	public long getMemoryUsedBytes() {
		return memoryUsedBytes;
	}
	public long getMemoryTotalBytes() {
		return memoryTotalBytes;
	}
	public double getTemperatureCelsius() {
		return temperatureCelsius;
	}
}
