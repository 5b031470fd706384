package io.tilt.tandem;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;

import org.mockito.Mockito;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.core.task.Scheduler;
import io.tilt.tandem.core.task.impl.AgentFactoryImpl;
import io.tilt.tandem.domain.WorkerInfo;

public class TestUtils {

	public static Config prototypeConfig() {
		final Config prototypeConfig = new Config();
		prototypeConfig.getBootstrap().setNamespace("tandem-test");
		prototypeConfig.getBootstrap().setBeatUnitMs(100l);
		prototypeConfig.getBootstrap().setEnableWebserver(false);
		return prototypeConfig;
	}

	/** @return a scheduler that builds agents but never runs them */
	public static Scheduler idleScheduler() {
		final Scheduler scheduler = Mockito.mock(Scheduler.class);
		Mockito.when(scheduler.getAgentFactory()).thenReturn(new AgentFactoryImpl());
		return scheduler;
	}

	public static WorkerInfo worker(final String id) {
		return new WorkerInfo(id, "host-" + id, 29500, 8, 64L << 30);
	}

	public static int freePort() {
		try (ServerSocket socket = new ServerSocket(0)) {
			socket.setReuseAddress(true);
			return socket.getLocalPort();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

}
