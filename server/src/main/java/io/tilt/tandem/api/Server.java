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
package io.tilt.tandem.api;

import static io.tilt.tandem.api.config.SchedulerSettings.THREAD_NAME_WEBSERVER_WORKER;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;

import org.apache.commons.lang.Validate;
import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.grizzly.http.server.NetworkListener;
import org.glassfish.grizzly.threadpool.ThreadPoolConfig;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.uri.internal.JerseyUriBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.ClassPathXmlApplicationContext;

import io.tilt.tandem.api.config.BootstrapConfiguration;
import io.tilt.tandem.api.inspect.AdminEndpoint;
import io.tilt.tandem.core.leader.Coordinator;
import io.tilt.tandem.utils.LogUtils;

/**
 * Starts a coordinator: its context, background services and restful surface.
 * One instance per coordinator, the application holds it until {@linkplain #shutdown()}.
 *
 * @author Cristian Gonzalez
 */
public class Server {

	private static final String CONTEXT_PATH = "classpath:io/tilt/tandem/config/context-tandem-spring.xml";

	protected static final Logger logger = LoggerFactory.getLogger(Server.class);
	private final String name = getClass().getSimpleName();

	private final Config config;
	private ClassPathXmlApplicationContext context;
	private HttpServer webServer;
	private URI baseUri;
	private final Thread shutdownHook;

	/**
	 * @param jsonFormatConfig with a configuration in a JSON file,
	 * whose format must comply {@linkplain Config} class serialization
	 * @throws IOException when given file is invalid
	 */
	public Server(final File jsonFormatConfig) throws IOException {
		this(Config.fromJsonFile(jsonFormatConfig));
	}

	/**
	 * Create a coordinator with default configuration,
	 * listening at {@value BootstrapConfiguration#WEB_SERVER_HOST_PORT}
	 */
	public Server() {
		this(new Config());
	}

	/** @param config	a specific configuration */
	public Server(final Config config) {
		Validate.notNull(config);
		config.getBootstrap().validate();
		this.config = config;
		this.shutdownHook = new Thread(() -> destroy(), "tandem-shutdown");
		init();
	}

	private void init() {
		final String namespace = config.getBootstrap().getNamespace();
		logger.info("{}: Initializing context for namespace: {}", name, namespace);
		Runtime.getRuntime().addShutdownHook(shutdownHook);
		final ClassPathXmlApplicationContext ctx = new ClassPathXmlApplicationContext(new String[] { CONTEXT_PATH }, false);
		ctx.addBeanFactoryPostProcessor(beanFactory -> beanFactory.registerSingleton("config", config));
		ctx.setDisplayName(new StringBuilder("tandem-")
				.append(namespace)
				.append("-ts:")
				.append(System.currentTimeMillis())
				.toString());
		ctx.setId(namespace);
		this.context = ctx;
		ctx.refresh();
		if (config.getBootstrap().isEnableWebserver()) {
			startWebserver();
			logger.info(LogUtils.getGreetings(namespace, BootstrapConfiguration.VERSION,
					config.getBootstrap().getWebServerHostPort()));
		} else {
			logger.info("{}: Webserver disabled by configuration, in-process use only", name);
		}
	}

	private void startWebserver() {
		final ResourceConfig res = new ResourceConfig()
				.register(context.getBean(CoordinatorEndpoint.class))
				.register(context.getBean(AdminEndpoint.class))
				.register(ObjectMapperProvider.class)
				.register(JacksonFeature.class);

		final URI uri = resolveWebServerBindAddress();
		final HttpServer server = GrizzlyHttpServerFactory.createHttpServer(uri, res, false);
		final int workers = config.getBootstrap().getWebServerWorkerThreads();
		final ThreadPoolConfig pool = ThreadPoolConfig.defaultConfig()
				.setCorePoolSize(Math.min(workers, 4))
				.setMaxPoolSize(workers)
				.setPoolName(THREAD_NAME_WEBSERVER_WORKER);
		for (NetworkListener listener : server.getListeners()) {
			logger.info("{}: Configuring webserver listener {}", name, listener);
			listener.getTransport().setWorkerThreadPoolConfig(pool.copy());
		}
		try {
			server.start();
		} catch (IOException e) {
			logger.error("{}: Unable to start web server at {}", name, uri, e);
			destroy();
			throw new UncheckedIOException("web server unavailable at " + uri, e);
		}
		this.webServer = server;
		// port zero is resolved at binding
		final int port = server.getListeners().iterator().next().getPort();
		final String hostPort = uri.getHost() + ":" + port;
		config.getBootstrap().setWebServerHostPort(hostPort);
		this.baseUri = new JerseyUriBuilder().scheme("http").host(uri.getHost()).port(port)
				.path(config.getBootstrap().getWebServerContextPath()).build();
		logger.info("{}: Web host:port = {}", name, hostPort);
	}

	private URI resolveWebServerBindAddress() {
		final BootstrapConfiguration bs = config.getBootstrap();
		final String[] webHostPort = bs.getWebServerHostPort().split(":");
		return new JerseyUriBuilder()
				.scheme("http")
				.host(webHostPort[0])
				.port(Integer.parseInt(webHostPort[1]))
				.path(bs.getWebServerContextPath())
				.build();
	}

	private void checkInit() {
		if (context == null || !context.isActive()) {
			throw new IllegalStateException("coordinator already shutdown or not started");
		}
	}

	/** @return the in-process access to every coordinator operation */
	public Coordinator getCoordinator() {
		checkInit();
		return context.getBean(Coordinator.class);
	}

	public Config getConfig() {
		return config;
	}

	/** @return like http://host:port/context, or null when the webserver is disabled */
	public URI getBaseUri() {
		return baseUri;
	}

	/** @return a remote client to this coordinator */
	public Client getClient() {
		checkInit();
		Validate.notNull(baseUri, "webserver disabled by configuration");
		return new Client(baseUri.toString());
	}

	protected synchronized void destroy() {
		if (webServer != null) {
			try {
				webServer.shutdownNow();
			} catch (RuntimeException e) {
				logger.error("{}: Unexpected while stopping web server", name, e);
			}
			webServer = null;
		}
		if (context != null) {
			if (context.isActive()) {
				context.close();
			}
			context = null;
		}
	}

	/**
	 * Stops the restful surface and the context, which in turn stops the background services.
	 * Abandoned barrier waiters are not released. Repeated calls do nothing.
	 * Executes automatically at VM shutdown.
	 */
	public void shutdown() {
		if (context != null) {
			logger.info("{}: Shutting down at request", name);
			destroy();
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (IllegalStateException e) {
				logger.debug("{}: VM already shutting down", name);
			}
		}
	}

}
