package com.gentoro.genopipe.http;

import com.gentoro.genopipe.exception.ConfigException;
import com.gentoro.genopipe.exception.ExceptionUtil;
import com.gentoro.genopipe.exception.StateException;
import com.gentoro.genopipe.logging.LoggingService;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.CrossOriginHandler;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler} wrapped in a CORS handler.
 *
 * <p>This class owns the Jetty lifecycle (start/stop/join) and exposes the {@link
 * ServletContextHandler} so that other components can register their servlets.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(EmbeddedJettyServer.class);
  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", 8080);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname = configuration.getString("http.hostname", "0.0.0.0");
      if (Objects.isNull(hostname) || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }
      hostname = hostname.trim();

      QueuedThreadPool threadPool = new QueuedThreadPool();
      threadPool.setDaemon(true);
      threadPool.setName("jetty-http");
      server = new Server(threadPool);

      connector = new ServerConnector(server);
      if (!hostname.equals("0.0.0.0")) {
        connector.setHost(hostname);
      }
      connector.setPort(port);
      server.addConnector(connector);

      contextHandler = new ServletContextHandler();
      contextHandler.setContextPath("/");

      CrossOriginHandler cors = new CrossOriginHandler();
      cors.setAllowedOriginPatterns(allowedOriginPatterns());
      cors.setAllowedMethods(Set.of("GET", "POST", "DELETE", "OPTIONS"));
      cors.setAllowedHeaders(Set.of("Content-Type", "Accept", "Origin"));
      cors.setHandler(contextHandler);
      server.setHandler(cors);
    }
  }

  private Set<String> allowedOriginPatterns() {
    String[] configured = configuration.getStringArray("http.cors.allowed-origins");
    if (configured.length == 0) {
      return Set.of(".*");
    }
    // Plain origins are matched literally; "*" allows any origin.
    return Arrays.stream(configured)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(s -> "*".equals(s) ? ".*" : Pattern.quote(s))
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /** Start Jetty if not already started. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new StateException(
                    "Could not start the HTTP listener; check that port %d is free"
                        .formatted(configuration.getInt("http.port", 8080)),
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      Server s = server;
      try {
        if (s.isRunning() || s.isStarting()) {
          s.setStopTimeout(2000);
          s.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping jetty server; continuing shutdown", e);
      } finally {
        server = null;
        connector = null;
        contextHandler = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return connector.getLocalPort();
      }
      return configuration.getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
