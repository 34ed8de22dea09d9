package com.gentoro.genopipe;

import com.gentoro.genopipe.api.ApiServer;
import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.FastaBundleService;
import com.gentoro.genopipe.cleanup.CleanupScheduler;
import com.gentoro.genopipe.exception.StateException;
import com.gentoro.genopipe.genome.GenomeDownloader;
import com.gentoro.genopipe.genome.NcbiAssemblyClient;
import com.gentoro.genopipe.http.EmbeddedJettyServer;
import com.gentoro.genopipe.http.OkHttpFactory;
import com.gentoro.genopipe.jobs.InMemoryJobRegistry;
import com.gentoro.genopipe.jobs.JobManager;
import com.gentoro.genopipe.jobs.JobRegistry;
import com.gentoro.genopipe.jobs.adapters.ExternalToolRunner;
import com.gentoro.genopipe.jobs.adapters.FetchGenomesAdapter;
import com.gentoro.genopipe.jobs.adapters.PhastestAdapter;
import com.gentoro.genopipe.jobs.adapters.PhastestClient;
import com.gentoro.genopipe.jobs.adapters.ResFinderAdapter;
import com.gentoro.genopipe.jobs.adapters.VfdbAdapter;
import com.gentoro.genopipe.logging.LoggingService;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** Wires the job core, the adapters and the HTTP server together and owns their lifecycle. */
public class GenoPipe {
  private static final org.slf4j.Logger log = LoggingService.getLogger(GenoPipe.class);

  private final StartupParameters startupParameters;
  private final Clock clock = Clock.systemUTC();
  private ConfigurationProvider configurationProvider;
  private EmbeddedJettyServer httpServer;
  private JobRegistry registry;
  private ArtifactManager artifacts;
  private JobManager jobs;
  private CleanupScheduler cleanup;

  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public GenoPipe(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    Configuration config = configuration();
    LoggingService.applyConfiguration(config);

    this.registry = new InMemoryJobRegistry(clock);
    this.artifacts =
        new ArtifactManager(Path.of(config.getString("storage.root", "./data")), registry, clock);
    this.jobs = new JobManager(registry, artifacts, config.getInt("jobs.worker-threads", 4), clock);

    OkHttpClient http = OkHttpFactory.create(config, "http.client");
    GenomeDownloader downloader = new GenomeDownloader(http);
    PhastestClient phastest =
        new PhastestClient(
            http,
            config.getString("phastest.api-url", "https://phastest.ca/phastest_api"),
            Duration.ofSeconds(config.getLong("phastest.probe-timeout-seconds", 10)));

    jobs.register(new FetchGenomesAdapter(new NcbiAssemblyClient(http, config)));
    jobs.register(
        new ResFinderAdapter(
            downloader,
            new ExternalToolRunner(
                "ResFinder", config.getList(String.class, "analysis.resfinder.command"))));
    jobs.register(
        new PhastestAdapter(
            downloader,
            phastest,
            Duration.ofSeconds(config.getLong("phastest.poll-interval-seconds", 30))));
    jobs.register(
        new VfdbAdapter(
            downloader,
            new ExternalToolRunner("VFDB", config.getList(String.class, "analysis.vfdb.command"))));

    this.cleanup = CleanupScheduler.fromConfiguration(config, jobs, artifacts);

    this.httpServer = new EmbeddedJettyServer(config);
    httpServer.prepare();
    try {
      new ApiServer(
              config.getString("http.context-path", "/api"),
              jobs,
              artifacts,
              new FastaBundleService(artifacts, downloader),
              phastest,
              config.getBoolean("phastest.probe-on-submit", true),
              cleanup,
              clock)
          .register(httpServer.getContextHandler());
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new StateException("Could not start http server", e);
    }
    cleanup.start();
    log.info("GenoPipe started on port {}", httpServer.getPort());
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "genopipe-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(cleanup);
        closeQuietly(httpServer);
        closeQuietly(jobs);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while closing {}: {}", closeable.getClass().getSimpleName(), e.toString());
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("GenoPipe not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public JobManager jobs() {
    return jobs;
  }

  public ArtifactManager artifacts() {
    return artifacts;
  }

  public JobRegistry registry() {
    return registry;
  }
}
