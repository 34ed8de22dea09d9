package com.gentoro.genopipe.artifacts;

import com.gentoro.genopipe.exception.IoException;
import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.NotReadyException;
import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.jobs.Job;
import com.gentoro.genopipe.jobs.JobRegistry;
import com.gentoro.genopipe.jobs.JobStatus;
import com.gentoro.genopipe.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * Owns every artifact byte on disk. Two independent stores live under {@code storage.root}:
 *
 * <ul>
 *   <li>{@code jobs/<job_id>/}: artifacts produced by a job, readable only once the job is
 *       completed, removed by {@link #deleteForJob(String)};
 *   <li>{@code temp/<namespace>/}: time-scoped files not tied to any job, removed only by {@link
 *       #sweepTemporary(Duration)}.
 * </ul>
 *
 * Job workspaces ({@code work/<job_id>/}) are scratch space for adapters and are not artifacts.
 *
 * <p>Each job and each namespace has a read/write lock. Readers hold the read lock until their
 * {@link ArtifactStream} is closed and deletion takes the write lock, so a delete happens strictly
 * before or strictly after any read.
 */
public final class ArtifactManager {
  private static final Logger log = LoggingService.getLogger(ArtifactManager.class);

  /** FASTA inputs of completed ResFinder jobs, used by the PHASTEST fallback bundle. */
  public static final String RESFINDER_INPUTS = "resfinder_inputs";

  /** Per-genome {@code .PHASTEST.zip} downloads. */
  public static final String PHASTEST_RESULTS = "phastest_results";

  public static final String TEMP_FASTA_PREFIX = "temp_fasta_";

  private final JobRegistry registry;
  private final Path jobsRoot;
  private final Path tempRoot;
  private final Path workRoot;
  private final Clock clock;

  private final Map<String, JobArtifacts> jobArtifacts = new ConcurrentHashMap<>();
  private final Map<String, ReadWriteLock> namespaceLocks = new ConcurrentHashMap<>();

  private record StoredArtifact(Path path, long size) {}

  private static final class JobArtifacts {
    final ReadWriteLock lock = new ReentrantReadWriteLock();
    final Map<FileKind, StoredArtifact> files = new EnumMap<>(FileKind.class);
    boolean deleted;
  }

  public ArtifactManager(Path storageRoot, JobRegistry registry) {
    this(storageRoot, registry, Clock.systemUTC());
  }

  public ArtifactManager(Path storageRoot, JobRegistry registry, Clock clock) {
    this.registry = registry;
    this.clock = clock;
    Path root = storageRoot.toAbsolutePath().normalize();
    this.jobsRoot = root.resolve("jobs");
    this.tempRoot = root.resolve("temp");
    this.workRoot = root.resolve("work");
    try {
      Files.createDirectories(jobsRoot);
      Files.createDirectories(tempRoot);
      Files.createDirectories(workRoot);
    } catch (IOException e) {
      throw new IoException("Cannot create storage directories under " + root, e);
    }
    log.info("Artifact storage at {}", root);
  }

  // --------------------------------------------------------------------
  // Job workspaces
  // --------------------------------------------------------------------

  /** Fresh scratch directory for a running job. */
  public Path workspaceFor(String jobId) {
    Path dir = IoUtil.secureResolve(workRoot, jobId);
    try {
      return Files.createDirectories(dir);
    } catch (IOException e) {
      throw new IoException("Cannot create workspace for job " + jobId, e);
    }
  }

  public void releaseWorkspace(String jobId) {
    IoUtil.silentDeleteDir(IoUtil.secureResolve(workRoot, jobId));
  }

  // --------------------------------------------------------------------
  // Job-scoped artifacts
  // --------------------------------------------------------------------

  /**
   * Moves the files produced by a job into its artifact directory.
   *
   * @return references in {@link FileKind} order, for the job's result
   */
  public List<ArtifactRef> register(String jobId, Map<FileKind, Path> produced) {
    Path dir = IoUtil.secureResolve(jobsRoot, jobId);
    JobArtifacts artifacts = jobArtifacts.computeIfAbsent(jobId, id -> new JobArtifacts());
    Lock lock = artifacts.lock.writeLock();
    lock.lock();
    try {
      if (artifacts.deleted) {
        throw new NotFoundException("Job not found: " + jobId);
      }
      List<ArtifactRef> refs = new ArrayList<>();
      Map<FileKind, Path> ordered = new EnumMap<>(FileKind.class);
      ordered.putAll(produced);
      for (Map.Entry<FileKind, Path> e : ordered.entrySet()) {
        FileKind kind = e.getKey();
        String filename = kind.filename(jobId);
        Path target = dir.resolve(filename);
        IoUtil.moveReplacing(e.getValue(), target);
        long size = Files.size(target);
        artifacts.files.put(kind, new StoredArtifact(target, size));
        refs.add(new ArtifactRef(kind, filename, size));
      }
      log.debug("Registered {} artifact(s) for job {}", refs.size(), jobId);
      return refs;
    } catch (IOException e) {
      throw new IoException("Cannot store artifacts of job " + jobId, e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Opens an artifact of a job.
   *
   * @throws NotFoundException if the job does not exist
   * @throws NotReadyException if the job is not completed or did not produce {@code kind}
   */
  public ArtifactStream open(String jobId, FileKind kind) {
    Job job = registry.require(jobId);
    if (job.status() != JobStatus.COMPLETED) {
      throw new NotReadyException(
          "Job %s is %s; results are not available yet".formatted(jobId, job.status().wireName()));
    }
    if (job.jobType() != kind.jobType()) {
      throw new NotReadyException(
          "Job %s is a %s job and has no %s artifact"
              .formatted(jobId, job.jobType().wireName(), kind.wireName()));
    }

    JobArtifacts artifacts = jobArtifacts.get(jobId);
    if (artifacts == null) {
      throw new NotReadyException(
          "Job %s produced no %s artifact".formatted(jobId, kind.wireName()));
    }
    Lock lock = artifacts.lock.readLock();
    lock.lock();
    try {
      if (artifacts.deleted) {
        throw new NotFoundException("Job not found: " + jobId);
      }
      StoredArtifact stored = artifacts.files.get(kind);
      if (stored == null) {
        throw new NotReadyException(
            "Job %s produced no %s artifact".formatted(jobId, kind.wireName()));
      }
      InputStream in = Files.newInputStream(stored.path());
      return new ArtifactStream(
          kind.filename(jobId), kind.contentType(), stored.size(), in, lock::unlock);
    } catch (NoSuchFileException e) {
      lock.unlock();
      throw new NotFoundException("Artifact file of job " + jobId + " is missing", e);
    } catch (IOException e) {
      lock.unlock();
      throw new IoException("Cannot read artifact of job " + jobId, e);
    } catch (RuntimeException e) {
      lock.unlock();
      throw e;
    }
  }

  /** Removes every artifact owned by the job. Safe to call more than once. */
  public void deleteForJob(String jobId) {
    JobArtifacts artifacts = jobArtifacts.computeIfAbsent(jobId, id -> new JobArtifacts());
    Lock lock = artifacts.lock.writeLock();
    lock.lock();
    try {
      artifacts.deleted = true;
      artifacts.files.clear();
      IoUtil.silentDeleteDir(IoUtil.secureResolve(jobsRoot, jobId));
    } finally {
      lock.unlock();
      jobArtifacts.remove(jobId, artifacts);
    }
    log.debug("Deleted artifacts of job {}", jobId);
  }

  // --------------------------------------------------------------------
  // Temporary namespaces
  // --------------------------------------------------------------------

  /** Files of one namespace, newest first. An unknown namespace is empty. */
  public List<TemporaryArtifact> listTemporary(String namespace) {
    Path dir = namespaceDir(namespace);
    List<TemporaryArtifact> out = new ArrayList<>();
    if (!Files.isDirectory(dir)) return out;
    Lock lock = lockNamespace(namespace, false);
    try {
      if (!Files.isDirectory(dir)) return out;
      try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
        for (Path file : ds) {
          if (!Files.isRegularFile(file) || file.getFileName().toString().startsWith(".")) {
            continue;
          }
          BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
          out.add(
              new TemporaryArtifact(
                  namespace,
                  file.getFileName().toString(),
                  attrs.size(),
                  attrs.lastModifiedTime().toInstant()));
        }
      }
      out.sort(Comparator.comparing(TemporaryArtifact::createdAt).reversed());
      return out;
    } catch (IOException e) {
      throw new IoException("Cannot list temporary namespace " + namespace, e);
    } finally {
      lock.unlock();
    }
  }

  /** Files of every namespace whose name starts with {@code prefix}, newest first. */
  public List<TemporaryArtifact> listTemporaryByPrefix(String prefix) {
    List<TemporaryArtifact> out = new ArrayList<>();
    for (String namespace : namespaces()) {
      if (namespace.startsWith(prefix)) {
        out.addAll(listTemporary(namespace));
      }
    }
    out.sort(Comparator.comparing(TemporaryArtifact::createdAt).reversed());
    return out;
  }

  /** Opens a temporary file, holding the namespace read lock until the stream is closed. */
  public ArtifactStream openTemporary(String namespace, String filename) {
    Path dir = namespaceDir(namespace);
    Path file = IoUtil.secureResolve(dir, filename);
    if (!Files.isRegularFile(file)) {
      throw new NotFoundException("File not found: " + namespace + "/" + filename);
    }
    Lock lock = lockNamespace(namespace, false);
    try {
      if (!Files.isRegularFile(file)) {
        throw new NotFoundException("File not found: " + namespace + "/" + filename);
      }
      long size = Files.size(file);
      return new ArtifactStream(
          filename, contentTypeOf(filename), size, Files.newInputStream(file), lock::unlock);
    } catch (NoSuchFileException e) {
      lock.unlock();
      throw new NotFoundException("File not found: " + namespace + "/" + filename, e);
    } catch (IOException e) {
      lock.unlock();
      throw new IoException("Cannot read " + namespace + "/" + filename, e);
    } catch (RuntimeException e) {
      lock.unlock();
      throw e;
    }
  }

  /** Copies {@code source} into a namespace under {@code filename}, replacing any older copy. */
  public TemporaryArtifact publishTemporary(String namespace, Path source, String filename) {
    return writeTemporary(
        namespace,
        filename,
        out -> {
          try (InputStream in = Files.newInputStream(source)) {
            in.transferTo(out);
          }
        });
  }

  /** Writer callback for {@link #writeTemporary(String, String, ContentWriter)}. */
  @FunctionalInterface
  public interface ContentWriter {
    void write(OutputStream out) throws IOException;
  }

  /**
   * Writes a temporary file. Content goes to a hidden part file first and is renamed into place
   * under the namespace write lock, so readers never see a half-written file.
   */
  public TemporaryArtifact writeTemporary(String namespace, String filename, ContentWriter writer) {
    Path dir = namespaceDir(namespace);
    Path target = IoUtil.secureResolve(dir, filename);
    Path part = dir.resolve("." + filename + "." + System.nanoTime() + ".part");
    try {
      Files.createDirectories(dir);
      try (OutputStream out = Files.newOutputStream(part)) {
        writer.write(out);
      }
      Lock lock = lockNamespace(namespace, true);
      try {
        IoUtil.moveReplacing(part, target);
        long size = Files.size(target);
        log.debug("Stored temporary file {}/{} ({} bytes)", namespace, filename, size);
        return new TemporaryArtifact(namespace, filename, size, clock.instant());
      } finally {
        lock.unlock();
      }
    } catch (IOException e) {
      throw new IoException("Cannot write " + namespace + "/" + filename, e);
    } finally {
      try {
        Files.deleteIfExists(part);
      } catch (IOException e) {
        log.debug("Could not remove part file {}: {}", part, e.toString());
      }
    }
  }

  /**
   * Runs {@code action} over the regular files of a namespace while holding its read lock. Part
   * files are excluded.
   */
  public <T> T withTemporaryFiles(String namespace, Function<List<Path>, T> action) {
    Path dir = namespaceDir(namespace);
    if (!Files.isDirectory(dir)) return action.apply(new ArrayList<>());
    Lock lock = lockNamespace(namespace, false);
    try {
      List<Path> files = new ArrayList<>();
      if (Files.isDirectory(dir)) {
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
          for (Path file : ds) {
            if (Files.isRegularFile(file) && !file.getFileName().toString().startsWith(".")) {
              files.add(file);
            }
          }
        }
      }
      files.sort(Comparator.comparing(p -> p.getFileName().toString()));
      return action.apply(files);
    } catch (IOException e) {
      throw new IoException("Cannot list temporary namespace " + namespace, e);
    } finally {
      lock.unlock();
    }
  }

  /** Allocates a new, unused {@code temp_fasta_<millis>} namespace. */
  public synchronized String newTempFastaNamespace() {
    long millis = clock.millis();
    while (Files.exists(tempRoot.resolve(TEMP_FASTA_PREFIX + millis))) {
      millis++;
    }
    String namespace = TEMP_FASTA_PREFIX + millis;
    try {
      Files.createDirectories(tempRoot.resolve(namespace));
    } catch (IOException e) {
      throw new IoException("Cannot create temporary namespace " + namespace, e);
    }
    return namespace;
  }

  /**
   * Removes temporary files last modified more than {@code maxAge} ago, and namespaces left
   * empty. Waits for in-flight reads of a namespace to finish before deleting from it.
   *
   * @return number of files removed
   */
  public int sweepTemporary(Duration maxAge) {
    Instant cutoff = clock.instant().minus(maxAge);
    int removed = 0;
    for (String namespace : namespaces()) {
      Path dir = tempRoot.resolve(namespace);
      Lock lock = lockNamespace(namespace, true);
      try {
        if (!Files.isDirectory(dir)) {
          // Removed by a concurrent sweep.
          namespaceLocks.remove(namespace);
          continue;
        }
        boolean empty = true;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
          for (Path file : ds) {
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            if (modified.isBefore(cutoff)) {
              IoUtil.silentDeleteDir(file);
              removed++;
            } else {
              empty = false;
            }
          }
        }
        if (empty) {
          Files.deleteIfExists(dir);
          namespaceLocks.remove(namespace);
        }
      } catch (IOException e) {
        log.warn("Sweep of temporary namespace {} incomplete: {}", namespace, e.toString());
      } finally {
        lock.unlock();
      }
    }
    if (removed > 0) {
      log.info("Removed {} temporary file(s) older than {}", removed, maxAge);
    }
    return removed;
  }

  private List<String> namespaces() {
    List<String> out = new ArrayList<>();
    if (!Files.isDirectory(tempRoot)) return out;
    try (DirectoryStream<Path> ds = Files.newDirectoryStream(tempRoot)) {
      for (Path p : ds) {
        if (Files.isDirectory(p)) out.add(p.getFileName().toString());
      }
    } catch (IOException e) {
      throw new IoException("Cannot list temporary namespaces", e);
    }
    return out;
  }

  private Path namespaceDir(String namespace) {
    if (namespace == null || !namespace.matches("[A-Za-z0-9_-]+")) {
      throw new ValidationException("Invalid namespace: " + namespace);
    }
    return tempRoot.resolve(namespace);
  }

  private ReadWriteLock lockFor(String namespace) {
    return namespaceLocks.computeIfAbsent(namespace, n -> new ReentrantReadWriteLock());
  }

  /**
   * Locks {@code namespace}. The sweep drops the lock of a namespace it removes, so a lock that is
   * no longer the registered one after acquiring it is released and looked up again.
   */
  private Lock lockNamespace(String namespace, boolean write) {
    while (true) {
      ReadWriteLock namespaceLock = lockFor(namespace);
      Lock lock = write ? namespaceLock.writeLock() : namespaceLock.readLock();
      lock.lock();
      if (namespaceLocks.get(namespace) == namespaceLock) {
        return lock;
      }
      lock.unlock();
    }
  }

  int namespaceLockCount() {
    return namespaceLocks.size();
  }

  static String contentTypeOf(String filename) {
    String lower = filename.toLowerCase();
    if (lower.endsWith(".zip")) return "application/zip";
    if (lower.endsWith(".csv")) return "text/csv";
    if (lower.endsWith(".xlsx")) return FileKind.VFDB_EXCEL.contentType();
    if (lower.endsWith(".fasta") || lower.endsWith(".fna") || lower.endsWith(".fa")) {
      return "text/plain";
    }
    return "application/octet-stream";
  }
}
