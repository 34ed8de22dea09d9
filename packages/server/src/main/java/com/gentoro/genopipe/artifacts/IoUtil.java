package com.gentoro.genopipe.artifacts;

import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import org.slf4j.Logger;

/** Small collection of I/O helpers for safe file operations. */
public final class IoUtil {
  private static final Logger log = LoggingService.getLogger(IoUtil.class);

  private IoUtil() {}

  /** Copy an InputStream to a file path, creating parent directories. */
  public static long copyStream(InputStream in, Path dest) throws IOException {
    Files.createDirectories(dest.getParent());
    try (OutputStream out = Files.newOutputStream(dest)) {
      return in.transferTo(out);
    }
  }

  /** Move a file, replacing the target, atomically when the file system allows it. */
  public static void moveReplacing(Path source, Path target) throws IOException {
    Files.createDirectories(target.getParent());
    try {
      Files.move(
          source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      log.debug("Atomic move of {} failed ({}), falling back to plain move", source, e.toString());
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Resolve a single file or directory name inside a base directory.
   *
   * <p>Rejects names with path separators or parent references so that caller-supplied names can
   * never escape {@code base}.
   */
  public static Path secureResolve(Path base, String name) {
    if (name == null
        || name.isBlank()
        || name.contains("..")
        || name.contains("/")
        || name.contains("\\")) {
      throw new ValidationException("Invalid file name: " + name);
    }
    Path dest = base.resolve(name).normalize();
    if (!dest.startsWith(base.normalize())) {
      throw new ValidationException("Invalid file name: " + name);
    }
    return dest;
  }

  /** Delete a directory tree. Failures are logged at debug level and otherwise ignored. */
  public static void silentDeleteDir(Path dir) {
    if (dir == null || !Files.exists(dir)) return;

    try (var stream = Files.walk(dir)) {
      stream
          .sorted(Comparator.reverseOrder())
          .forEach(
              p -> {
                try {
                  Files.deleteIfExists(p);
                } catch (IOException e) {
                  log.debug("Could not delete {}: {}", p, e.toString());
                }
              });
    } catch (IOException e) {
      log.debug("Could not walk {}: {}", dir, e.toString());
    }
  }
}
