package com.gentoro.genopipe.genome;

import com.gentoro.genopipe.exception.AdapterException;
import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.logging.LoggingService;
import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * Downloads a genome FASTA, decompressing it when gzip-encoded. The written file always starts
 * with a {@code >} header line and uses {@code \n} line endings with surrounding whitespace
 * removed; anything before the first header is dropped.
 */
public class GenomeDownloader {
  private static final Logger log = LoggingService.getLogger(GenomeDownloader.class);

  private final OkHttpClient http;

  public GenomeDownloader(OkHttpClient http) {
    this.http = http;
  }

  /** Downloads {@code genome} into {@code directory} under {@code filename}. */
  public Path download(GenomeRecord genome, Path directory, String filename) {
    HttpUrl url = genome.url() == null ? null : HttpUrl.parse(genome.url());
    if (url == null) {
      throw new ValidationException("Invalid genome URL: " + genome.url());
    }
    Path target = directory.resolve(filename);
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new AdapterException(
            "Failed to download %s: HTTP %d".formatted(genome.url(), response.code()));
      }
      Files.createDirectories(directory);
      try (InputStream in = maybeGunzip(body.byteStream())) {
        writeNormalized(in, target);
      }
    } catch (IOException e) {
      deleteQuietly(target);
      throw new AdapterException("Failed to download %s: %s".formatted(genome.url(), e), e);
    } catch (RuntimeException e) {
      deleteQuietly(target);
      throw e;
    }
    log.debug("Downloaded {} to {}", genome.url(), target);
    return target;
  }

  static InputStream maybeGunzip(InputStream raw) throws IOException {
    BufferedInputStream in = new BufferedInputStream(raw);
    in.mark(2);
    int b1 = in.read();
    int b2 = in.read();
    in.reset();
    if (b1 == 0x1f && b2 == 0x8b) {
      return new GZIPInputStream(in);
    }
    return in;
  }

  static void writeNormalized(InputStream in, Path target) throws IOException {
    boolean headerSeen = false;
    try (BufferedReader reader =
            new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        String clean = line.replace("\uFEFF", "").strip();
        if (!headerSeen) {
          if (!clean.startsWith(">")) continue;
          headerSeen = true;
        }
        writer.write(clean);
        writer.write('\n');
      }
    }
    if (!headerSeen) {
      throw new AdapterException("No FASTA header found in " + target.getFileName());
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.debug("Could not remove partial download {}: {}", file, e.toString());
    }
  }
}
