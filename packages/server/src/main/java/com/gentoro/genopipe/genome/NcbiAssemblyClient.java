package com.gentoro.genopipe.genome;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.UpstreamUnavailableException;
import com.gentoro.genopipe.logging.LoggingService;
import com.gentoro.genopipe.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Looks up the genome assemblies of a BioProject through the NCBI E-utilities ({@code esearch}
 * then {@code esummary} on the {@code assembly} database, JSON mode).
 */
public class NcbiAssemblyClient {
  private static final Logger log = LoggingService.getLogger(NcbiAssemblyClient.class);

  static final String DEFAULT_BASE_URL = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
  private static final Pattern STAT =
      Pattern.compile("<Stat category=\"([a-z_]+)\" sequence_tag=\"all\">(\\d+)</Stat>");

  private final OkHttpClient http;
  private final HttpUrl baseUrl;
  private final String apiKey;
  private final String email;
  private final int retmax;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public NcbiAssemblyClient(OkHttpClient http, Configuration configuration) {
    this(
        http,
        configuration.getString("ncbi.base-url", DEFAULT_BASE_URL),
        configuration.getString("ncbi.api-key", ""),
        configuration.getString("ncbi.email", ""),
        configuration.getInt("ncbi.retmax", 1000));
  }

  public NcbiAssemblyClient(
      OkHttpClient http, String baseUrl, String apiKey, String email, int retmax) {
    this.http = http;
    this.baseUrl = HttpUrl.get(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
    this.apiKey = apiKey;
    this.email = email;
    this.retmax = retmax;
  }

  /**
   * Genome records of every assembly in the BioProject that has a downloadable FASTA.
   *
   * @throws NotFoundException if the BioProject resolves to no assemblies
   * @throws UpstreamUnavailableException if NCBI cannot be reached or answers with an error
   */
  public List<GenomeRecord> fetchAssemblies(String bioprojectId) {
    List<String> ids = searchAssemblyIds(bioprojectId);
    if (ids.isEmpty()) {
      throw new NotFoundException("No genome assemblies found for BioProject " + bioprojectId)
          .with("bioproject_id", bioprojectId);
    }
    log.debug("BioProject {} has {} assemblies", bioprojectId, ids.size());

    JsonNode summaries =
        get(endpoint("esummary.fcgi").addQueryParameter("id", String.join(",", ids)));
    JsonNode result = summaries.path("result");
    List<GenomeRecord> genomes = new ArrayList<>();
    for (JsonNode uid : result.path("uids")) {
      JsonNode summary = result.path(uid.asText());
      GenomeRecord record = toRecord(summary, bioprojectId);
      if (record == null) {
        log.debug("Assembly {} has no FTP path, skipped", uid.asText());
        continue;
      }
      genomes.add(record);
    }
    if (genomes.isEmpty()) {
      throw new NotFoundException(
              "No downloadable genome assemblies found for BioProject " + bioprojectId)
          .with("bioproject_id", bioprojectId);
    }
    return genomes;
  }

  List<String> searchAssemblyIds(String bioprojectId) {
    JsonNode root =
        get(
            endpoint("esearch.fcgi")
                .addQueryParameter("term", bioprojectId + "[BioProject]")
                .addQueryParameter("retmax", String.valueOf(retmax)));
    List<String> ids = new ArrayList<>();
    for (JsonNode id : root.path("esearchresult").path("idlist")) {
      ids.add(id.asText());
    }
    return ids;
  }

  static GenomeRecord toRecord(JsonNode summary, String bioprojectId) {
    String ftpPath = text(summary, "ftppath_refseq");
    if (ftpPath == null) ftpPath = text(summary, "ftppath_genbank");
    if (ftpPath == null) return null;
    if (ftpPath.startsWith("ftp://")) {
      ftpPath = "https://" + ftpPath.substring("ftp://".length());
    }
    if (ftpPath.endsWith("/")) ftpPath = ftpPath.substring(0, ftpPath.length() - 1);
    String directory = ftpPath.substring(ftpPath.lastIndexOf('/') + 1);
    String url = ftpPath + "/" + directory + "_genomic.fna.gz";

    String organism = orUnknown(text(summary, "organism"));
    String[] parts = organism.split(" \\(")[0].trim().split("\\s+");
    String genus = parts.length > 0 && !parts[0].isEmpty() ? parts[0] : "Unknown";
    String species =
        parts.length > 1
            ? String.join(" ", List.of(parts).subList(1, Math.min(parts.length, 3)))
            : "Unknown";

    String strain = "Unknown";
    for (JsonNode infra : summary.path("biosource").path("infraspecieslist")) {
      String value = text(infra, "sub_value");
      if (value != null) {
        strain = value;
        break;
      }
    }

    String meta = summary.path("meta").asText("");
    String contigCount = "Unknown";
    String genomeSize = "Unknown";
    Matcher m = STAT.matcher(meta);
    while (m.find()) {
      if ("contig_count".equals(m.group(1))) contigCount = m.group(2);
      if ("total_length".equals(m.group(1))) genomeSize = m.group(2);
    }

    return new GenomeRecord(
        url,
        genus,
        species,
        strain,
        organism,
        orUnknown(text(summary, "assemblyaccession")),
        orUnknown(text(summary, "assemblyname")),
        orUnknown(text(summary, "assemblystatus")),
        orUnknown(text(summary, "taxid")),
        orUnknown(text(summary, "submitterorganization")),
        orUnknown(text(summary, "submissiondate")),
        contigCount,
        genomeSize,
        bioprojectId);
  }

  private HttpUrl.Builder endpoint(String path) {
    HttpUrl.Builder builder =
        baseUrl
            .newBuilder()
            .addPathSegment(path)
            .addQueryParameter("db", "assembly")
            .addQueryParameter("retmode", "json");
    if (apiKey != null && !apiKey.isBlank()) builder.addQueryParameter("api_key", apiKey);
    if (email != null && !email.isBlank()) builder.addQueryParameter("email", email);
    return builder;
  }

  private JsonNode get(HttpUrl.Builder url) {
    HttpUrl target = url.build();
    Request request = new Request.Builder().url(target).get().build();
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new UpstreamUnavailableException(
                "NCBI answered HTTP %d for %s".formatted(response.code(), target.encodedPath()))
            .with("status", response.code());
      }
      return mapper.readTree(body.byteStream());
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Could not reach NCBI: " + e.getMessage(), e);
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) return null;
    String s = value.asText();
    return s.isBlank() ? null : s.trim();
  }

  private static String orUnknown(String value) {
    return value == null ? "Unknown" : value;
  }
}
