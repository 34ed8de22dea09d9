package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.FastaBundleService;
import com.gentoro.genopipe.artifacts.TemporaryArtifact;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** POST /api/download-fasta-files {@code {"genome_urls": [...]}}: zip of the genomes' FASTA. */
public final class FastaBundleServlet extends ApiServlet {
  private final FastaBundleService bundles;
  private final ArtifactManager artifacts;

  public FastaBundleServlet(FastaBundleService bundles, ArtifactManager artifacts) {
    this.bundles = bundles;
    this.artifacts = artifacts;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    TemporaryArtifact bundle = bundles.bundleGenomes(readGenomes(readJson(req)));
    writeAttachment(resp, artifacts.openTemporary(bundle.namespace(), bundle.filename()));
  }
}
