package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.FastaBundleService;
import com.gentoro.genopipe.artifacts.TemporaryArtifact;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * GET /api/download-resfinder-fasta-zip
 *
 * <p>PHASTEST fallback: bundles the FASTA inputs of earlier ResFinder runs for manual submission.
 * 404 when no ResFinder input exists yet.
 */
public final class ResfinderFastaZipServlet extends ApiServlet {
  private final FastaBundleService bundles;
  private final ArtifactManager artifacts;

  public ResfinderFastaZipServlet(FastaBundleService bundles, ArtifactManager artifacts) {
    this.bundles = bundles;
    this.artifacts = artifacts;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    TemporaryArtifact bundle = bundles.bundleStagedResfinderInputs();
    writeAttachment(resp, artifacts.openTemporary(bundle.namespace(), bundle.filename()));
  }
}
