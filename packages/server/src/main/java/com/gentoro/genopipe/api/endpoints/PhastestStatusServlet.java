package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.jobs.adapters.PhastestClient;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /api/phastest-status
 *
 * <p>{@code available} only when PHASTEST answers HTTP 200. A network failure answers 503 with
 * {@code status: unavailable}.
 */
public final class PhastestStatusServlet extends ApiServlet {
  private final PhastestClient client;

  public PhastestStatusServlet(PhastestClient client) {
    this.client = client;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    PhastestClient.Availability availability = client.probe();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", availability.available() ? "available" : "unavailable");
    if (availability.statusCode() != null) {
      body.put("status_code", availability.statusCode());
      writeJson(resp, 200, body);
    } else {
      body.put("error", availability.error());
      writeJson(resp, 503, body);
    }
  }
}
