package com.gentoro.genopipe.http;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.genopipe.exception.ConfigException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.configuration2.BaseConfiguration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class EmbeddedJettyServerTest {

  private EmbeddedJettyServer server;

  @AfterEach
  void tearDown() {
    if (server != null) server.close();
  }

  @Test
  void servesRegisteredServletsOnEphemeralPort() throws Exception {
    server = new EmbeddedJettyServer(config("*"));
    server.prepare();
    server.getContextHandler().addServlet(new ServletHolder(new PingServlet()), "/ping");
    server.start();

    assertTrue(server.isRunning());
    assertTrue(server.getPort() > 0);
    try (Response response = call(new Request.Builder().url(url("/ping")).get().build())) {
      assertEquals(200, response.code());
      assertEquals("pong", response.body().string());
    }
  }

  @Test
  void answersCorsPreflightForAllowedOrigin() throws Exception {
    server = new EmbeddedJettyServer(config("https://ui.example.org"));
    server.start();

    Request preflight =
        new Request.Builder()
            .url(url("/api/jobs"))
            .method("OPTIONS", null)
            .header("Origin", "https://ui.example.org")
            .header("Access-Control-Request-Method", "DELETE")
            .build();
    try (Response response = call(preflight)) {
      assertEquals("https://ui.example.org", response.header("Access-Control-Allow-Origin"));
    }
  }

  @Test
  void blankHostnameIsRejected() {
    BaseConfiguration config = config("*");
    config.setProperty("http.hostname", " ");
    server = new EmbeddedJettyServer(config);

    assertThrows(ConfigException.class, server::prepare);
  }

  @Test
  void stopIsIdempotent() {
    server = new EmbeddedJettyServer(config("*"));
    server.start();

    server.stop();
    server.stop();

    assertFalse(server.isRunning());
  }

  private static BaseConfiguration config(String origin) {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("http.port", 0);
    config.addProperty("http.hostname", "127.0.0.1");
    config.addProperty("http.cors.allowed-origins", origin);
    return config;
  }

  private String url(String path) {
    return "http://127.0.0.1:" + server.getPort() + path;
  }

  private static Response call(Request request) throws IOException {
    return new OkHttpClient().newCall(request).execute();
  }

  private static class PingServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setContentType("text/plain");
      resp.getWriter().write("pong");
    }
  }
}
