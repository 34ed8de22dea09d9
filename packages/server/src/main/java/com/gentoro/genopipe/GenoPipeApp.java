package com.gentoro.genopipe;

import com.gentoro.genopipe.logging.LoggingService;

public class GenoPipeApp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(GenoPipeApp.class);

  public static void main(String[] args) {
    try {
      GenoPipe app = new GenoPipe(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
