package com.gentoro.genopipe;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesKeyValuePairsAndBareFlags() {
    StartupParameters params =
        new StartupParameters(new String[] {"--config=/etc/genopipe.yaml", "--verbose", "stray"});

    assertEquals("/etc/genopipe.yaml", params.configFile());
    assertEquals("true", params.getParameter("verbose"));
    assertNull(params.getParameter("stray"));
    assertEquals(2, params.asMap().size());
  }

  @Test
  void valueMayContainEqualsSign() {
    StartupParameters params = new StartupParameters(new String[] {"--filter=a=b"});

    assertEquals("a=b", params.getParameter("filter"));
  }

  @Test
  void defaultsApplyToMissingParameters() {
    StartupParameters params = new StartupParameters(null);

    assertNull(params.configFile());
    assertEquals("8080", params.getParameter("port", "8080"));
    assertTrue(params.asMap().isEmpty());
  }
}
