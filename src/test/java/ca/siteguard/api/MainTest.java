package ca.siteguard.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("analyze"));
    assertTrue(buffer.toString().contains("taxonomy"));
    assertTrue(buffer.toString().contains("health"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().startsWith("usage: siteguard"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"inspect"}));
  }

  @Test
  void globalHelpIsForwardedToCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help", "taxonomy"}));
    assertTrue(buffer.toString().contains("SiteGuard taxonomy listing"));
  }

  @Test
  void dispatchesToTaxonomy() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"TAXONOMY"}));
    assertTrue(buffer.toString().contains("ppe-hard-hat-required"));
  }
}
