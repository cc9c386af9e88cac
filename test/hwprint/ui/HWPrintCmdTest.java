package hwprint.ui;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HWPrintCmdTest {

  // run() sets the root level from -q/-v/-vv, restore the one of log4j2-test.xml
  @AfterEach
  void restoreLogLevel() {
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.WARN);
  }

  @Test
  void testQuietTurnsLoggingOff(@TempDir Path tempDir) throws IOException {
    Path input = Files.writeString(tempDir.resolve("messages.yaml"), "- module: A\n  printf: [{message: hello}]\n");
    Assertions.assertEquals(0, HWPrintCmd.run(new String[] {"-q", "-i", input.toString(), "-o", tempDir.resolve("out").toString()}));
    Assertions.assertEquals(Level.OFF, LogManager.getRootLogger().getLevel());
    restoreLogLevel();
    Assertions.assertEquals(Level.WARN, LogManager.getRootLogger().getLevel());
  }

  @Test
  void testGenerate(@TempDir Path tempDir) throws IOException {
    Path input = Files.writeString(tempDir.resolve("messages.yaml"), "- module: MyModule\n"
                                                                        + "  signals: [{name: myWire, type: UInt, width: 32}]\n"
                                                                        + "  printf: [{message: 'myWire = ${myWire}%x', name: howdy}]\n");
    Path config = Files.writeString(tempDir.resolve("config.yaml"), "clock_name: clk\n");
    Path outDir = tempDir.resolve("out");
    int status = HWPrintCmd.run(new String[] {"-q", "-i", input.toString(), "-o", outDir.toString(), "-c", config.toString()});
    Assertions.assertEquals(0, status);
    String emitted = Files.readString(outDir.resolve("MyModule.fir"));
    Assertions.assertTrue(emitted.startsWith("circuit MyModule :\n  module MyModule :\n    input clk : Clock\n"), emitted);
    Assertions.assertTrue(emitted.contains("printf(clk, UInt<1>(\"h1\"), \"myWire = %x\", myWire) : howdy\n"), emitted);
  }

  @Test
  void testFailures(@TempDir Path tempDir) throws IOException {
    Path outDir = tempDir.resolve("out");
    Assertions.assertEquals(1, HWPrintCmd.run(new String[] {"-q"}));
    Assertions.assertEquals(1, HWPrintCmd.run(new String[] {"-q", "-i", tempDir.resolve("missing.yaml").toString(), "-o", outDir.toString()}));
    Path input = Files.writeString(tempDir.resolve("bad.yaml"), "- module: A\n  printf: [{message: '100% done'}]\n");
    Assertions.assertEquals(1, HWPrintCmd.run(new String[] {"-q", "-i", input.toString(), "-o", outDir.toString()}));
    Assertions.assertFalse(Files.exists(outDir.resolve("A.fir")));
  }

  @Test
  void testHelp() {
    Assertions.assertEquals(0, HWPrintCmd.run(new String[] {"-h", "-i", "unused.yaml"}));
  }
}
