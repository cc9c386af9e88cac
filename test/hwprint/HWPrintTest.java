package hwprint;

import hwprint.frontend.Messages;
import hwprint.hardware.Bundle;
import hwprint.hardware.ModuleBuilder;
import hwprint.hardware.UInt;
import hwprint.ui.HWPrintConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HWPrintTest {

  static HWPrint createDesign() {
    HWPrint shim = new HWPrint();
    ModuleBuilder sub = shim.AddModule("MySubModule");
    Bundle io = new Bundle();
    UInt fizz = io.field("fizz", new UInt(32));
    sub.output("io", io);
    ModuleBuilder top = shim.AddModule("MyModule");
    top.instance("myInst", sub);
    top.printf(Messages.cf("fizz = ", fizz, "%d"));
    return shim;
  }

  static final String expectedCircuit = "circuit MyModule :\n"
                                        + "  module MySubModule :\n"
                                        + "    input clock : Clock\n"
                                        + "    output io : {fizz : UInt<32>}\n"
                                        + "\n"
                                        + "  module MyModule :\n"
                                        + "    input clock : Clock\n"
                                        + "\n"
                                        + "    inst myInst of MySubModule\n"
                                        + "\n"
                                        + "    printf(clock, UInt<1>(\"h1\"), \"fizz = %d\", myInst.io.fizz) : printf\n";

  @Test
  void testEmitCircuit() {
    HWPrint shim = createDesign();
    ModuleBuilder top = shim.GetModule("MyModule").orElseThrow();
    Assertions.assertEquals(List.of(top), shim.GetTopModules());
    Assertions.assertEquals(expectedCircuit, shim.EmitCircuit(top));
  }

  @Test
  void testGenerate(@TempDir Path tempDir) throws IOException {
    HWPrint shim = createDesign();
    Assertions.assertTrue(shim.Generate(tempDir.toString()));
    Assertions.assertEquals(expectedCircuit, Files.readString(tempDir.resolve("MyModule.fir")));
    Assertions.assertFalse(Files.exists(tempDir.resolve("MySubModule.fir")));
  }

  @Test
  void testConfiguredModules() {
    HWPrintConfig cfg = new HWPrintConfig();
    cfg.clock_name = "clk";
    cfg.indent = "    ";
    HWPrint shim = new HWPrint(cfg);
    ModuleBuilder module = shim.AddModule("A");
    Assertions.assertEquals("circuit A :\n    module A :\n        input clk : Clock\n", shim.EmitCircuit(module));
    Assertions.assertThrows(IllegalArgumentException.class, () -> shim.AddModule("A"));
  }
}
