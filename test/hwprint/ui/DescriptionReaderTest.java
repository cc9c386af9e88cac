package hwprint.ui;

import hwprint.HWPrint;
import hwprint.hardware.ModuleBuilder;
import hwprint.printable.FormatException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DescriptionReaderTest {

  static HWPrint read(String description) { return read(new HWPrintConfig(), description); }

  static HWPrint read(HWPrintConfig cfg, String description) {
    HWPrint shim = new HWPrint(cfg);
    new DescriptionReader(shim).Read(new ByteArrayInputStream(description.getBytes(StandardCharsets.UTF_8)));
    return shim;
  }

  static List<String> printLines(ModuleBuilder module) {
    return module.emit().lines().map(String::trim).filter(line -> line.startsWith("printf(")).collect(Collectors.toList());
  }

  static final String design = String.join("\n",
      "- module: MySubModule",
      "  ports:",
      "    - {name: io, direction: output, type: Bundle, fields: [{name: fizz, type: UInt, width: 32}]}",
      "- module: MyModule",
      "  instances:",
      "    - {name: myInst, module: MySubModule}",
      "  ports:",
      "    - {name: en, type: Bool}",
      "  signals:",
      "    - {name: myWire, type: UInt, width: 32}",
      "    - {name: myVec, type: Vec, elements: 2, element: {type: UInt, width: 8}}",
      "    - {name: myBun, type: Bundle, fields: [{name: foo, type: UInt, width: 8}, {name: bar, type: SInt, width: 8}]}",
      "    - {name: b1, type: UInt, literal: 10}",
      "  values: {f1: 20.45156, i1: 10}",
      "  printf:",
      "    - {message: 'F1 = $f1%2.2f wire = ${myWire}%x', name: howdy}",
      "    - {message: 'vec = $myVec bun = $myBun', condition: en}",
      "    - {message: 'fizz = ${myInst.io.fizz} at ${myInst.io.fizz}%N, foo = ${myBun.foo}%b', mode: cf}",
      "    - {message: '100% of ${myVec[1]}%x', mode: p, name: ratio}",
      "    - {message: 'b1 = ${b1}%x i1 = $i1%x costs $$5'}",
      "");

  @Test
  void testRead() {
    HWPrint shim = read(design);
    Assertions.assertEquals(2, shim.GetModules().size());
    ModuleBuilder module = shim.GetModule("MyModule").orElseThrow();
    Assertions.assertEquals(
        List.of("printf(clock, UInt<1>(\"h1\"), \"F1 = 20.45 wire = %x\", myWire) : howdy",
                "printf(clock, en, \"vec = Vec(%d, %d) bun = AnonymousBundle(foo -> %d, bar -> %d)\", myVec[0], myVec[1], myBun.foo, myBun.bar)"
                    + " : printf",
                "printf(clock, UInt<1>(\"h1\"), \"fizz = %d at myInst.io.fizz, foo = %b\", myInst.io.fizz, myBun.foo) : printf_1",
                "printf(clock, UInt<1>(\"h1\"), \"100%% of %d%%x\", myVec[1]) : ratio",
                "printf(clock, UInt<1>(\"h1\"), \"b1 = %x i1 = a costs $5\", UInt<4>(\"ha\")) : printf_2"),
        printLines(module));
    Assertions.assertTrue(module.emit().contains("wire myBun : {foo : UInt<8>, bar : SInt<8>}"));
  }

  @Test
  void testDefaultModeFromConfig() {
    HWPrintConfig cfg = new HWPrintConfig();
    cfg.default_mode = "legacy";
    HWPrint shim = read(cfg, "- module: A\n  signals: [{name: w, type: UInt, width: 4}]\n  printf: [{message: '50% of ${w}%x'}]\n");
    Assertions.assertEquals(List.of("printf(clock, UInt<1>(\"h1\"), \"50%% of %d%%x\", w) : printf"),
                            printLines(shim.GetModule("A").orElseThrow()));
  }

  @Test
  void testMessageErrorsNameThePrintf() {
    FormatException e = Assertions.assertThrows(
        FormatException.class, () -> read("- module: A\n  signals: [{name: w, type: UInt, width: 4}]\n  printf: [{message: '${w}%2.2f'}]\n"));
    Assertions.assertTrue(e.getMessage().startsWith("A.printf[0]: "), e.getMessage());
    Assertions.assertThrows(FormatException.class, () -> read("- module: A\n  printf: [{message: '100% done'}]\n"));
    Assertions.assertThrows(FormatException.class, () -> read("- module: A\n  printf: [{message: 'x = $x'}]\n"));
  }

  @Test
  void testMalformedDescriptions() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> read("- module: A\n  signals: [{name: w, type: Float}]\n"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> read("- module: A\n  signals: [{name: w, type: UInt}]\n"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> read("- module: A\n  instances: [{name: i, module: B}]\n"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> read("- module: A\n  ports: [{name: p, type: Bool, direction: inout}]\n"));
    Assertions.assertThrows(IllegalArgumentException.class,
                            () -> read("- module: A\n  signals: [{name: w, type: UInt, width: 2}]\n  printf: [{message: x, condition: w}]\n"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> read("module: A\n"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> read("- module: A\n- module: A\n"));
  }

  @Test
  void testBoolLiterals() {
    HWPrint shim = read("- module: A\n"
                        + "  signals: [{name: one, type: Bool, literal: 1}, {name: t, type: Bool, literal: true},"
                        + " {name: zero, type: Bool, literal: 0}, {name: f, type: Bool, literal: false}]\n"
                        + "  printf: [{message: 'v = ${one}%x ${t}%x ${zero}%x ${f}%x'}]\n");
    Assertions.assertEquals(
        List.of("printf(clock, UInt<1>(\"h1\"), \"v = %x %x %x %x\", UInt<1>(\"h1\"), UInt<1>(\"h1\"), UInt<1>(\"h0\"), UInt<1>(\"h0\")) : printf"),
        printLines(shim.GetModule("A").orElseThrow()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"2", "-1", "yes_please", "'1.5'"})
  void testInvalidBoolLiteral(String literal) {
    IllegalArgumentException e = Assertions.assertThrows(
        IllegalArgumentException.class, () -> read("- module: A\n  signals: [{name: b, type: Bool, literal: " + literal + "}]\n"));
    Assertions.assertTrue(e.getMessage().contains("Bool literal must be true, false, 0 or 1"), e.getMessage());
  }

  @Test
  void testUnknownKeysAreIgnored() {
    HWPrint shim = read("- module: A\n  comment: ignored\n  printf: [{message: hello, color: red}]\n");
    Assertions.assertEquals(List.of("printf(clock, UInt<1>(\"h1\"), \"hello\") : printf"), printLines(shim.GetModule("A").orElseThrow()));
    Assertions.assertTrue(read("").GetModules().isEmpty());
  }
}
