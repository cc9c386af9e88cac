package hwprint.ui;

import hwprint.frontend.Messages;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HWPrintConfigTest {

  static InputStream yaml(String text) { return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)); }

  @Test
  void testLoad() {
    HWPrintConfig cfg = HWPrintConfig.load(yaml("clock_name: clk\ndefault_mode: legacy\npass_through_directives: [q, t]\n"));
    Assertions.assertEquals("clk", cfg.clock_name);
    Assertions.assertEquals(Messages.Mode.legacy, cfg.GetDefaultMode());
    Assertions.assertEquals(Set.of('q', 't'), cfg.GetPassThroughDirectives());
    Assertions.assertEquals("  ", cfg.indent);
  }

  @Test
  void testDefaults() {
    HWPrintConfig cfg = HWPrintConfig.load(yaml(""));
    Assertions.assertEquals("clock", cfg.clock_name);
    Assertions.assertEquals(Messages.Mode.cf, cfg.GetDefaultMode());
    Assertions.assertTrue(cfg.GetPassThroughDirectives().isEmpty());
  }

  @ParameterizedTest
  @ValueSource(strings = {"default_mode: pold", "pass_through_directives: [x]", "pass_through_directives: [qq]", "clock_name: ''"})
  void testInvalid(String text) {
    Assertions.assertThrows(IllegalArgumentException.class, () -> HWPrintConfig.load(yaml(text)));
  }
}
