package hwprint.frontend;

import hwprint.printable.FormatException;
import java.math.BigInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HostFormatterTest {

  @Test
  void testFormat() {
    Assertions.assertEquals("20.45", HostFormatter.format("%2.2f", 20.45156));
    Assertions.assertEquals("a", HostFormatter.format("%x", 10));
    Assertions.assertEquals("  7", HostFormatter.format("%3d", 7));
    Assertions.assertEquals("1,234,567", HostFormatter.format("%,d", 1234567));
    Assertions.assertEquals("null", HostFormatter.format("%s", null));
  }

  @Test
  void testIntegralValuesAreWidened() {
    Assertions.assertEquals("3.0", HostFormatter.format("%.1f", 3));
    Assertions.assertEquals("12.00", HostFormatter.format("%.2f", BigInteger.valueOf(12)));
  }

  @Test
  void testMismatchFails() {
    FormatException e = Assertions.assertThrows(FormatException.class, () -> HostFormatter.format("%d", "text"));
    Assertions.assertNotNull(e.getCause());
    Assertions.assertThrows(FormatException.class, () -> HostFormatter.format("%q", 1));
  }
}
