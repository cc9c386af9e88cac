package hwprint.backend;

import hwprint.hardware.HardwareValue;
import hwprint.printable.ArgumentToken;
import java.util.List;

/**
 * Sink for lowered circuit statements of one module.
 */
public interface IRBuilder {
  /**
   * Emits a print statement.
   * @param formatString flattened format string (<code>%d %x %b %c</code> tokens, <code>%%</code> for a literal percent)
   * @param args one argument per format token, left to right
   * @param condition 1-bit value enabling the print
   * @param clock clock the print is sampled on
   * @return handle of the emitted statement
   */
  PrintStatement emitFormatStatement(String formatString, List<ArgumentToken> args, HardwareValue condition, HardwareValue clock);
}
