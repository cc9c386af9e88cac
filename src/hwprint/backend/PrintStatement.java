package hwprint.backend;

import hwprint.hardware.HardwareValue;
import hwprint.printable.ArgumentToken;
import java.util.List;
import java.util.Optional;

/**
 * Handle of an emitted print statement. The statement name used in the IR can be suggested until the module is emitted.
 */
public class PrintStatement {
  private final String formatString;
  private final List<ArgumentToken> args;
  private final HardwareValue condition;
  private final HardwareValue clock;
  private String suggestedName = null;

  PrintStatement(String formatString, List<ArgumentToken> args, HardwareValue condition, HardwareValue clock) {
    this.formatString = formatString;
    this.args = List.copyOf(args);
    this.condition = condition;
    this.clock = clock;
  }

  public String getFormatString() { return formatString; }

  public List<ArgumentToken> getArgs() { return args; }

  public HardwareValue getCondition() { return condition; }

  public HardwareValue getClock() { return clock; }

  /**
   * Suggests the name of the statement in the IR. Clashes with other names of the module are resolved by adding a suffix.
   * @return this statement
   */
  public PrintStatement suggestName(String name) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Statement name must not be empty");
    this.suggestedName = name;
    return this;
  }

  public Optional<String> getSuggestedName() { return Optional.ofNullable(suggestedName); }

  @Override
  public String toString() {
    return String.format("PrintStatement(\"%s\", %d args%s)", formatString, args.size(),
                         suggestedName == null ? "" : ", name " + suggestedName);
  }
}
