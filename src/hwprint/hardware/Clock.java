package hwprint.hardware;

import hwprint.printable.Document;

/** Clock signal. Clocks are neither bit-vectors nor aggregates and accept only the default and name directives. */
public class Clock extends HardwareValue {

  @Override
  public ValueKind kind() {
    return ValueKind.Other;
  }

  @Override
  public Document toPrintable() {
    return Document.literal("CLOCK");
  }

  @Override
  public String irType() {
    return "Clock";
  }
}
