package hwprint.printable;

import hwprint.hardware.HardwareValue;

/**
 * Positional argument of a flattened message, referencing the hardware value printed by one directive of the format string.
 */
public record ArgumentToken(HardwareValue value) {}
