package hwprint.hardware;

/**
 * Coarse kind of a {@link HardwareValue}, used to pick the directives a value accepts.
 */
public enum ValueKind {
  BitVector,
  Vec,
  Bundle,
  /** Hardware values that are neither bit-vectors nor aggregates (e.g. clocks). */
  Other
}
