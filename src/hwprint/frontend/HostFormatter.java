package hwprint.frontend;

import hwprint.printable.FormatException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.IllegalFormatException;
import java.util.Locale;

/**
 * Formats plain (non-hardware) arguments eagerly with {@link java.util.Formatter} semantics.
 * Output does not depend on the default locale.
 */
public class HostFormatter {

  private HostFormatter() {}

  /**
   * Formats one value with one format token.
   * Integral numbers given to a floating point conversion (<code>%f %e %g %a</code>) are widened first.
   * @param token the format token, e.g. <code>%2.2f</code>
   * @param value the value, may be null
   * @return the formatted text
   * @throws FormatException if the token is malformed or does not fit the value
   */
  public static String format(String token, Object value) {
    Object arg = value;
    if (isFloatingConversion(token.charAt(token.length() - 1)))
      arg = widenIntegral(value);
    try {
      return String.format(Locale.ROOT, token, arg);
    } catch (IllegalFormatException e) {
      throw new FormatException(String.format("Cannot format %s with '%s': %s", describe(value), token, e.getMessage()), e);
    }
  }

  private static boolean isFloatingConversion(char conversion) {
    switch (Character.toLowerCase(conversion)) {
    case 'f':
    case 'e':
    case 'g':
    case 'a':
      return true;
    default:
      return false;
    }
  }

  private static Object widenIntegral(Object value) {
    if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long)
      return ((Number)value).doubleValue();
    if (value instanceof BigInteger)
      return new BigDecimal((BigInteger)value);
    return value;
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
  }
}
