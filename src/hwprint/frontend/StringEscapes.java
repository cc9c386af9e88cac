package hwprint.frontend;

import hwprint.printable.FormatException;

/**
 * Resolves backslash escapes in literal template text.
 */
public class StringEscapes {

  private StringEscapes() {}

  /**
   * Replaces <code>\b \t \n \f \r \" \' \\</code> and <code>&#92;uXXXX</code> by the characters they stand for.
   * @param text raw template text
   * @return the processed text
   * @throws FormatException on an unknown or truncated escape sequence
   */
  public static String treatEscapes(String text) {
    int firstBackslash = text.indexOf('\\');
    if (firstBackslash < 0)
      return text;
    StringBuilder ret = new StringBuilder(text.length());
    ret.append(text, 0, firstBackslash);
    int i = firstBackslash;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c != '\\') {
        ret.append(c);
        ++i;
        continue;
      }
      if (i + 1 >= text.length())
        throw new FormatException("Trailing backslash in \"" + text + "\"");
      char escaped = text.charAt(i + 1);
      switch (escaped) {
      case 'b':
        ret.append('\b');
        break;
      case 't':
        ret.append('\t');
        break;
      case 'n':
        ret.append('\n');
        break;
      case 'f':
        ret.append('\f');
        break;
      case 'r':
        ret.append('\r');
        break;
      case '"':
      case '\'':
      case '\\':
        ret.append(escaped);
        break;
      case 'u': {
        if (i + 6 > text.length())
          throw new FormatException("Truncated unicode escape in \"" + text + "\"");
        String hex = text.substring(i + 2, i + 6);
        try {
          ret.append((char)Integer.parseInt(hex, 16));
        } catch (NumberFormatException e) {
          throw new FormatException("Invalid unicode escape \\u" + hex + " in \"" + text + "\"", e);
        }
        i += 6;
        continue;
      }
      default:
        throw new FormatException(String.format("Invalid escape '\\%c' at index %d in \"%s\"", escaped, i, text));
      }
      i += 2;
    }
    return ret.toString();
  }
}
