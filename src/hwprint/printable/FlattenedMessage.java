package hwprint.printable;

import java.util.List;

/**
 * Backend form of a {@link Document}: a format string using <code>%d %x %b %c</code> tokens and <code>%%</code> for a literal percent,
 * plus one argument per token, left to right.
 */
public record FlattenedMessage(String formatString, List<ArgumentToken> arguments) {
  public FlattenedMessage {
    arguments = List.copyOf(arguments);
  }
}
