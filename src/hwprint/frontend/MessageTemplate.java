package hwprint.frontend;

import hwprint.printable.FormatException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Literal text parts interleaved with interpolated arguments: <code>parts[0] args[0] parts[1] ... args[n-1] parts[n]</code>.
 * Arguments may be hardware values, documents or plain host values (including <code>null</code>).
 */
public final class MessageTemplate {
  private final List<String> parts;
  private final List<Object> args;

  private MessageTemplate(List<String> parts, List<Object> args) {
    this.parts = parts;
    this.args = args;
  }

  /**
   * @throws FormatException unless there is exactly one more part than arguments
   */
  public static MessageTemplate of(List<String> parts, List<?> args) {
    if (parts.size() != args.size() + 1)
      throw new FormatException(
          String.format("Wrong number of arguments: %d text part(s) need %d argument(s), got %d", parts.size(), parts.size() - 1, args.size()));
    for (String part : parts) {
      if (part == null)
        throw new FormatException("Template text parts must not be null");
    }
    return new MessageTemplate(Collections.unmodifiableList(new ArrayList<>(parts)),
                               Collections.unmodifiableList(new ArrayList<Object>(args)));
  }

  /** Template without arguments. */
  public static MessageTemplate text(String text) { return of(List.of(text), List.of()); }

  public static Builder builder() { return new Builder(); }

  public List<String> getParts() { return parts; }

  public List<Object> getArgs() { return args; }

  /** Returns a copy with every part transformed. */
  MessageTemplate mapParts(UnaryOperator<String> op) {
    List<String> newParts = new ArrayList<>(parts.size());
    parts.forEach(part -> newParts.add(op.apply(part)));
    return new MessageTemplate(Collections.unmodifiableList(newParts), args);
  }

  @Override
  public String toString() {
    StringBuilder ret = new StringBuilder();
    for (int i = 0; i < args.size(); ++i)
      ret.append(parts.get(i)).append("${").append(args.get(i)).append("}");
    return ret.append(parts.get(parts.size() - 1)).toString();
  }

  /**
   * Assembles a template from text and arguments in reading order. Consecutive text is merged, and an empty part is inserted
   * between consecutive arguments.
   */
  public static class Builder {
    private final List<String> parts = new ArrayList<>();
    private final List<Object> args = new ArrayList<>();
    private StringBuilder currentPart = new StringBuilder();

    public Builder text(String text) {
      currentPart.append(text);
      return this;
    }

    public Builder arg(Object arg) {
      parts.add(currentPart.toString());
      currentPart = new StringBuilder();
      args.add(arg);
      return this;
    }

    public MessageTemplate build() {
      List<String> finalParts = new ArrayList<>(parts);
      finalParts.add(currentPart.toString());
      return MessageTemplate.of(finalParts, args);
    }
  }
}
