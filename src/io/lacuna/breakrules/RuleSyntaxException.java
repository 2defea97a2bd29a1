package io.lacuna.breakrules;

/**
 * Thrown when rule text cannot be parsed. Carries the position of the problem within the source.
 */
public class RuleSyntaxException extends Exception {

  private final RuleError error;
  private final int offset;
  private final int line;
  private final int column;
  private final String context;

  RuleSyntaxException(RuleError error, String detail, String source, int offset) {
    super(message(error, detail, source, offset));
    this.error = error;
    this.offset = offset;
    this.line = lineOf(source, offset);
    this.column = offset - lineStart(source, offset) + 1;
    this.context = lineText(source, offset);
  }

  /**
   * @return the kind of error
   */
  public RuleError error() {
    return error;
  }

  /**
   * @return the offset of the error from the start of the rule text
   */
  public int offset() {
    return offset;
  }

  /**
   * @return the 1-based line of the error
   */
  public int line() {
    return line;
  }

  /**
   * @return the 1-based column of the error
   */
  public int column() {
    return column;
  }

  /**
   * @return the full text of the line containing the error
   */
  public String context() {
    return context;
  }

  ///

  private static String message(RuleError error, String detail, String source, int offset) {
    StringBuilder sb = new StringBuilder(error.description());
    if (detail != null) {
      sb.append(": ").append(detail);
    }
    sb.append(" at line ").append(lineOf(source, offset))
            .append(", column ").append(offset - lineStart(source, offset) + 1);
    return sb.toString();
  }

  private static int lineOf(String source, int offset) {
    int line = 1;
    for (int i = 0; i < offset && i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        line++;
      }
    }
    return line;
  }

  private static int lineStart(String source, int offset) {
    int i = Math.min(offset, source.length());
    while (i > 0 && source.charAt(i - 1) != '\n') {
      i--;
    }
    return i;
  }

  private static String lineText(String source, int offset) {
    int start = lineStart(source, offset);
    int end = source.indexOf('\n', start);
    return source.substring(start, end < 0 ? source.length() : end);
  }
}
