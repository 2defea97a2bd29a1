package io.lacuna.breakrules;

/**
 * The kinds of error a rule set can be rejected with.
 */
public enum RuleError {
  RULE_SYNTAX("syntax error in rule"),
  MISMATCHED_PAREN("mismatched parentheses"),
  UNCLOSED_SET("missing ']' in set expression"),
  MALFORMED_SET("malformed set expression"),
  RULE_EMPTY_SET("set expression matches nothing"),
  UNDEFINED_VARIABLE("undefined $variable"),
  VARIABLE_REDEFINITION("$variable is already defined"),
  HEX_DIGITS_EXPECTED("hex digits expected in escape"),
  NEW_LINE_IN_QUOTED_STRING("new line in quoted string"),
  MALFORMED_RULE_TAG("malformed {tag}"),
  UNRECOGNIZED_OPTION("unrecognized !!option");

  private final String description;

  RuleError(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
