package kanban.model;

import java.util.Locale;

/**
 * Who may read a board without a membership.
 */
public enum Visibility {
  /** Members only. */
  PRIVATE,
  /** Members plus anyone from the board's organization (read-only). */
  ORG,
  /** Anyone (read-only). */
  PUBLIC;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Visibility fromCode(String code) {
    return Visibility.valueOf(code.toUpperCase(Locale.ROOT));
  }
}
