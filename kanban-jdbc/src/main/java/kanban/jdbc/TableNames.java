package kanban.jdbc;

import java.util.Objects;

/**
 * Table naming for the board schema. All tables share one configurable prefix.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "kb_";
  private static final String PREFIX_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private final String board;
  private final String membership;
  private final String list;
  private final String card;
  private final String cardLabel;
  private final String label;
  private final String comment;

  private TableNames(String prefix) {
    this.board = prefix + "board";
    this.membership = prefix + "membership";
    this.list = prefix + "list";
    this.card = prefix + "card";
    this.cardLabel = prefix + "card_label";
    this.label = prefix + "label";
    this.comment = prefix + "comment";
  }

  public static TableNames withPrefix(String prefix) {
    return new TableNames(validatePrefix(prefix));
  }

  public static TableNames defaults() {
    return new TableNames(DEFAULT_PREFIX);
  }

  /**
   * @throws IllegalArgumentException if the prefix is not a plain SQL identifier
   */
  public static String validatePrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.matches(PREFIX_PATTERN)) {
      throw new IllegalArgumentException("Invalid table prefix: " + prefix);
    }
    return prefix;
  }

  public String board() {
    return board;
  }

  public String membership() {
    return membership;
  }

  public String list() {
    return list;
  }

  public String card() {
    return card;
  }

  public String cardLabel() {
    return cardLabel;
  }

  public String label() {
    return label;
  }

  public String comment() {
    return comment;
  }
}
