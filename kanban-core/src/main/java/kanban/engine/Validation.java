package kanban.engine;

import kanban.InvalidArgumentException;

import java.util.regex.Pattern;

/**
 * Input checks shared by engine operations. Failures raise {@link InvalidArgumentException}.
 */
final class Validation {
  static final int MAX_TITLE_LENGTH = 512;
  static final int MAX_LABEL_NAME_LENGTH = 64;
  static final int MAX_TEXT_LENGTH = 10_000;

  private static final Pattern COLOR = Pattern.compile("#[0-9a-fA-F]{6}");

  private Validation() {}

  /** Returns the stripped title. */
  static String title(String title) {
    return nonBlank(title, "title", MAX_TITLE_LENGTH);
  }

  static String labelName(String name) {
    return nonBlank(name, "label name", MAX_LABEL_NAME_LENGTH);
  }

  static String commentBody(String body) {
    return nonBlank(body, "comment body", MAX_TEXT_LENGTH);
  }

  /** {@code null} clears the description. */
  static String description(String description) {
    if (description != null && description.length() > MAX_TEXT_LENGTH) {
      throw new InvalidArgumentException("description exceeds " + MAX_TEXT_LENGTH + " characters");
    }
    return description;
  }

  /** Returns the color in lower case. */
  static String color(String color) {
    if (color == null || !COLOR.matcher(color).matches()) {
      throw new InvalidArgumentException("color must be #RRGGBB, got: " + color);
    }
    return color.toLowerCase();
  }

  private static String nonBlank(String value, String name, int maxLength) {
    if (value == null || value.isBlank()) {
      throw new InvalidArgumentException(name + " cannot be blank");
    }
    String stripped = value.strip();
    if (stripped.length() > maxLength) {
      throw new InvalidArgumentException(name + " exceeds " + maxLength + " characters");
    }
    return stripped;
  }
}
