package kanban.engine;

import kanban.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidationTest {

  @Test
  void titleIsStripped() {
    assertEquals("Todo", Validation.title("  Todo\t"));
  }

  @Test
  void blankOrMissingTitleRejected() {
    assertThrows(InvalidArgumentException.class, () -> Validation.title(null));
    assertThrows(InvalidArgumentException.class, () -> Validation.title(""));
    assertThrows(InvalidArgumentException.class, () -> Validation.title(" \n "));
  }

  @Test
  void titleLengthIsBounded() {
    assertEquals(512, Validation.title("x".repeat(512)).length());
    assertThrows(InvalidArgumentException.class, () -> Validation.title("x".repeat(513)));
  }

  @Test
  void labelNameIsShorterThanTitle() {
    assertEquals("bug", Validation.labelName(" bug "));
    assertThrows(InvalidArgumentException.class, () -> Validation.labelName("x".repeat(65)));
  }

  @Test
  void descriptionMayBeNullButNotHuge() {
    assertNull(Validation.description(null));
    assertEquals("", Validation.description(""));
    assertThrows(InvalidArgumentException.class, () -> Validation.description("x".repeat(10_001)));
  }

  @Test
  void commentBodyMustHaveText() {
    assertEquals("LGTM", Validation.commentBody("LGTM"));
    assertThrows(InvalidArgumentException.class, () -> Validation.commentBody("  "));
  }

  @Test
  void colorIsHexAndLowerCased() {
    assertEquals("#a0b1c2", Validation.color("#A0B1C2"));
    assertThrows(InvalidArgumentException.class, () -> Validation.color("red"));
    assertThrows(InvalidArgumentException.class, () -> Validation.color("#abc"));
    assertThrows(InvalidArgumentException.class, () -> Validation.color(null));
  }
}
