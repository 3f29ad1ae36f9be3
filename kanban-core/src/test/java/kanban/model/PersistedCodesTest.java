package kanban.model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PersistedCodesTest {

  private Locale saved;

  @BeforeEach
  void setUp() {
    saved = Locale.getDefault();
    // dotless i: "I".toLowerCase() is "ı" here
    Locale.setDefault(new Locale("tr", "TR"));
  }

  @AfterEach
  void tearDown() {
    Locale.setDefault(saved);
  }

  @Test
  void visibilityCodesIgnoreDefaultLocale() {
    assertEquals("private", Visibility.PRIVATE.code());
    assertEquals("public", Visibility.PUBLIC.code());
    for (Visibility visibility : Visibility.values()) {
      assertEquals(visibility, Visibility.fromCode(visibility.code()));
    }
  }

  @Test
  void roleCodesIgnoreDefaultLocale() {
    assertEquals("admin", Role.ADMIN.code());
    assertEquals(Role.ADMIN, Role.fromCode("admin"));
    for (Role role : Role.values()) {
      assertEquals(role, Role.fromCode(role.code()));
    }
  }
}
