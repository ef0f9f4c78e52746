package com.example.ghostmysql.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.*;

class MySqlExtensionTest {

  private final StageTask stage = SetupResult::skipped;
  private final List<String> registered = new ArrayList<>();
  private final StageRegistrar registrar =
      (name, task, description) -> registered.add(name + "|" + description);

  @Test
  @DisplayName("Registers the mysql stage for a networked MySQL install")
  void registersForNetworkedInstall() {
    final var added =
        new MySqlExtension(stage).setup(registrar, new SetupOptions(false, "mysql", "production"));

    assertTrue(added);
    assertEquals(List.of("mysql|\"ghost\" mysql user"), registered);
  }

  @Test
  @DisplayName("Skips registration for local installs")
  void skipsLocalInstall() {
    assertFalse(
        new MySqlExtension(stage)
            .setup(registrar, new SetupOptions(true, "mysql", "development")));
    assertTrue(registered.isEmpty());
  }

  @Test
  @DisplayName("Skips registration when sqlite3 is chosen")
  void skipsSqlite() {
    assertFalse(
        new MySqlExtension(stage)
            .setup(registrar, new SetupOptions(false, "sqlite3", "production")));
    assertTrue(registered.isEmpty());
  }
}
