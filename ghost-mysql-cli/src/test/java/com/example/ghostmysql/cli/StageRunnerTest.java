package com.example.ghostmysql.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.example.ghostmysql.core.SetupResult;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.*;

class StageRunnerTest {

  @Test
  @DisplayName("Runs stages in registration order")
  void runsInOrder() throws Exception {
    final var ran = new ArrayList<String>();
    final var runner = new StageRunner();
    runner.addStage(
        "nginx",
        () -> {
          ran.add("nginx");
          return SetupResult.skipped();
        },
        "nginx");
    runner.addStage(
        "mysql",
        () -> {
          ran.add("mysql");
          return SetupResult.skipped();
        },
        "\"ghost\" mysql user");

    final var results = runner.runAll();

    assertEquals(List.of("nginx", "mysql"), ran);
    assertEquals(List.of("nginx", "mysql"), List.copyOf(results.keySet()));
  }

  @Test
  @DisplayName("First failure stops the run")
  void firstFailureStops() {
    final var ran = new ArrayList<String>();
    final var runner = new StageRunner();
    runner.addStage(
        "mysql",
        () -> {
          throw new IllegalStateException("boom");
        },
        "mysql");
    runner.addStage(
        "systemd",
        () -> {
          ran.add("systemd");
          return SetupResult.skipped();
        },
        "systemd");

    assertThrows(IllegalStateException.class, runner::runAll);
    assertTrue(ran.isEmpty());
  }

  @Test
  @DisplayName("Stage names are unique")
  void namesAreUnique() throws Exception {
    final var runner = new StageRunner();
    runner.addStage("mysql", SetupResult::skipped, "mysql");

    assertThrows(
        IllegalArgumentException.class,
        () -> runner.addStage("mysql", SetupResult::skipped, "mysql"));
    assertEquals(List.of("mysql"), List.copyOf(runner.runAll().keySet()));
  }
}
