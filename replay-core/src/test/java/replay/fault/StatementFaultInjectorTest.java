package replay.fault;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StatementFaultInjectorTest {

  private static final String CREATE = "CREATE TABLE t (id INT PRIMARY KEY)";

  @Test
  void unarmedInjectorNeverFires() {
    StatementFaultInjector injector = new StatementFaultInjector();

    assertTrue(injector.inject(FaultPoints.LOAD_EXEC_FAILED, List.of(CREATE)).isEmpty());
    assertEquals(0, injector.hits(FaultPoints.LOAD_EXEC_FAILED));
  }

  @Test
  void armedPointReproducesErrorCode() {
    StatementFaultInjector injector = new StatementFaultInjector()
        .arm(FaultPoints.LOAD_EXEC_FAILED, 1050, "CREATE TABLE");

    for (int i = 0; i < 3; i++) {
      Optional<SQLException> injected = injector.inject(FaultPoints.LOAD_EXEC_FAILED, List.of(CREATE));
      assertTrue(injected.isPresent());
      assertEquals(1050, injected.get().getErrorCode());
    }
    assertEquals(3, injector.hits(FaultPoints.LOAD_EXEC_FAILED));
  }

  @Test
  void onlySingleStatementBatchesWithMarkerMatch() {
    StatementFaultInjector injector = new StatementFaultInjector()
        .arm(FaultPoints.LOAD_EXEC_FAILED, 1213, "CREATE TABLE");

    assertTrue(injector.inject(FaultPoints.LOAD_EXEC_FAILED, List.of("INSERT INTO t VALUES (1)")).isEmpty());
    assertTrue(injector.inject(FaultPoints.LOAD_EXEC_FAILED, List.of(CREATE, CREATE)).isEmpty());
    assertTrue(injector.inject("OtherPoint", List.of(CREATE)).isEmpty());
  }

  @Test
  void limitedArmingExpires() {
    StatementFaultInjector injector = new StatementFaultInjector()
        .armTimes(FaultPoints.LOAD_EXEC_FAILED, 1213, "CREATE TABLE", 2);

    assertTrue(injector.inject(FaultPoints.LOAD_EXEC_FAILED, List.of(CREATE)).isPresent());
    assertTrue(injector.inject(FaultPoints.LOAD_EXEC_FAILED, List.of(CREATE)).isPresent());
    assertTrue(injector.inject(FaultPoints.LOAD_EXEC_FAILED, List.of(CREATE)).isEmpty());
    assertEquals(2, injector.hits(FaultPoints.LOAD_EXEC_FAILED));
  }

  @Test
  void disarmStopsFiring() {
    StatementFaultInjector injector = new StatementFaultInjector()
        .arm(FaultPoints.LOAD_EXEC_FAILED, 1050, "CREATE TABLE");

    injector.disarm(FaultPoints.LOAD_EXEC_FAILED);

    assertTrue(injector.inject(FaultPoints.LOAD_EXEC_FAILED, List.of(CREATE)).isEmpty());
  }

  @Test
  void rejectsInvalidErrorCode() {
    StatementFaultInjector injector = new StatementFaultInjector();

    assertThrows(IllegalArgumentException.class,
        () -> injector.arm(FaultPoints.LOAD_EXEC_FAILED, 70_000, "CREATE TABLE"));
    assertThrows(IllegalArgumentException.class,
        () -> injector.armTimes(FaultPoints.LOAD_EXEC_FAILED, 1050, "CREATE TABLE", 0));
  }
}
