package replay.fault;

/**
 * Names of the fault injection points consulted by the replay layer.
 */
public final class FaultPoints {

  /**
   * Consulted before every attempt of a statement batch. Fires only for single-statement
   * batches whose statement contains the armed marker.
   */
  public static final String LOAD_EXEC_FAILED = "LoadExecFailed";

  private FaultPoints() {
  }
}
