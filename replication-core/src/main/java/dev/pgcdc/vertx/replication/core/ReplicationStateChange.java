package dev.pgcdc.vertx.replication.core;

public final class ReplicationStateChange {
  private final ReplicationStreamState previousState;
  private final ReplicationStreamState state;
  private final Throwable cause;
  private final long attempt;
  private final String position;

  public ReplicationStateChange(ReplicationStreamState previousState,
                                ReplicationStreamState state,
                                Throwable cause,
                                long attempt,
                                String position) {
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.attempt = attempt;
    this.position = position;
  }

  public ReplicationStreamState previousState() {
    return previousState;
  }

  public ReplicationStreamState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }

  /**
   * Session attempt number, starting at 1 for the first bootstrap.
   */
  public long attempt() {
    return attempt;
  }

  /**
   * Last confirmed log position in its textual form, or {@code null} before the first session
   * confirmed anything.
   */
  public String position() {
    return position;
  }

  @Override
  public String toString() {
    return "ReplicationStateChange{" +
      previousState + " -> " + state +
      ", attempt=" + attempt +
      ", position=" + position +
      (cause == null ? "" : ", cause=" + cause) +
      '}';
  }
}
