package io.hosthub.backoffice.recurring;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Hand-off between a generation run and the worker generating one of its rules. Exactly one side
 * wins: the worker by completing before it commits, or the run by abandoning the attempt once it
 * stops waiting. An abandoned attempt must roll back.
 */
public final class GenerationLease {

  private enum State {
    RUNNING,
    COMPLETING,
    ABANDONED
  }

  private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

  /** Called by the worker just before commit. False if the run already gave up on it. */
  public boolean complete() {
    return state.compareAndSet(State.RUNNING, State.COMPLETING);
  }

  /** Called by the run when it stops waiting. False if the worker is already committing. */
  public boolean abandon() {
    return state.compareAndSet(State.RUNNING, State.ABANDONED);
  }

  public boolean isAbandoned() {
    return state.get() == State.ABANDONED;
  }
}
