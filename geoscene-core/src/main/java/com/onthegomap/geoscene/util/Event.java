package com.onthegomap.geoscene.util;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A signal that notifies every registered listener when it is raised.
 * <p>
 * Listeners run synchronously on the thread that calls {@link #raise(Object)}, in the order they were added. A
 * listener that throws is logged and does not prevent the remaining listeners from running.
 *
 * @param <T> type of the payload handed to listeners
 */
public class Event<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Event.class);
  private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

  /**
   * Registers {@code listener} to be called each time this event is raised.
   *
   * @return a handle that removes the listener when run
   */
  public Runnable addListener(Consumer<? super T> listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  public boolean removeListener(Consumer<? super T> listener) {
    return listeners.remove(listener);
  }

  public int numberOfListeners() {
    return listeners.size();
  }

  /** Calls every listener with {@code payload}. */
  public void raise(T payload) {
    for (var listener : listeners) {
      try {
        listener.accept(payload);
      } catch (RuntimeException e) {
        LOGGER.error("Event listener {} failed", listener, e);
      }
    }
  }
}
