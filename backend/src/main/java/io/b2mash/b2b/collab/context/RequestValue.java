package io.b2mash.b2b.collab.context;

import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * A value bound for the extent of a single call, usually one HTTP request. Bindings nest: the
 * previous value is restored when the binding call returns, on any exit path.
 */
public final class RequestValue<T> {

  private final String name;
  private final ThreadLocal<T> holder = new ThreadLocal<>();

  private RequestValue(String name) {
    this.name = name;
  }

  public static <T> RequestValue<T> named(String name) {
    return new RequestValue<>(name);
  }

  public String name() {
    return name;
  }

  public boolean isBound() {
    return holder.get() != null;
  }

  /** Returns the bound value. Throws {@link NoSuchElementException} if nothing is bound. */
  public T get() {
    T value = holder.get();
    if (value == null) {
      throw new NoSuchElementException(name + " is not bound");
    }
    return value;
  }

  public T orElse(T fallback) {
    T value = holder.get();
    return value != null ? value : fallback;
  }

  public void runWhere(T value, Runnable action) {
    callWhere(
        value,
        () -> {
          action.run();
          return null;
        });
  }

  public <R> R callWhere(T value, Supplier<R> action) {
    T previous = bind(value);
    try {
      return action.get();
    } finally {
      restore(previous);
    }
  }

  T bind(T value) {
    if (value == null) {
      throw new IllegalArgumentException("Cannot bind null to " + name);
    }
    T previous = holder.get();
    holder.set(value);
    return previous;
  }

  void restore(T previous) {
    if (previous == null) {
      holder.remove();
    } else {
      holder.set(previous);
    }
  }
}
