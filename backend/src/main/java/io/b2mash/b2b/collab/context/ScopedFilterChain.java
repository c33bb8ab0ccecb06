package io.b2mash.b2b.collab.context;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Runs the rest of a servlet filter chain with a {@link RequestValue} bound, keeping the filter
 * contract's checked exceptions (IOException, ServletException) intact.
 */
public final class ScopedFilterChain {

  private ScopedFilterChain() {}

  /**
   * Binds {@code value} to {@code key}, continues the chain and restores the previous binding on
   * every exit path.
   */
  public static <T> void runScoped(
      RequestValue<T> key,
      T value,
      FilterChain chain,
      HttpServletRequest request,
      HttpServletResponse response)
      throws ServletException, IOException {
    T previous = key.bind(value);
    try {
      chain.doFilter(request, response);
    } finally {
      key.restore(previous);
    }
  }
}
