package io.b2mash.b2b.collab.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestScopesTest {

  @Test
  void memberIdBoundWithinScope() {
    UUID id = UUID.randomUUID();
    RequestScopes.MEMBER_ID.runWhere(
        id,
        () -> {
          assertThat(RequestScopes.MEMBER_ID.get()).isEqualTo(id);
          assertThat(RequestScopes.requireMemberId()).isEqualTo(id);
          assertThat(RequestScopes.getMemberIdOrNull()).isEqualTo(id);
        });
  }

  @Test
  void memberIdUnboundOutsideScope() {
    assertThat(RequestScopes.MEMBER_ID.isBound()).isFalse();
    assertThat(RequestScopes.getMemberIdOrNull()).isNull();
    assertThatThrownBy(() -> RequestScopes.MEMBER_ID.get())
        .isInstanceOf(NoSuchElementException.class);
    assertThatThrownBy(RequestScopes::requireMemberId)
        .isInstanceOf(MemberContextNotBoundException.class);
  }

  @Test
  void nestedScopeShadowsOuter() {
    RequestScopes.REQUEST_ID.runWhere(
        "outer",
        () -> {
          String inner = RequestScopes.REQUEST_ID.callWhere("inner", RequestScopes.REQUEST_ID::get);

          assertThat(inner).isEqualTo("inner");
          assertThat(RequestScopes.REQUEST_ID.get()).isEqualTo("outer");
        });
    assertThat(RequestScopes.REQUEST_ID.isBound()).isFalse();
  }

  @Test
  void bindingIsReleasedWhenActionThrows() {
    assertThatThrownBy(
            () ->
                RequestScopes.MEMBER_ID.runWhere(
                    UUID.randomUUID(),
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);
    assertThat(RequestScopes.MEMBER_ID.isBound()).isFalse();
  }

  @Test
  void nullCannotBeBound() {
    assertThatThrownBy(() -> RequestScopes.MEMBER_ID.runWhere(null, () -> {}))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void filterChainRunsWithValueBound() throws Exception {
    UUID id = UUID.randomUUID();
    var seen = new AtomicReference<UUID>();
    var chain =
        new MockFilterChain(
            new HttpServlet() {
              @Override
              protected void service(
                  HttpServletRequest req,
                  HttpServletResponse resp) {
                seen.set(RequestScopes.MEMBER_ID.get());
              }
            });

    ScopedFilterChain.runScoped(
        RequestScopes.MEMBER_ID,
        id,
        chain,
        new MockHttpServletRequest(),
        new MockHttpServletResponse());

    assertThat(seen.get()).isEqualTo(id);
    assertThat(RequestScopes.MEMBER_ID.isBound()).isFalse();
  }

  @Test
  void filterChainReleasesValueOnServletException() {
    var chain =
        new MockFilterChain(
            new HttpServlet() {
              @Override
              protected void service(
                  HttpServletRequest req,
                  HttpServletResponse resp)
                  throws ServletException {
                throw new ServletException("downstream failure");
              }
            });

    assertThatThrownBy(
            () ->
                ScopedFilterChain.runScoped(
                    RequestScopes.MEMBER_ID,
                    UUID.randomUUID(),
                    chain,
                    new MockHttpServletRequest(),
                    new MockHttpServletResponse()))
        .isInstanceOf(ServletException.class);
    assertThat(RequestScopes.MEMBER_ID.isBound()).isFalse();
  }
}
