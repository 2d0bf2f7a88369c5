package com.example.auth.config;

import com.example.auth.service.AuthMetrics;
import com.example.auth.token.AccessTokenVerifier;
import com.example.auth.token.AuthenticatedPrincipal;
import com.example.auth.token.InvalidAccessTokenException;
import com.example.common.RequestIds;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Bearer トークンを検証し、成功時に {@link AuthenticatedPrincipal} を SecurityContext へ載せる。
 *
 * <p>検証に失敗しても応答はここでは書かず、認証が必要な経路だけが EntryPoint で 401 になる。
 */
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  private static final String USER_ROLE = "ROLE_USER";

  /** 後段の {@link RequestMdcInterceptor} が同じ request_id を使うためのリクエスト属性名。 */
  static final String REQUEST_ID_ATTRIBUTE =
      BearerTokenAuthenticationFilter.class.getName() + ".REQUEST_ID";

  private final AuthTokenProperties properties;
  private final AccessTokenVerifier accessTokenVerifier;
  private final AuthMetrics authMetrics;

  public BearerTokenAuthenticationFilter(
      AuthTokenProperties properties,
      AccessTokenVerifier accessTokenVerifier,
      AuthMetrics authMetrics) {
    this.properties = properties;
    this.accessTokenVerifier = accessTokenVerifier;
    this.authMetrics = authMetrics;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    request.setAttribute(
        REQUEST_ID_ATTRIBUTE,
        RequestIds.resolve(request.getHeader(RequestMdcInterceptor.REQUEST_ID_HEADER)));
    final Optional<String> token =
        BearerTokenExtractor.extract(request.getHeader(properties.headerName()));
    if (token.isPresent()) {
      authenticate(request, token.get());
    }
    filterChain.doFilter(request, response);
  }

  private void authenticate(HttpServletRequest request, String token) {
    try {
      final AuthenticatedPrincipal principal = accessTokenVerifier.verify(token);
      final UsernamePasswordAuthenticationToken authentication =
          UsernamePasswordAuthenticationToken.authenticated(
              principal, null, List.of(new SimpleGrantedAuthority(USER_ROLE)));
      final SecurityContext context = SecurityContextHolder.createEmptyContext();
      context.setAuthentication(authentication);
      SecurityContextHolder.setContext(context);
      authMetrics.recordTokenVerification("success");
    } catch (InvalidAccessTokenException ex) {
      SecurityContextHolder.clearContext();
      authMetrics.recordTokenVerification(ex.reason().name().toLowerCase(Locale.ROOT));
      // インターセプタより前に動くため、ここでは request_id を自前で MDC に載せる
      try (MDC.MDCCloseable ignored =
          MDC.putCloseable("request_id", (String) request.getAttribute(REQUEST_ID_ATTRIBUTE))) {
        logger.warn(
            "bearer token rejected: reason={} path={}", ex.reason(), request.getRequestURI());
      }
    }
  }
}
