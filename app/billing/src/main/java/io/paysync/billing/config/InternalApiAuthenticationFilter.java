package io.paysync.billing.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String INTERNAL_PATH_PREFIX = "/internal/";

  private final BillingInternalApiProperties properties;

  public InternalApiAuthenticationFilter(BillingInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith(INTERNAL_PATH_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (isValidInternalToken(request.getHeader(properties.headerName()))) {
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(
              "provider-webhook-boundary",
              "N/A",
              List.of(new SimpleGrantedAuthority(INTERNAL_ROLE)));
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "internal authentication not established for protected path={}",
          request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private boolean isValidInternalToken(String actualToken) {
    if (actualToken == null || properties.token().isBlank()) {
      return false;
    }
    // constant-time comparison; the token is a shared secret
    return MessageDigest.isEqual(
        actualToken.getBytes(StandardCharsets.UTF_8),
        properties.token().getBytes(StandardCharsets.UTF_8));
  }
}
