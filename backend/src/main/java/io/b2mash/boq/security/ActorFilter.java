package io.b2mash.boq.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Binds the JWT subject and role to {@link ActorContext} for the rest of the request. */
@Component
public class ActorFilter extends OncePerRequestFilter {

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (!(auth instanceof JwtAuthenticationToken jwtAuth)) {
      // Anonymous catalog reads
      filterChain.doFilter(request, response);
      return;
    }

    try {
      ActorContext.set(
          jwtAuth.getToken().getSubject(), JwtClaimUtils.extractRole(jwtAuth.getToken()));
      filterChain.doFilter(request, response);
    } finally {
      ActorContext.clear();
    }
  }
}
