package io.mylab.lab.labplatform.security;

import java.util.Collection;
import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/** Maps the {@code o.rol} claim to a single {@code ROLE_*} authority. */
@Component
public class LabJwtAuthenticationConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    String role = LabJwtUtils.extractRole(jwt);
    if (role == null) {
      return List.of();
    }
    try {
      return List.of(new SimpleGrantedAuthority(PlatformRole.fromValue(role).authority()));
    } catch (IllegalArgumentException e) {
      return List.of();
    }
  }
}
