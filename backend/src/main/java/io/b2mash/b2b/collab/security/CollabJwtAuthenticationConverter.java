package io.b2mash.b2b.collab.security;

import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/** Every bearer of a valid token with a subject is a user of the API. */
@Component
public class CollabJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    if (jwt.getSubject() == null) {
      return new JwtAuthenticationToken(jwt, List.of());
    }
    return new JwtAuthenticationToken(
        jwt, List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_USER)), jwt.getSubject());
  }
}
