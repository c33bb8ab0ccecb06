package io.b2mash.b2b.collab.security;

import io.b2mash.b2b.collab.audit.AuditAuthenticationEntryPoint;
import io.b2mash.b2b.collab.context.RequestLoggingFilter;
import io.b2mash.b2b.collab.member.MemberFilter;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  private final CollabJwtAuthenticationConverter jwtAuthConverter;
  private final MemberFilter memberFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final AuditAuthenticationEntryPoint auditAuthEntryPoint;
  private final Environment environment;

  public SecurityConfig(
      CollabJwtAuthenticationConverter jwtAuthConverter,
      MemberFilter memberFilter,
      RequestLoggingFilter requestLoggingFilter,
      AuditAuthenticationEntryPoint auditAuthEntryPoint,
      Environment environment) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.memberFilter = memberFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.auditAuthEntryPoint = auditAuthEntryPoint;
    this.environment = environment;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/**")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter))
                    .authenticationEntryPoint(auditAuthEntryPoint))
        .addFilterAfter(memberFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(requestLoggingFilter, MemberFilter.class);

    return http.build();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
