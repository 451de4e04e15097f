package com.homepurse.analysis.config;

import com.homepurse.analysis.security.JsonAuthErrorHandlers;
import com.homepurse.analysis.security.TraceIdFilter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtDecoders;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {
    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            TraceIdFilter traceIdFilter,
            JwtAuthenticationConverter jwtAuthenticationConverter,
            JsonAuthErrorHandlers jsonAuthErrorHandlers
    ) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(registry -> registry
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                // Analysis endpoints always need a verified identity; household scope is derived from it
                .requestMatchers("/analysis/**", "/api/analysis/**").authenticated()
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(resource -> resource
                .authenticationEntryPoint(jsonAuthErrorHandlers)
                .accessDeniedHandler(jsonAuthErrorHandlers)
                .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter))
            );

        http.addFilterBefore(traceIdFilter, UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    @Bean
    JwtAuthenticationConverter jwtAuthenticationConverter() {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setPrincipalClaimName("sub");
        converter.setJwtGrantedAuthoritiesConverter(jwt -> List.of());
        return converter;
    }

    @Bean
    public JwtDecoder jwtDecoder(HomepurseProperties properties, Environment environment) {
        HomepurseProperties.Security security = properties.security();
        if (security.hasIssuer()) {
            log.info("Security: using issuer {}", security.issuer());
            return JwtDecoders.fromIssuerLocation(security.issuer());
        }
        if (security.hasDevJwtSecret() && !environment.acceptsProfiles(Profiles.of("prod"))) {
            log.warn("Security: no issuer configured; falling back to dev shared secret (non-prod only)");
            SecretKeySpec key = new SecretKeySpec(security.devJwtSecret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
            NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key)
                    .macAlgorithm(MacAlgorithm.HS256)
                    .build();
            decoder.setJwtValidator(token -> OAuth2TokenValidatorResult.success());
            return decoder;
        }
        throw new IllegalStateException("Neither an issuer nor a dev JWT secret is configured (set HOMEPURSE_JWT_ISSUER or HOMEPURSE_DEV_JWT_SECRET)");
    }
}
