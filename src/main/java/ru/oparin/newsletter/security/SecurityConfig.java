package ru.oparin.newsletter.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.core.userdetails.MapReactiveUserDetailsService;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import ru.oparin.newsletter.config.properties.AdminProperties;

import java.util.UUID;

@Slf4j
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .httpBasic(basic -> {})
                .authorizeExchange(auth -> auth
                        .pathMatchers("/swagger-ui/**", "/v3/api-docs/**").permitAll()
                        .pathMatchers("/health/**", "/health").permitAll()
                        .pathMatchers("/subscriptions/**", "/subscriptions").permitAll()
                        .pathMatchers("/admin/**").hasRole("ADMIN")
                        .anyExchange().denyAll()
                )
                .securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
                .build();
    }

    @Bean
    public MapReactiveUserDetailsService adminUserDetailsService(AdminProperties adminProperties,
                                                                 PasswordEncoder passwordEncoder) {
        String password = adminProperties.getPassword();
        if (password == null || password.isBlank()) {
            // Без пароля публикация выпусков фактически отключена
            log.warn("Пароль администратора не задан (app.admin.password), публикация выпусков недоступна");
            password = UUID.randomUUID().toString();
        }
        UserDetails admin = User.withUsername(adminProperties.getUsername())
                .password(passwordEncoder.encode(password))
                .roles("ADMIN")
                .build();
        return new MapReactiveUserDetailsService(admin);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
