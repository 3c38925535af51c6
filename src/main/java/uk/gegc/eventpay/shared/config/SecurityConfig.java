package uk.gegc.eventpay.shared.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import uk.gegc.eventpay.shared.api.problem.ErrorTypes;
import uk.gegc.eventpay.shared.api.problem.ProblemDetailBuilder;

import java.io.IOException;

/**
 * Providers call the webhook endpoints without credentials: the payload signature is their
 * authentication, checked inside the endpoint. Only health and API docs are otherwise open.
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private static final String[] WEBHOOK_ENDPOINTS = {"/webhooks/stripe", "/webhooks/paypal"};
    private static final String[] PUBLIC_READ_ENDPOINTS = {
            "/actuator/health", "/actuator/health/**", "/v3/api-docs/**", "/swagger-ui/**"
    };

    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        return http
                // No browser sessions and no cookies, so CSRF tokens would only block providers
                .csrf(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.POST, WEBHOOK_ENDPOINTS).permitAll()
                        .requestMatchers(HttpMethod.GET, PUBLIC_READ_ENDPOINTS).permitAll()
                        .anyRequest().authenticated())
                .exceptionHandling(handling -> handling
                        .authenticationEntryPoint((request, response, ex) -> writeProblem(response,
                                ProblemDetailBuilder.create(HttpStatus.UNAUTHORIZED, ErrorTypes.UNAUTHORIZED,
                                        "Unauthorized", "Authentication is required to access this resource", request)))
                        .accessDeniedHandler((request, response, ex) -> writeProblem(response,
                                ProblemDetailBuilder.create(HttpStatus.FORBIDDEN, ErrorTypes.ACCESS_DENIED,
                                        "Access Denied", "You do not have permission to access this resource", request))))
                .build();
    }

    private void writeProblem(HttpServletResponse response, ProblemDetail problem) throws IOException {
        response.setStatus(problem.getStatus());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
