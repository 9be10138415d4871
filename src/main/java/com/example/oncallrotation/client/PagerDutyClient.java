package com.example.oncallrotation.client;

import com.example.oncallrotation.client.ClientModels.OnCallUser;
import com.example.oncallrotation.client.ClientModels.ScheduleUsersResponse;
import com.example.oncallrotation.config.PagerDutyProperties;
import com.example.oncallrotation.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Client for the PagerDuty REST API.
 * <p>
 * Single attempt per call, guarded by a Resilience4j circuit breaker.
 */
@Slf4j
@Component
public class PagerDutyClient {

    static final String SERVICE_NAME = "PagerDuty";

    private static final DateTimeFormatter QUERY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final WebClient webClient;
    private final Duration timeout;

    public PagerDutyClient(@Qualifier("pagerDutyWebClient") WebClient webClient, PagerDutyProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    /**
     * Users on call for a schedule within {@code [since, until)}, in the order PagerDuty returns them
     *
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "pagerDuty", fallbackMethod = "getOnCallUsersFallback")
    public List<OnCallUser> getOnCallUsers(String scheduleId, String apiToken, Instant since, Instant until) {
        log.debug("Calling PagerDuty for users on schedule {} between {} and {}", scheduleId, since, until);

        try {
            var response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/schedules/{scheduleId}/users")
                            .queryParam("time_zone", "UTC")
                            .queryParam("since", "{since}")
                            .queryParam("until", "{until}")
                            .build(scheduleId, QUERY_TIME.format(since), QUERY_TIME.format(until)))
                    .header(HttpHeaders.AUTHORIZATION, "Token token=" + apiToken)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .bodyToMono(ScheduleUsersResponse.class)
                    .timeout(timeout)
                    .block();

            var users = response == null || response.getUsers() == null ? List.<OnCallUser>of() : response.getUsers();
            log.info("PagerDuty schedule {} has {} user(s) on call", scheduleId, users.size());
            return users;
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to get on-call users for schedule {}: {}", scheduleId, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback method when circuit breaker is open or the call failed
     */
    @SuppressWarnings("unused")
    private List<OnCallUser> getOnCallUsersFallback(String scheduleId, String apiToken, Instant since, Instant until, Exception e) {
        if (e instanceof ExternalServiceException externalServiceException) {
            throw externalServiceException;
        }
        log.warn("Circuit breaker open for PagerDuty, schedule: {}, error: {}", scheduleId, e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }
}
