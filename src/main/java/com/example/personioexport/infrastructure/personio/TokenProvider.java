package com.example.personioexport.infrastructure.personio;

import com.example.personioexport.config.PersonioProperties;
import com.example.personioexport.domain.model.Credential;
import com.example.personioexport.infrastructure.exception.PersonioAuthenticationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Obtains and caches the bearer credential for the Personio API.
 * <p>
 * Reads are lock-free; refreshes are serialized so that concurrent document workers detecting
 * expiry at the same time trigger a single credential exchange.
 */
@Component
public class TokenProvider {

    private static final Logger log = LoggerFactory.getLogger(TokenProvider.class);

    private final RestClient restClient;
    private final PersonioProperties.Api api;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile Credential cached;

	/**
	 * Creates the provider.
	 *
	 * @param personioRestClient client rooted at the Personio base URL
	 * @param properties         export configuration holding the client identity
	 * @param clock              clock used for expiry checks
	 */
    public TokenProvider(RestClient personioRestClient, PersonioProperties properties, Clock clock) {
        this.restClient = personioRestClient;
        this.api = properties.api();
        this.clock = clock;
    }

	/**
	 * Returns the cached credential while it is usable, otherwise exchanges the client identity
	 * for a new one.
	 *
	 * @return usable credential
	 * @throws PersonioAuthenticationException when the exchange fails
	 */
    public Credential getValidToken() {
        Credential current = cached;
        if (isUsable(current)) {
            return current;
        }
        refreshLock.lock();
        try {
            current = cached;
            if (isUsable(current)) {
                return current;
            }
            cached = exchange();
            return cached;
        } finally {
            refreshLock.unlock();
        }
    }

	/**
	 * Replaces a credential the API rejected.
	 * When another caller already replaced {@code rejected} while this one waited, the newer
	 * credential is returned without a second exchange.
	 *
	 * @param rejected credential that produced a 401
	 * @return fresh credential
	 * @throws PersonioAuthenticationException when the exchange fails
	 */
    public Credential forceRefresh(Credential rejected) {
        refreshLock.lock();
        try {
            Credential current = cached;
            if (current != null && current != rejected && isUsable(current)) {
                return current;
            }
            cached = exchange();
            return cached;
        } finally {
            refreshLock.unlock();
        }
    }

    private boolean isUsable(Credential credential) {
        return credential != null && credential.isUsableAt(clock.instant(), api.tokenSafetyMargin());
    }

    private Credential exchange() {
        log.info("Authenticating with Personio API...");
        JsonNode response;
        try {
            response = restClient.post()
                    .uri(PersonioPaths.resolve(api.endpoints().auth()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(Map.of("client_id", api.clientId(), "client_secret", api.clientSecret()))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            log.error("Personio rejected the credential exchange with status {}", ex.getStatusCode().value());
            throw new PersonioAuthenticationException(
                    "Credential exchange failed with status " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            log.error("Credential exchange with Personio failed: {}", ex.getMessage());
            throw new PersonioAuthenticationException("Failed to authenticate: " + ex.getMessage(), ex);
        }

        JsonNode data = response == null ? null : response.path("data");
        String token = data == null ? "" : data.path("token").asText("");
        if (token.isBlank()) {
            log.error("Credential exchange returned no token");
            throw new PersonioAuthenticationException("Unexpected token response structure: no data.token field");
        }
        long expiresIn = data.path("expires_in").asLong(0);
        Duration lifetime = expiresIn > 0 ? Duration.ofSeconds(expiresIn) : api.tokenLifetime();
        Instant expiresAt = clock.instant().plus(lifetime);
        log.info("Successfully authenticated, token valid until {}", expiresAt);
        return new Credential(token, expiresAt);
    }
}
