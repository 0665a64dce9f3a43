package com.example.personioexport.infrastructure.personio;

import com.example.personioexport.config.PersonioProperties;
import com.example.personioexport.domain.model.Credential;
import com.example.personioexport.infrastructure.exception.PersonioApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Single choke point for outbound Personio resource calls.
 * <p>
 * Every call carries the bearer token from {@link TokenProvider}. A 401 triggers one forced token
 * refresh and one repeat of the call, which does not count as an attempt. Connection errors,
 * timeouts, 5xx and 429 responses are retried by a {@link RetryTemplate} with exponential backoff
 * up to {@code retryMaxAttempts} physical attempts, honoring {@code Retry-After} on 429. Any other
 * non-success status fails immediately.
 */
@Component
public class PersonioHttpGateway {

    private static final Logger log = LoggerFactory.getLogger(PersonioHttpGateway.class);
    private static final int TOO_MANY_REQUESTS = 429;
    private static final int UNAUTHORIZED = 401;
    private static final String CREDENTIAL_REFRESHED = "personio.credential-refreshed";

    private final RestClient restClient;
    private final TokenProvider tokenProvider;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String baseUrl;
    private final int maxAttempts;
    private final int pageSize;
    private final int maxPages;
    private final RetryTemplate retryTemplate;

	/**
	 * Creates the gateway.
	 *
	 * @param personioRestClient client rooted at the Personio base URL
	 * @param tokenProvider      source of bearer credentials
	 * @param properties         export configuration (retry, paging)
	 * @param objectMapper       JSON decoder for response bodies
	 * @param sleeper            pause between attempts
	 * @param clock              clock used to interpret {@code Retry-After} dates
	 */
    public PersonioHttpGateway(RestClient personioRestClient,
                               TokenProvider tokenProvider,
                               PersonioProperties properties,
                               ObjectMapper objectMapper,
                               Sleeper sleeper,
                               Clock clock) {
        PersonioProperties.Api api = properties.api();
        this.restClient = personioRestClient;
        this.tokenProvider = tokenProvider;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.baseUrl = api.baseUrl();
        this.maxAttempts = api.retryMaxAttempts();
        this.pageSize = api.pageSize();
        this.maxPages = api.maxPages();

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(maxAttempts,
                Map.<Class<? extends Throwable>, Boolean>of(
                        ResourceAccessException.class, true,
                        TransientStatusException.class, true)));
        template.setBackOffPolicy(new RetryAfterBackOffPolicy(api.retryBaseDelay(), api.retryMaxDelay(), sleeper));
        this.retryTemplate = template;
    }

	/**
	 * Issues one logical JSON request.
	 *
	 * @param method   HTTP method
	 * @param endpoint endpoint, see {@link PersonioPaths#resolve(String)}
	 * @param params   query parameters, may be empty
	 * @return decoded response
	 * @throws PersonioApiException when the call fails for good
	 */
    public ParsedPage request(HttpMethod method, String endpoint, Map<String, ?> params) {
        RawResponse response = execute(method, endpoint, params, MediaType.APPLICATION_JSON);
        return decode(endpoint, response);
    }

	/**
	 * Lazily walks every page of a collection endpoint in server order.
	 * Each advance of the returned stream fetches at most one page; the stream is single-use and a
	 * fresh traversal requires calling this method again.
	 *
	 * @param method   HTTP method, normally GET
	 * @param endpoint collection endpoint
	 * @param params   initial query parameters
	 * @return ordered, finite stream of non-empty pages
	 * @throws PersonioApiException from the stream when a page cannot be fetched
	 */
    public Stream<ParsedPage> paginate(HttpMethod method, String endpoint, Map<String, ?> params) {
        PageIterator iterator = new PageIterator(method, endpoint, params);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

	/**
	 * Downloads a binary payload under the same auth and retry rules as JSON calls.
	 *
	 * @param endpoint download endpoint or absolute URL
	 * @return response body bytes
	 * @throws PersonioApiException when the download fails for good
	 */
    public byte[] download(String endpoint) {
        return execute(HttpMethod.GET, endpoint, Map.of(), MediaType.ALL).body();
    }

    private RawResponse execute(HttpMethod method, String endpoint, Map<String, ?> params, MediaType accept) {
        URI uri = buildUri(endpoint, params);
        try {
            return retryTemplate.execute(context -> attempt(context, method, uri, endpoint, accept));
        } catch (TransientStatusException ex) {
            throw new PersonioApiException("Giving up on " + endpoint + " after " + maxAttempts
                    + " attempts, last status " + ex.status, ex.status, endpoint);
        } catch (ResourceAccessException ex) {
            throw new PersonioApiException("Network error after " + maxAttempts + " attempts for "
                    + endpoint + ": " + ex.getMessage(), PersonioApiException.NO_STATUS, endpoint, ex);
        } catch (BackOffInterruptedException ex) {
            throw new PersonioApiException("Interrupted while waiting to retry " + endpoint,
                    PersonioApiException.NO_STATUS, endpoint, ex);
        }
    }

	/**
	 * One physical attempt, plus the single repeat after a 401.
	 *
	 * @throws TransientStatusException on 5xx and 429, to be retried by the template
	 * @throws ResourceAccessException  on connection errors and timeouts, to be retried by the template
	 */
    private RawResponse attempt(RetryContext context, HttpMethod method, URI uri, String endpoint, MediaType accept) {
        int attempt = context.getRetryCount() + 1;
        Credential credential = tokenProvider.getValidToken();
        RawResponse response = send(method, uri, endpoint, credential, accept, attempt);
        if (response.status() == UNAUTHORIZED && !context.hasAttribute(CREDENTIAL_REFRESHED)) {
            log.warn("Received 401 from {}, refreshing token and repeating the call once", endpoint);
            context.setAttribute(CREDENTIAL_REFRESHED, Boolean.TRUE);
            tokenProvider.forceRefresh(credential);
            response = send(method, uri, endpoint, tokenProvider.getValidToken(), accept, attempt);
        }

        int status = response.status();
        if (status >= 200 && status < 300) {
            return response;
        }
        if (isTransient(status)) {
            Optional<Duration> retryAfter = status == TOO_MANY_REQUESTS
                    ? RetryAfterBackOffPolicy.parseRetryAfter(response.headers().getFirst(HttpHeaders.RETRY_AFTER), clock)
                    : Optional.empty();
            if (retryAfter.isPresent()) {
                context.setAttribute(RetryAfterBackOffPolicy.RETRY_AFTER_ATTRIBUTE, retryAfter.get());
            } else {
                context.removeAttribute(RetryAfterBackOffPolicy.RETRY_AFTER_ATTRIBUTE);
            }
            log.warn("{} {} returned {} (attempt {}/{})", method, endpoint, status, attempt, maxAttempts);
            throw new TransientStatusException(status);
        }
        throw new PersonioApiException("Personio API request failed with status " + status + " for " + endpoint,
                status, endpoint);
    }

    private RawResponse send(HttpMethod method, URI uri, String endpoint, Credential credential,
                             MediaType accept, int attempt) {
        try {
            return exchange(method, uri, credential, accept);
        } catch (ResourceAccessException ex) {
            log.warn("Network error on {} {} (attempt {}/{}): {}",
                    method, endpoint, attempt, maxAttempts, ex.getMessage());
            throw ex;
        }
    }

    private RawResponse exchange(HttpMethod method, URI uri, Credential credential, MediaType accept) {
        return restClient.method(method)
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + credential.accessToken())
                .accept(accept)
                .exchange((request, response) -> {
                    HttpHeaders headers = new HttpHeaders();
                    headers.putAll(response.getHeaders());
                    return new RawResponse(response.getStatusCode().value(), headers,
                            StreamUtils.copyToByteArray(response.getBody()));
                });
    }

    private static boolean isTransient(int status) {
        return status == TOO_MANY_REQUESTS || status >= 500;
    }

    private ParsedPage decode(String endpoint, RawResponse response) {
        if (response.body().length == 0) {
            return new ParsedPage(response.status(), MissingNode.getInstance());
        }
        try {
            return new ParsedPage(response.status(), objectMapper.readTree(response.body()));
        } catch (IOException ex) {
            throw new PersonioApiException("Malformed JSON payload from " + endpoint, response.status(), endpoint, ex);
        }
    }

    private URI buildUri(String endpoint, Map<String, ?> params) {
        String resolved = PersonioPaths.resolve(endpoint);
        if (params.isEmpty() && PersonioPaths.isAbsolute(resolved)) {
            return URI.create(resolved);
        }
        String target = PersonioPaths.isAbsolute(resolved) ? resolved : baseUrl + resolved;
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(target);
        Map<String, Object> variables = new HashMap<>();
        int index = 0;
        for (Map.Entry<String, ?> param : params.entrySet()) {
            String variable = "p" + index++;
            builder.queryParam(param.getKey(), "{" + variable + "}");
            variables.put(variable, param.getValue());
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

    private record RawResponse(int status, HttpHeaders headers, byte[] body) {
    }

    /**
     * Signals a retryable status to the {@link RetryTemplate}.
     */
    private static final class TransientStatusException extends RuntimeException {

        private final int status;

        private TransientStatusException(int status) {
            super("Transient status " + status, null, false, false);
            this.status = status;
        }
    }

    /**
     * Iterator behind {@link #paginate}. Owns the pagination cursor of one traversal.
     */
    private final class PageIterator implements Iterator<ParsedPage> {

        private final HttpMethod method;
        private final String endpoint;
        private final Map<String, Object> params;
        private int pagesFetched;
        private int recordsFetched;
        private boolean exhausted;
        private ParsedPage next;

        private PageIterator(HttpMethod method, String endpoint, Map<String, ?> initialParams) {
            this.method = method;
            this.endpoint = endpoint;
            this.params = new LinkedHashMap<>(initialParams);
            this.params.putIfAbsent("limit", pageSize);
            this.params.putIfAbsent("offset", 0);
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = fetchNext();
            }
            return next != null;
        }

        @Override
        public ParsedPage next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more pages for " + endpoint);
            }
            ParsedPage page = next;
            next = null;
            return page;
        }

        private ParsedPage fetchNext() {
            if (pagesFetched >= maxPages) {
                log.warn("Reached max pages limit ({}) for {}. Data might be incomplete.", maxPages, endpoint);
                exhausted = true;
                return null;
            }
            log.debug("Fetching page {} for {}...", pagesFetched + 1, endpoint);
            ParsedPage page = request(method, endpoint, params);
            pagesFetched++;

            List<JsonNode> records = page.records();
            if (records.isEmpty()) {
                log.debug("No more data for {} at page {}", endpoint, pagesFetched);
                exhausted = true;
                return null;
            }
            recordsFetched += records.size();
            if (page.isSingleObject()) {
                exhausted = true;
                return page;
            }
            advance(page.metadata(), records.size());
            log.info("Fetched page {} for {} ({} records so far)", pagesFetched, endpoint, recordsFetched);
            return page;
        }

        private void advance(JsonNode metadata, int pageRecordCount) {
            if (metadata.has("next_cursor") || metadata.path("links").has("next")) {
                String cursor = nextCursor(metadata);
                if (cursor.isEmpty()) {
                    exhausted = true;
                } else {
                    params.remove("offset");
                    params.put("cursor", cursor);
                }
                return;
            }
            if (metadata.has("total_pages")) {
                int totalPages = metadata.path("total_pages").asInt(1);
                int currentPage = metadata.path("current_page").asInt(pagesFetched);
                if (currentPage >= totalPages) {
                    exhausted = true;
                } else {
                    params.put("page", currentPage + 1);
                    params.put("offset", recordsFetched);
                }
                return;
            }
            if (pageRecordCount < limit()) {
                exhausted = true;
            } else {
                params.put("offset", recordsFetched);
            }
        }

        private String nextCursor(JsonNode metadata) {
            String cursor = PersonioJson.text(metadata.get("next_cursor"));
            if (!cursor.isEmpty()) {
                return cursor;
            }
            String href = PersonioJson.text(metadata.path("links").path("next").get("href"));
            if (href.isEmpty()) {
                return "";
            }
            String encoded = UriComponentsBuilder.fromUriString(href).build().getQueryParams().getFirst("cursor");
            return encoded == null ? "" : UriUtils.decode(encoded, StandardCharsets.UTF_8);
        }

        private int limit() {
            Object limit = params.get("limit");
            try {
                return Integer.parseInt(String.valueOf(limit));
            } catch (NumberFormatException ex) {
                return pageSize;
            }
        }
    }
}
