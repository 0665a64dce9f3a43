package com.example.personioexport.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Wires the HTTP client used for every call to Personio.
 */
@Configuration
@EnableConfigurationProperties(PersonioProperties.class)
public class PersonioClientConfig {

	/**
	 * Builds the {@link RestClient} shared by the token provider and the HTTP gateway.
	 * The configured timeout applies to each attempt, both for connecting and for reading.
	 *
	 * @param properties bound export configuration
	 * @return client rooted at the Personio base URL
	 */
    @Bean
    public RestClient personioRestClient(PersonioProperties properties) {
        PersonioProperties.Api api = properties.api();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(api.httpTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(api.httpTimeout());

        return RestClient.builder()
                .baseUrl(api.baseUrl())
                .requestFactory(factory)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

	/**
	 * @return pause used between retry attempts of Personio calls
	 */
    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }
}
