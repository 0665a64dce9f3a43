package com.example.personioexport.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Bearer credential issued by the Personio auth endpoint.
 * Lives only in memory inside the token provider.
 */
public record Credential(String accessToken, Instant expiresAt) {

	/**
	 * Tells whether the credential can still be used at the given instant.
	 *
	 * @param now          current time
	 * @param safetyMargin how long before {@link #expiresAt()} the credential is considered stale
	 * @return {@code true} when {@code now < expiresAt - safetyMargin}
	 */
    public boolean isUsableAt(Instant now, Duration safetyMargin) {
        return now.isBefore(expiresAt.minus(safetyMargin));
    }

    @Override
    public String toString() {
        return "Credential[accessToken=***, expiresAt=" + expiresAt + "]";
    }
}
