package com.example.personioexport.infrastructure.personio;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Resolves configured endpoint names into request paths.
 */
public final class PersonioPaths {

    private PersonioPaths() {
    }

	/**
	 * Turns an endpoint into a path relative to the base URL.
	 * Endpoints without an explicit {@code v1/} or {@code v2/} prefix target the v1 API;
	 * absolute URLs are returned unchanged.
	 *
	 * @param endpoint configured endpoint, with or without leading slash
	 * @return path starting with {@code /}, or the absolute URL
	 */
    public static String resolve(String endpoint) {
        if (isAbsolute(endpoint)) {
            return endpoint;
        }
        String trimmed = endpoint.replaceAll("^/+", "");
        if (trimmed.startsWith("v1/") || trimmed.startsWith("v2/")) {
            return "/" + trimmed;
        }
        return "/v1/" + trimmed;
    }

    public static boolean isAbsolute(String endpoint) {
        return endpoint.startsWith("http://") || endpoint.startsWith("https://");
    }

	/**
	 * Replaces {@code {name}} placeholders with path-segment encoded values.
	 *
	 * @param template endpoint template
	 * @param values   placeholder values
	 * @return expanded endpoint
	 */
    public static String expand(String template, Map<String, String> values) {
        String expanded = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            expanded = expanded.replace("{" + entry.getKey() + "}",
                    UriUtils.encodePathSegment(entry.getValue(), StandardCharsets.UTF_8));
        }
        return expanded;
    }
}
