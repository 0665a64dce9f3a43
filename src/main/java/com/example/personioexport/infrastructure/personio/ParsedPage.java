package com.example.personioexport.infrastructure.personio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One decoded JSON response from Personio.
 * Records are read from {@code data} (v1) or {@code _data} (v2) and metadata from
 * {@code metadata} or {@code _meta}.
 *
 * @param status HTTP status of the response
 * @param body   decoded body, a missing node when the response was empty
 */
public record ParsedPage(int status, JsonNode body) {

    public ParsedPage {
        body = body == null ? MissingNode.getInstance() : body;
    }

	/**
	 * @return records in server order; a single object payload yields a one-element list
	 */
    public List<JsonNode> records() {
        JsonNode data = payload();
        if (data.isArray()) {
            List<JsonNode> records = new ArrayList<>(data.size());
            data.forEach(records::add);
            return records;
        }
        if (data.isObject() && !data.isEmpty()) {
            return List.of(data);
        }
        return List.of();
    }

	/**
	 * @return {@code true} when the payload is one object rather than a collection
	 */
    public boolean isSingleObject() {
        return payload().isObject();
    }

    public JsonNode metadata() {
        return body.has("metadata") ? body.get("metadata") : body.path("_meta");
    }

    private JsonNode payload() {
        return body.has("data") ? body.get("data") : body.path("_data");
    }
}
