package com.ai.intake.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Validates spoken addresses with the Google Geocoding API. An address is
 * accepted when the best match has a street and a city or state, and is either
 * precisely located or carries a house number.
 */
@Service
public class GoogleMapsAddressValidator implements AddressValidator {

    private static final Logger log = LoggerFactory.getLogger(GoogleMapsAddressValidator.class);

    static final String NOT_FOUND = "Address not found. Please provide a more specific address.";
    static final String MISSING_COMPONENTS = "Please provide a complete address with street, city, and state.";
    static final String INCOMPLETE = "The address seems incomplete. Please provide the full street address including house number.";

    private static final Set<String> PRECISE_LOCATION_TYPES = Set.of("ROOFTOP", "RANGE_INTERPOLATED");

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String geocodeUrl;

    public GoogleMapsAddressValidator(RestTemplateBuilder builder,
                                      @Value("${google.maps.api-key:}") String apiKey,
                                      @Value("${google.maps.geocode-url:https://maps.googleapis.com/maps/api/geocode/json}") String geocodeUrl,
                                      @Value("${google.maps.timeout:5s}") Duration timeout) {
        this.restTemplate = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
        this.apiKey = apiKey;
        this.geocodeUrl = geocodeUrl;
    }

    @Override
    public AddressValidation validate(String address) {
        if (StringUtils.isBlank(apiKey)) {
            throw new AddressValidationException("google.maps.api-key is not set");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(geocodeUrl)
                .queryParam("address", address)
                .queryParam("key", apiKey)
                .encode()
                .build()
                .toUri();
        JsonNode root;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            root = mapper.readTree(response.getBody());
        } catch (RestClientException | IOException e) {
            throw new AddressValidationException("Geocoding request failed", e);
        }
        return interpret(root);
    }

    AddressValidation interpret(JsonNode root) {
        String status = root.path("status").asText("");
        if ("ZERO_RESULTS".equals(status)) {
            return AddressValidation.invalid(NOT_FOUND);
        }
        if (!"OK".equals(status)) {
            throw new AddressValidationException("Geocoding API returned " + status + ": "
                    + root.path("error_message").asText(""));
        }
        JsonNode results = root.path("results");
        if (!results.isArray() || results.isEmpty()) {
            return AddressValidation.invalid(NOT_FOUND);
        }

        JsonNode best = results.get(0);
        JsonNode components = best.path("address_components");
        boolean hasStreetNumber = hasComponent(components, "street_number");
        boolean hasRoute = hasComponent(components, "route");
        boolean hasLocality = hasComponent(components, "locality")
                || hasComponent(components, "administrative_area_level_1");
        String locationType = best.path("geometry").path("location_type").asText("");
        String formatted = best.path("formatted_address").asText("");

        if (!hasRoute || !hasLocality) {
            log.debug("Geocoded '{}' lacks street or locality", formatted);
            return AddressValidation.invalid(MISSING_COMPONENTS);
        }
        if (!PRECISE_LOCATION_TYPES.contains(locationType) && !hasStreetNumber) {
            log.debug("Geocoded '{}' is imprecise ({}) with no house number", formatted, locationType);
            return AddressValidation.invalid(INCOMPLETE);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("formatted_address", formatted);
        details.put("place_id", best.path("place_id").asText(""));
        details.put("location_type", locationType);
        JsonNode location = best.path("geometry").path("location");
        if (location.has("lat") && location.has("lng")) {
            details.put("lat", location.path("lat").asDouble());
            details.put("lng", location.path("lng").asDouble());
        }
        details.put("has_street_number", hasStreetNumber);
        details.put("has_route", true);
        details.put("has_locality", true);
        return AddressValidation.valid(formatted, details);
    }

    private static boolean hasComponent(JsonNode components, String type) {
        for (JsonNode component : components) {
            for (JsonNode t : component.path("types")) {
                if (type.equals(t.asText())) {
                    return true;
                }
            }
        }
        return false;
    }
}
