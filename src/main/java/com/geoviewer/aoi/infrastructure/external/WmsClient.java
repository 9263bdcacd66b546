package com.geoviewer.aoi.infrastructure.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoviewer.aoi.domain.model.FeatureInfoQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;

/**
 * Client for the external WMS server.
 * Issues GetFeatureInfo requests and returns the JSON body untouched.
 */
@Service
public class WmsClient {

    private static final Logger logger = LoggerFactory.getLogger(WmsClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final int timeoutSeconds;
    private final int featureCount;
    private final int maxRetries;

    public WmsClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        @Value("${app.wms.base-url}") String baseUrl,
        @Value("${app.wms.timeout-seconds:15}") int timeoutSeconds,
        @Value("${app.wms.feature-count:10}") int featureCount,
        @Value("${app.wms.max-retries:2}") int maxRetries
    ) {
        this.objectMapper = objectMapper;
        this.timeoutSeconds = timeoutSeconds;
        this.featureCount = featureCount;
        this.maxRetries = maxRetries;
        this.webClient = webClientBuilder
            .baseUrl(baseUrl)
            .build();
    }

    /**
     * Fetch feature information for a pixel of a rendered map.
     *
     * @param query Pixel, map extent and layers of the lookup
     * @return Raw JSON response body
     * @throws WmsException if the server fails, times out or returns something other than JSON
     */
    public String getFeatureInfo(FeatureInfoQuery query) {
        logger.debug("Requesting GetFeatureInfo: {}", query);

        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .queryParam("service", "WMS")
                    .queryParam("version", "1.1.1")
                    .queryParam("request", "GetFeatureInfo")
                    .queryParam("layers", "{layers}")
                    .queryParam("query_layers", "{layers}")
                    .queryParam("info_format", "application/json")
                    .queryParam("feature_count", featureCount)
                    .queryParam("x", query.getX())
                    .queryParam("y", query.getY())
                    .queryParam("bbox", "{bbox}")
                    .queryParam("width", query.getWidth())
                    .queryParam("height", query.getHeight())
                    .queryParam("srs", "EPSG:4326")
                    .build(Map.of("layers", query.getLayers(), "bbox", query.getBbox())))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .retryWhen(Retry.fixedDelay(maxRetries, Duration.ofSeconds(1))
                    .filter(throwable -> throwable instanceof WebClientRequestException)
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
        } catch (WebClientResponseException e) {
            logger.error("WMS server returned error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new WmsException("WMS request failed: " + e.getStatusCode(), e);
        } catch (WebClientException e) {
            logger.error("Failed to connect to WMS server", e);
            throw new WmsException("Failed to connect to WMS server", e);
        } catch (Exception e) {
            logger.error("Unexpected error querying WMS server", e);
            throw new WmsException("Unexpected error querying WMS server", e);
        }

        return requireJson(responseBody);
    }

    private String requireJson(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new WmsException("WMS server returned an empty response");
        }
        try {
            objectMapper.readTree(responseBody);
            return responseBody;
        } catch (JsonProcessingException e) {
            logger.error("WMS server returned a non-JSON response");
            throw new WmsException("WMS server returned a non-JSON response", e);
        }
    }

    /**
     * Exception thrown when WMS calls fail.
     */
    public static class WmsException extends RuntimeException {
        public WmsException(String message) {
            super(message);
        }

        public WmsException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
