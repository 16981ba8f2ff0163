package com.fundfeed.provider;

import com.fundfeed.exception.SchemaException;
import com.fundfeed.exception.TransientNetworkException;
import com.fundfeed.exception.UpstreamRejectedException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Blocking HTTP access to vendor endpoints with failure classification.
 *
 * <p>Connection and read failures, HTTP 429 and 5xx become {@link TransientNetworkException}
 * (retried by {@link RetryPolicy}); any other non-2xx status becomes
 * {@link UpstreamRejectedException}. Bodies are read as bytes and decoded as UTF-8 because
 * the JSONP endpoints omit the charset from their content type.
 */
@Component
public class VendorHttpClient {

    private final RestClient vendorRestClient;

    public VendorHttpClient(RestClient vendorRestClient) {
        this.vendorRestClient = vendorRestClient;
    }

    public String get(URI uri, String referer) {
        try {
            byte[] body = vendorRestClient
                    .get()
                    .uri(uri)
                    .header(HttpHeaders.REFERER, referer)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw classify(uri, response.getStatusCode());
                    })
                    .body(byte[].class);
            return decode(uri, body);
        } catch (ResourceAccessException e) {
            throw new TransientNetworkException("I/O error calling " + uri.getHost() + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new SchemaException("Unreadable response from " + uri.getHost() + ": " + e.getMessage(), e);
        }
    }

    public String postJson(URI uri, String referer, String jsonBody) {
        try {
            byte[] body = vendorRestClient
                    .post()
                    .uri(uri)
                    .header(HttpHeaders.REFERER, referer)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(jsonBody.getBytes(StandardCharsets.UTF_8))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw classify(uri, response.getStatusCode());
                    })
                    .body(byte[].class);
            return decode(uri, body);
        } catch (ResourceAccessException e) {
            throw new TransientNetworkException("I/O error calling " + uri.getHost() + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new SchemaException("Unreadable response from " + uri.getHost() + ": " + e.getMessage(), e);
        }
    }

    static RuntimeException classify(URI uri, HttpStatusCode status) {
        if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value() || status.is5xxServerError()) {
            return new TransientNetworkException("HTTP " + status.value() + " from " + uri.getHost());
        }
        return new UpstreamRejectedException("HTTP " + status.value() + " from " + uri.getHost());
    }

    private static String decode(URI uri, byte[] body) {
        if (body == null || body.length == 0) {
            throw new SchemaException("Empty response body from " + uri.getHost());
        }
        return new String(body, StandardCharsets.UTF_8);
    }
}
