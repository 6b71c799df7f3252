package com.realtycrm.mlssync.common.apiclient;

import com.realtycrm.mlssync.common.apiclient.authentication.Authentication;
import com.realtycrm.mlssync.common.apiclient.model.ApiRequest;
import com.realtycrm.mlssync.common.apiclient.model.ApiResponse;
import com.realtycrm.mlssync.common.apiclient.model.HeaderConfig;
import com.realtycrm.mlssync.exception.apiclient.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Base class for blocking HTTP clients built on {@link WebClient}. It applies authentication and static
 * headers, enforces a per-request timeout and maps every failure onto the {@link ApiException} hierarchy,
 * so subclasses only deal with request shapes and payload parsing.
 */
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;

    protected ApiClient(final WebClient webClient, final Authentication authentication,
                        final HeaderConfig headerConfig) {
        this.webClient = webClient;
        this.authentication = authentication;
        this.headerConfig = headerConfig;
    }

    /**
     * Maximum time a single call may take, including reading the body.
     */
    protected Duration requestTimeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * Executes the request and blocks for the response.
     *
     * @param apiRequest The request to send.
     *
     * @return The successful (2xx) response.
     *
     * @throws ApiException for any non-2xx status, timeout or transport failure.
     */
    protected ApiResponse call(@NonNull final ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            final WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            final ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                           .timeout(requestTimeout())
                                                           .onErrorMap(this::mapException)
                                                           .block();
            if (apiResponse == null) {
                throw new ApiException("Empty response from " + apiRequest.getPath(),
                                       HttpStatus.INTERNAL_SERVER_ERROR.value());
            }
            log.debug("Received status {} for path {}", apiResponse.getStatusCode(), apiRequest.getPath());
            return apiResponse;

        } catch (ApiException e) {
            log.warn("API call to {} failed with status {}: {}", apiRequest.getPath(), e.getStatusCode(),
                     e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Exception during API call to {}", apiRequest.getPath(), e);
            throw mapException(Exceptions.unwrap(e));
        }
    }

    private RuntimeException mapException(final Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException
            || error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out after " + requestTimeout().toMillis() + " ms");
        }
        if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(final ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    private void configureHeaders(final ApiRequest apiRequest, final WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }
        apiRequest.getHeaders().forEach(requestBodySpec::header);

        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
        Optional.ofNullable(apiRequest.getContentType()).ifPresent(requestBodySpec::contentType);
    }

    private void configureBody(final ApiRequest apiRequest, final WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() != null) {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        }
    }

    private Mono<ApiResponse> handleResponse(final ClientResponse response) {
        final int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            final HttpHeaders headers = response.headers().asHttpHeaders();
            final Instant timestamp = Instant.now();
            return response.bodyToMono(byte[].class)
                           .defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder()
                                                   .data(data)
                                                   .contentType(headers.getContentType())
                                                   .headers(headers)
                                                   .statusCode(statusCode)
                                                   .timestamp(timestamp)
                                                   .build());
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    private ApiException createException(final String body, final int statusCode) {
        final String message = body == null || body.isBlank() ? "HTTP " + statusCode : body;
        return switch (statusCode) {
            case 400 -> new BadRequestException(message);
            case 401 -> new UnauthorizedException(message);
            case 403 -> new ForbiddenException(message);
            case 404 -> new NotFoundException(message);
            case 429 -> new TooManyRequestsException(message);
            case 500 -> new InternalServerException(message);
            case 502 -> new BadGatewayException(message);
            case 503 -> new ServiceUnavailableException(message);
            case 504 -> new GatewayTimeoutException(message);
            default -> new ApiException(message, statusCode);
        };
    }
}
