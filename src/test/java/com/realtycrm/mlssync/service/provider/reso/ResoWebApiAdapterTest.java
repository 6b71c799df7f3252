package com.realtycrm.mlssync.service.provider.reso;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.realtycrm.mlssync.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.realtycrm.mlssync.common.json.jackson.JacksonJsonParser;
import com.realtycrm.mlssync.exception.AuthenticationException;
import com.realtycrm.mlssync.exception.ConnectivityException;
import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.service.provider.MediaReference;
import com.realtycrm.mlssync.service.provider.ProviderHealth;
import com.realtycrm.mlssync.service.provider.RecordPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResoWebApiAdapterTest {

    private static final ResoWebApiAdapter.ResoSettings SETTINGS = new ResoWebApiAdapter.ResoSettings(
            "mls-a", "Property", "Media", "ListingKey", "ModificationTimestamp");

    private final List<ClientRequest> requests = new ArrayList<>();

    private ResoWebApiAdapter adapter(Function<ClientRequest, ClientResponse> responder, int pageSize) {
        WebClient webClient = WebClient.builder()
                                       .baseUrl("http://mls.test/odata")
                                       .exchangeFunction(request -> {
                                           requests.add(request);
                                           return Mono.just(responder.apply(request));
                                       })
                                       .build();
        return new ResoWebApiAdapter(webClient, new BearerTokenAuthentication("secret-token"),
                                     new JacksonJsonParser(new ObjectMapper()), SETTINGS, pageSize,
                                     Duration.ofSeconds(5));
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
                             .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                             .body(body)
                             .build();
    }

    @Test
    @DisplayName("full page yields a skip cursor and sends the watermark filter")
    void fetchChangedRecords_fullPage() {
        ResoWebApiAdapter adapter = adapter(request -> json("""
                {"value": [{"ListingKey": "A"}, {"ListingKey": "B"}]}
                """), 2);

        RecordPage page = adapter.fetchChangedRecords(Instant.parse("2024-03-01T00:00:00Z"), null);

        assertThat(page.records()).extracting(record -> record.valueAt("ListingKey")).containsExactly("A", "B");
        assertThat(page.nextCursor()).isEqualTo("2");
        ClientRequest last = requests.get(requests.size() - 1);
        assertThat(last.url().getPath()).isEqualTo("/odata/Property");
        assertThat(last.url().getQuery()).contains("$top=2", "$skip=0",
                                                   "$filter=ModificationTimestamp ge 2024-03-01T00:00:00Z");
        assertThat(last.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-token");
    }

    @Test
    @DisplayName("short page without next link is the last page")
    void fetchChangedRecords_lastPage() {
        ResoWebApiAdapter adapter = adapter(request -> json("{\"value\": [{\"ListingKey\": \"C\"}]}"), 2);

        RecordPage page = adapter.fetchChangedRecords(null, "4");

        assertThat(page.isLast()).isTrue();
        assertThat(requests.get(requests.size() - 1).url().getQuery()).contains("$skip=4")
                                                                      .doesNotContain("$filter");
    }

    @Test
    @DisplayName("401 from the provider surfaces as an authentication failure")
    void unauthorized() {
        ResoWebApiAdapter adapter = adapter(request -> ClientResponse.create(HttpStatus.UNAUTHORIZED)
                                                                     .body("invalid token").build(), 10);

        assertThatThrownBy(() -> adapter.fetchChangedRecords(null, null))
                .isInstanceOf(AuthenticationException.class);
    }

    @Test
    @DisplayName("5xx and unreadable bodies surface as connectivity failures")
    void serverErrorAndGarbage() {
        ResoWebApiAdapter failing = adapter(request -> ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE)
                                                                     .build(), 10);
        ResoWebApiAdapter garbage = adapter(request -> json("<html>maintenance</html>"), 10);

        assertThatThrownBy(() -> failing.fetchChangedRecords(null, null)).isInstanceOf(ConnectivityException.class);
        assertThatThrownBy(() -> garbage.fetchChangedRecords(null, null)).isInstanceOf(ConnectivityException.class);
    }

    @Test
    @DisplayName("media references are read from the Media resource")
    void fetchMediaReferences() {
        ResoWebApiAdapter adapter = adapter(request -> request.url().getPath().endsWith("/Media")
                ? json("""
                       {"value": [
                         {"MediaURL": "https://img.test/1.jpg", "MediaCategory": "Photo", "Order": 1},
                         {"MediaURL": "", "Order": 2},
                         {"MediaURL": "https://img.test/tour", "MediaCategory": "Virtual Tour", "Order": "3"}
                       ]}
                       """)
                : json("{\"value\": []}"), 10);

        List<MediaReference> media = adapter.fetchMediaReferences("L'1");

        assertThat(media).containsExactly(
                new MediaReference("https://img.test/1.jpg", MediaKind.PHOTO, 1, null),
                new MediaReference("https://img.test/tour", MediaKind.VIRTUAL_TOUR, 3, null));
        assertThat(requests.get(requests.size() - 1).url().getQuery()).contains("ResourceRecordKey eq 'L''1'");
    }

    @Test
    @DisplayName("health check reports down instead of throwing")
    void healthCheck_down() {
        ResoWebApiAdapter adapter = adapter(request -> ClientResponse.create(HttpStatus.BAD_GATEWAY).build(), 10);

        assertThat(adapter.healthCheck().status()).isEqualTo(ProviderHealth.Status.DOWN);
    }
}
