package com.realtycrm.mlssync.service.provider.fixture;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.realtycrm.mlssync.common.json.jackson.JacksonJsonParser;
import com.realtycrm.mlssync.exception.ConnectivityException;
import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.service.provider.MediaReference;
import com.realtycrm.mlssync.service.provider.ProviderHealth;
import com.realtycrm.mlssync.service.provider.RecordPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StaticFixtureAdapterTest {

    private static final StaticFixtureAdapter.FixtureSettings SETTINGS = new StaticFixtureAdapter.FixtureSettings(
            "fixture", "ListingKey", "ModificationTimestamp", "Media");

    private static StaticFixtureAdapter adapter(Resource resource, int pageSize) {
        return new StaticFixtureAdapter(resource, new JacksonJsonParser(new ObjectMapper()), SETTINGS, pageSize);
    }

    @Test
    @DisplayName("pages through every record when no watermark is given")
    void fetch_pagesThroughAll() {
        StaticFixtureAdapter adapter = adapter(new ClassPathResource("fixtures/test-listings.json"), 2);

        RecordPage first = adapter.fetchChangedRecords(null, null);
        RecordPage second = adapter.fetchChangedRecords(null, first.nextCursor());

        assertThat(first.records()).hasSize(2);
        assertThat(first.isLast()).isFalse();
        assertThat(second.records()).hasSize(1);
        assertThat(second.isLast()).isTrue();
        assertThat(second.records().get(0).valueAt("ListingKey")).isEqualTo("T-3");
    }

    @Test
    @DisplayName("watermark filters out records modified before it")
    void fetch_filtersByWatermark() {
        StaticFixtureAdapter adapter = adapter(new ClassPathResource("fixtures/test-listings.json"), 10);

        RecordPage page = adapter.fetchChangedRecords(Instant.parse("2024-03-05T00:00:00Z"), null);

        assertThat(page.records()).extracting(record -> record.valueAt("ListingKey")).containsExactly("T-2", "T-3");
    }

    @Test
    @DisplayName("media references carry kind, order and caption")
    void fetchMediaReferences_mapsObjectsAndStrings() {
        StaticFixtureAdapter adapter = adapter(new ClassPathResource("fixtures/test-listings.json"), 10);

        List<MediaReference> media = adapter.fetchMediaReferences("T-1");
        List<MediaReference> plain = adapter.fetchMediaReferences("T-2");

        assertThat(media).hasSize(3);
        assertThat(media.get(1)).isEqualTo(new MediaReference("https://images.example.com/t-1/1.jpg",
                                                              MediaKind.PHOTO, 1, "Front"));
        assertThat(media.get(2).kind()).isEqualTo(MediaKind.VIRTUAL_TOUR);
        assertThat(plain).containsExactly(new MediaReference("https://images.example.com/t-2/a.jpg",
                                                             MediaKind.PHOTO, 1, null));
        assertThat(adapter.fetchMediaReferences("unknown")).isEmpty();
    }

    @Test
    @DisplayName("missing fixture is a connectivity failure and reports down")
    void missingFixture() {
        StaticFixtureAdapter adapter = adapter(new ClassPathResource("fixtures/does-not-exist.json"), 10);

        assertThatThrownBy(adapter::connect).isInstanceOf(ConnectivityException.class);
        assertThat(adapter.healthCheck().status()).isEqualTo(ProviderHealth.Status.DOWN);
    }
}
