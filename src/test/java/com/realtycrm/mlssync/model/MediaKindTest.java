package com.realtycrm.mlssync.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MediaKindTest {

    @Test
    @DisplayName("provider category wins over the URL extension")
    void classify_categoryFirst() {
        assertThat(MediaKind.classify("Video", "https://img.test/1.jpg")).isEqualTo(MediaKind.VIDEO);
        assertThat(MediaKind.classify("Branded Virtual Tour", null)).isEqualTo(MediaKind.VIRTUAL_TOUR);
        assertThat(MediaKind.classify("Floor Plan", "https://img.test/plan.pdf")).isEqualTo(MediaKind.PHOTO);
    }

    @Test
    @DisplayName("without a category the extension of the URL path decides")
    void classify_byExtension() {
        assertThat(MediaKind.classify(null, "https://cdn.test/walkthrough.MP4?sig=abc")).isEqualTo(MediaKind.VIDEO);
        assertThat(MediaKind.classify(" ", "https://cdn.test/disclosures.pdf")).isEqualTo(MediaKind.DOCUMENT);
        assertThat(MediaKind.classify(null, "https://cdn.test/photo")).isEqualTo(MediaKind.PHOTO);
        assertThat(MediaKind.classify(null, "not a url")).isEqualTo(MediaKind.PHOTO);
    }
}
