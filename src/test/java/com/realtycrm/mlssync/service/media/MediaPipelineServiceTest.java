package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.exception.MediaProcessingException;
import com.realtycrm.mlssync.exception.StorageException;
import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.model.MediaStage;
import com.realtycrm.mlssync.model.MediaVariant;
import com.realtycrm.mlssync.model.SyncErrorCategory;
import com.realtycrm.mlssync.service.ledger.SyncErrorEntry;
import com.realtycrm.mlssync.service.ledger.SyncErrorLedger;
import com.realtycrm.mlssync.service.storage.ObjectStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MediaPipelineServiceTest {

    private static final String SOURCE_URL = "https://images.example.com/l-1/front.jpg";

    @Mock
    MediaStateService stateService;
    @Mock
    ImageDownloader downloader;
    @Mock
    ObjectStorage objectStorage;
    @Mock
    SyncErrorLedger errorLedger;

    private MediaPipelineService pipeline;

    @Captor
    ArgumentCaptor<List<MediaVariant>> variants;

    @BeforeEach
    void setUp() {
        MlsSyncProperties properties = new MlsSyncProperties();
        pipeline = new MediaPipelineService(stateService, downloader, new ImageVariantGenerator(properties),
                                            objectStorage, new MediaKeyStrategy(properties), errorLedger);
        MediaWorkItem item = new MediaWorkItem(5L, 11L, "mls-a", "L-1", "run-1", SOURCE_URL,
                                               MediaKeyStrategy.hashSourceUrl(SOURCE_URL), MediaKind.PHOTO);
        when(stateService.claim(5L)).thenReturn(true);
        when(stateService.load(5L)).thenReturn(Optional.of(item));
        when(objectStorage.publicUrl(anyString())).thenAnswer(invocation -> "https://cdn/" + invocation.getArgument(0));
    }

    @Test
    @DisplayName("successful processing uploads three variants and marks the row uploaded")
    void process_success() throws IOException {
        when(downloader.download(SOURCE_URL)).thenReturn(ImageVariantGeneratorTest.png(640, 480,
                                                                                       BufferedImage.TYPE_INT_RGB));

        pipeline.process(5L);
        verify(stateService).markUploaded(eq(5L), variants.capture());
        assertThat(variants.getValue()).hasSize(3)
                                       .allSatisfy(v -> assertThat(v.getUrl()).startsWith("https://cdn/properties/"));
        verify(objectStorage, times(3)).put(anyString(), any(byte[].class), eq("image/jpeg"));
        verify(errorLedger, never()).record(any());
    }

    @Test
    @DisplayName("reprocessing writes to the same storage keys")
    void process_sameKeysOnRetry() throws IOException {
        when(downloader.download(SOURCE_URL)).thenReturn(ImageVariantGeneratorTest.png(640, 480,
                                                                                       BufferedImage.TYPE_INT_RGB));

        pipeline.process(5L);
        pipeline.process(5L);

        ArgumentCaptor<String> keys = ArgumentCaptor.forClass(String.class);
        verify(objectStorage, times(6)).put(keys.capture(), any(byte[].class), anyString());
        assertThat(keys.getAllValues().subList(0, 3)).isEqualTo(keys.getAllValues().subList(3, 6));
    }

    @Test
    @DisplayName("download timeout marks the row failed and records a media error")
    void process_downloadTimeout() {
        when(downloader.download(SOURCE_URL)).thenThrow(
                new MediaProcessingException(MediaStage.DOWNLOAD, "Download timed out after 20s"));

        pipeline.process(5L);

        verify(stateService).markFailed(5L, MediaStage.DOWNLOAD, "Download timed out after 20s");
        ArgumentCaptor<SyncErrorEntry> error = ArgumentCaptor.forClass(SyncErrorEntry.class);
        verify(errorLedger).record(error.capture());
        assertThat(error.getValue().category()).isEqualTo(SyncErrorCategory.MEDIA);
        assertThat(error.getValue().mediaId()).isEqualTo(5L);
        assertThat(error.getValue().propertyId()).isEqualTo(11L);
        assertThat(error.getValue().field()).isEqualTo("DOWNLOAD");
        verify(objectStorage, never()).put(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("storage outage degrades the row to the source URL")
    void process_storageUnavailable() throws IOException {
        when(downloader.download(SOURCE_URL)).thenReturn(ImageVariantGeneratorTest.png(640, 480,
                                                                                       BufferedImage.TYPE_INT_RGB));
        doThrow(new StorageException("bucket unreachable", new RuntimeException()))
                .when(objectStorage).put(anyString(), any(byte[].class), anyString());

        pipeline.process(5L);

        verify(stateService).markDegraded(5L, "bucket unreachable");
        verify(stateService, never()).markUploaded(any(), any());
        verify(stateService, never()).markFailed(any(), any(), any());
        ArgumentCaptor<SyncErrorEntry> error = ArgumentCaptor.forClass(SyncErrorEntry.class);
        verify(errorLedger).record(error.capture());
        assertThat(error.getValue().field()).isEqualTo("UPLOAD");
    }

    @Test
    @DisplayName("row claimed elsewhere is left alone")
    void process_notClaimed() {
        when(stateService.claim(5L)).thenReturn(false);

        pipeline.process(5L);

        verify(downloader, never()).download(anyString());
        verify(stateService, never()).load(any());
    }
}
