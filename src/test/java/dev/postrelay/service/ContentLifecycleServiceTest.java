package dev.postrelay.service;

import dev.postrelay.config.ContentProperties;
import dev.postrelay.entity.ContentItem;
import dev.postrelay.exception.NotFoundException;
import dev.postrelay.exception.PreconditionViolationException;
import dev.postrelay.exception.StorageFailureException;
import dev.postrelay.metrics.RelayMetrics;
import dev.postrelay.model.ApprovalMode;
import dev.postrelay.model.ApprovalState;
import dev.postrelay.model.LifecycleState;
import dev.postrelay.repository.ContentItemRepository;
import dev.postrelay.storage.MediaStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContentLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2025-11-06T10:00:00Z");

    @Mock
    private ContentItemRepository contentItemRepository;

    @Mock
    private MediaStorage mediaStorage;

    @Mock
    private RelayMetrics metrics;

    private ContentLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new ContentLifecycleService(contentItemRepository, mediaStorage, new ContentProperties(),
                metrics, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(contentItemRepository.save(any(ContentItem.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private ContentItem stored(ContentItem item) {
        when(contentItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
        return item;
    }

    private static ContentItem scraped(long id) {
        return ContentItem.builder().id(id).wordCount(10).mediaGenerated(false).build();
    }

    private static ContentItem withMedia(long id) {
        return ContentItem.builder().id(id).wordCount(10).mediaGenerated(true).mediaRef(id + ".png").build();
    }

    private static ContentItem approved(long id) {
        ContentItem item = withMedia(id);
        item.setApprovalState(ApprovalState.APPROVED);
        item.setApprovedAt(NOW.minusSeconds(600));
        item.setAutoPostEnabled(true);
        return item;
    }

    private static ContentItem published(long id) {
        ContentItem item = approved(id);
        item.setPublishedToTarget(true);
        item.setPublishedAt(NOW.minusSeconds(60));
        return item;
    }

    @Nested
    @DisplayName("Media generation")
    class MediaGenerationTests {

        @Test
        @DisplayName("Should move a scraped item to awaiting approval")
        void shouldMarkMediaGenerated() {
            stored(scraped(1));

            ContentItem result = service.markMediaGenerated(1L, "1.png");

            assertThat(result.isMediaGenerated()).isTrue();
            assertThat(result.getMediaRef()).isEqualTo("1.png");
            assertThat(LifecycleState.of(result)).isEqualTo(LifecycleState.MEDIA_GENERATED);
        }

        @Test
        @DisplayName("Should refuse an item that already has media")
        void shouldRefuseTwice() {
            stored(withMedia(1));

            assertThatThrownBy(() -> service.markMediaGenerated(1L, "other.png"))
                    .isInstanceOf(PreconditionViolationException.class);
            verify(contentItemRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should require a media reference")
        void shouldRequireRef() {
            assertThatThrownBy(() -> service.markMediaGenerated(1L, " "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Approval decisions")
    class ApprovalTests {

        @Test
        @DisplayName("Should approve for auto-post with priority")
        void shouldApproveAuto() {
            stored(withMedia(1));

            ContentItem result = service.approve(1L, true, 10);

            assertThat(result.getApprovalState()).isEqualTo(ApprovalState.APPROVED);
            assertThat(result.getApprovedAt()).isEqualTo(NOW);
            assertThat(result.isAutoPostEnabled()).isTrue();
            assertThat(result.getApprovalMode()).isEqualTo(ApprovalMode.AUTO);
            assertThat(result.getPublishPriority()).isEqualTo(10);
        }

        @Test
        @DisplayName("Should approve for manual posting and keep priority when none given")
        void shouldApproveManual() {
            ContentItem item = withMedia(1);
            item.setPublishPriority(3);
            stored(item);

            ContentItem result = service.approve(1L, false, null);

            assertThat(result.getApprovalMode()).isEqualTo(ApprovalMode.MANUAL);
            assertThat(result.isAutoPostEnabled()).isFalse();
            assertThat(result.getPublishPriority()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should allow changing a rejection into an approval")
        void shouldReapproveRejected() {
            ContentItem item = withMedia(1);
            item.setApprovalState(ApprovalState.REJECTED);
            stored(item);

            assertThat(service.approve(1L, true, null).getApprovalState()).isEqualTo(ApprovalState.APPROVED);
        }

        @Test
        @DisplayName("Should reject and clear auto-post")
        void shouldReject() {
            stored(approved(1));

            ContentItem result = service.reject(1L);

            assertThat(result.getApprovalState()).isEqualTo(ApprovalState.REJECTED);
            assertThat(result.isAutoPostEnabled()).isFalse();
            assertThat(result.getApprovedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should refuse approval after publication")
        void shouldRefuseAfterPublish() {
            stored(published(1));

            assertThatThrownBy(() -> service.approve(1L, true, null))
                    .isInstanceOf(PreconditionViolationException.class)
                    .hasMessageContaining("PUBLISHED");
            assertThatThrownBy(() -> service.reject(1L))
                    .isInstanceOf(PreconditionViolationException.class);
        }

        @Test
        @DisplayName("Should refuse approval changes while the item is being published")
        void shouldRefuseWhileReserved() {
            ContentItem item = approved(1);
            item.setPublishClaimedAt(NOW.minus(Duration.ofMinutes(5)));
            stored(item);

            assertThatThrownBy(() -> service.reject(1L))
                    .isInstanceOf(PreconditionViolationException.class)
                    .hasMessageContaining("being published");
            assertThat(item.getApprovalState()).isEqualTo(ApprovalState.APPROVED);
        }

        @Test
        @DisplayName("Should ignore a reservation older than the claim timeout")
        void shouldIgnoreStaleReservation() {
            ContentItem item = approved(1);
            item.setPublishClaimedAt(NOW.minus(Duration.ofHours(2)));
            stored(item);

            assertThat(service.reject(1L).getApprovalState()).isEqualTo(ApprovalState.REJECTED);
        }

        @Test
        @DisplayName("Should throw NotFound for unknown item")
        void shouldThrowNotFound() {
            when(contentItemRepository.findById(99L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.approve(99L, true, null))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Publish and download")
    class PublishTests {

        @Test
        @DisplayName("Should publish an approved item")
        void shouldPublishApproved() {
            ContentItem item = approved(1);
            item.setPublishClaimedAt(NOW.minusSeconds(30));
            stored(item);

            ContentItem result = service.markPublished(1L);

            assertThat(result.isPublishedToTarget()).isTrue();
            assertThat(result.getPublishedAt()).isEqualTo(NOW);
            assertThat(result.getPublishClaimedAt()).isNull();
            verify(metrics).recordPublished();
        }

        @Test
        @DisplayName("Should never publish an unapproved item")
        void shouldRefuseUnapproved() {
            ContentItem item = stored(withMedia(1));

            assertThatThrownBy(() -> service.markPublished(1L))
                    .isInstanceOf(PreconditionViolationException.class);
            assertThat(item.isPublishedToTarget()).isFalse();
        }

        @Test
        @DisplayName("Should mark a published item downloaded")
        void shouldMarkDownloaded() {
            stored(published(1));

            ContentItem result = service.markDownloaded(1L);

            assertThat(result.isDownloaded()).isTrue();
            assertThat(result.getDownloadedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should keep the first download time on repeated downloads")
        void shouldBeIdempotent() {
            ContentItem item = published(1);
            item.setDownloaded(true);
            item.setDownloadedAt(NOW.minusSeconds(3600));
            stored(item);

            ContentItem result = service.markDownloaded(1L);

            assertThat(result.getDownloadedAt()).isEqualTo(NOW.minusSeconds(3600));
            verify(contentItemRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should refuse download before publication")
        void shouldRefuseDownloadBeforePublish() {
            stored(approved(1));

            assertThatThrownBy(() -> service.markDownloaded(1L))
                    .isInstanceOf(PreconditionViolationException.class);
        }
    }

    @Nested
    @DisplayName("Delete")
    class DeleteTests {

        @Test
        @DisplayName("Should refuse to delete a protected item and leave it unchanged")
        void shouldProtectApproved() {
            ContentItem item = stored(approved(1));

            assertThatThrownBy(() -> service.delete(1L))
                    .isInstanceOf(PreconditionViolationException.class)
                    .satisfies(e -> assertThat(((PreconditionViolationException) e).getState())
                            .isEqualTo(LifecycleState.APPROVED));
            verify(contentItemRepository, never()).delete(any(ContentItem.class));
            verifyNoInteractions(mediaStorage);
            assertThat(item.getApprovalState()).isEqualTo(ApprovalState.APPROVED);
        }

        @Test
        @DisplayName("Should delete a rejected item and its artifact")
        void shouldDeleteRejected() {
            ContentItem item = withMedia(1);
            item.setApprovalState(ApprovalState.REJECTED);
            stored(item);

            service.delete(1L);

            verify(contentItemRepository).delete(item);
            verify(mediaStorage).delete("1.png");
        }

        @Test
        @DisplayName("Should still delete the item when the artifact cannot be removed")
        void shouldDeleteDespiteStorageFailure() {
            ContentItem item = stored(published(1));
            when(mediaStorage.delete("1.png")).thenThrow(new StorageFailureException("disk", null));

            service.delete(1L);

            verify(contentItemRepository).delete(item);
        }

        @Test
        @DisplayName("Should delete a scraped item without touching storage")
        void shouldDeleteScraped() {
            ContentItem item = stored(scraped(1));

            service.delete(1L);

            verify(contentItemRepository).delete(item);
            verifyNoInteractions(mediaStorage);
        }
    }
}
