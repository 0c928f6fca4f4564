package dev.postrelay.service;

import dev.postrelay.config.ContentProperties;
import dev.postrelay.entity.ContentItem;
import dev.postrelay.exception.NotFoundException;
import dev.postrelay.exception.PersistenceConflictException;
import dev.postrelay.exception.PreconditionViolationException;
import dev.postrelay.jobs.JobRequest;
import dev.postrelay.model.ApprovalState;
import dev.postrelay.model.BulkResult;
import dev.postrelay.model.LifecycleState;
import dev.postrelay.model.MediaDownload;
import dev.postrelay.repository.ContentItemRepository;
import dev.postrelay.scheduler.AdaptiveScheduler;
import dev.postrelay.scheduler.TickOutcome;
import dev.postrelay.storage.MediaStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContentAdminServiceTest {

    @Mock
    private ContentItemRepository contentItemRepository;

    @Mock
    private ContentLifecycleService lifecycleService;

    @Mock
    private PublishQueueService publishQueue;

    @Mock
    private AdaptiveScheduler scheduler;

    @Mock
    private MediaStorage mediaStorage;

    @Captor
    private ArgumentCaptor<JobRequest> requestCaptor;

    private ContentAdminService adminService;

    @BeforeEach
    void setUp() {
        adminService = new ContentAdminService(contentItemRepository, lifecycleService, publishQueue, scheduler,
                mediaStorage, new ContentProperties());
    }

    private static ContentItem item(long id, ApprovalState approval, boolean published) {
        return ContentItem.builder().id(id).wordCount(10).mediaGenerated(true).mediaRef(id + ".png")
                .approvalState(approval).publishedToTarget(published).build();
    }

    @Nested
    @DisplayName("Bulk operations")
    class BulkTests {

        @Test
        @DisplayName("Should apply bulk approve per item and report failures")
        void shouldBulkApprove() {
            when(lifecycleService.approve(anyLong(), eq(true), eq(5)))
                    .thenAnswer(inv -> item(inv.getArgument(0), ApprovalState.APPROVED, false));
            when(lifecycleService.approve(2L, true, 5)).thenThrow(
                    new PreconditionViolationException(2L, LifecycleState.SCRAPED, "Cannot approve item 2"));

            BulkResult result = adminService.bulkApprove(List.of(1L, 2L, 3L), true, 5);

            assertThat(result.succeeded()).containsExactly(1L, 3L);
            assertThat(result.failed()).containsOnlyKeys(2L);
            verify(lifecycleService).approve(1L, true, 5);
            verify(lifecycleService).approve(3L, true, 5);
        }

        @Test
        @DisplayName("Bulk delete skips protected items and deletes the rest")
        void shouldBulkDelete() {
            doNothing().when(lifecycleService).delete(anyLong());
            doThrow(new PreconditionViolationException(1L, LifecycleState.APPROVED, "Cannot delete item 1"))
                    .when(lifecycleService).delete(1L);

            BulkResult result = adminService.bulkDelete(List.of(1L, 2L));

            assertThat(result.succeeded()).containsExactly(2L);
            assertThat(result.failed()).containsKey(1L);
            verify(lifecycleService).delete(2L);
        }

        @Test
        @DisplayName("A missing item does not stop a bulk reject")
        void shouldBulkRejectWithMissingItem() {
            when(lifecycleService.reject(anyLong()))
                    .thenAnswer(inv -> item(inv.getArgument(0), ApprovalState.REJECTED, false));
            when(lifecycleService.reject(9L)).thenThrow(NotFoundException.item(9L));

            BulkResult result = adminService.bulkReject(List.of(9L, 4L));

            assertThat(result.succeeded()).containsExactly(4L);
            assertThat(result.failed()).containsKey(9L);
        }

        @Test
        @DisplayName("A concurrent modification is reported per item")
        void shouldReportConflictPerItem() {
            when(lifecycleService.reject(4L)).thenThrow(new OptimisticLockingFailureException("stale"));

            BulkResult result = adminService.bulkReject(List.of(4L));

            assertThat(result.failed()).containsKey(4L);
        }
    }

    @Nested
    @DisplayName("Publish now")
    class PublishNowTests {

        @Test
        @DisplayName("Should start one publish run for the item")
        void shouldTriggerPublish() {
            when(publishQueue.validateManualTarget(7L)).thenReturn(item(7, ApprovalState.APPROVED, false));
            when(scheduler.trigger(eq("publish"), any())).thenReturn(TickOutcome.FIRED);

            adminService.publishNow(7L);

            verify(scheduler).trigger(eq("publish"), requestCaptor.capture());
            assertThat(requestCaptor.getValue().targetItemIds()).containsExactly(7L);
            assertThat(requestCaptor.getValue().skipDelay()).isTrue();
        }

        @Test
        @DisplayName("Unapproved item is refused before any run starts")
        void shouldRefuseUnapprovedItem() {
            when(publishQueue.validateManualTarget(8L)).thenThrow(
                    new PreconditionViolationException(8L, LifecycleState.MEDIA_GENERATED, "Cannot publish item 8"));

            assertThatThrownBy(() -> adminService.publishNow(8L))
                    .isInstanceOf(PreconditionViolationException.class);
            verifyNoInteractions(scheduler);
        }

        @Test
        @DisplayName("Should fail when the publish job is still running")
        void shouldFailWhenJobRunning() {
            when(publishQueue.validateManualTarget(7L)).thenReturn(item(7, ApprovalState.APPROVED, false));
            when(scheduler.trigger(eq("publish"), any())).thenReturn(TickOutcome.IN_FLIGHT);

            assertThatThrownBy(() -> adminService.publishNow(7L))
                    .isInstanceOf(PreconditionViolationException.class)
                    .hasMessageContaining("IN_FLIGHT");
        }

        @Test
        @DisplayName("Bulk publish-now sends valid items in one run, in order")
        void shouldBulkPublishInOneRun() {
            when(publishQueue.validateManualTarget(1L)).thenReturn(item(1, ApprovalState.APPROVED, false));
            when(publishQueue.validateManualTarget(2L)).thenThrow(
                    new PreconditionViolationException(2L, LifecycleState.PUBLISHED, "Cannot publish item 2"));
            when(publishQueue.validateManualTarget(3L)).thenReturn(item(3, ApprovalState.APPROVED, false));
            when(scheduler.trigger(eq("publish"), any())).thenReturn(TickOutcome.FIRED);

            BulkResult result = adminService.bulkPublishNow(List.of(3L, 2L, 1L));

            verify(scheduler, times(1)).trigger(eq("publish"), requestCaptor.capture());
            assertThat(requestCaptor.getValue().targetItemIds()).containsExactly(3L, 1L);
            assertThat(result.succeeded()).containsExactly(3L, 1L);
            assertThat(result.failed()).containsOnlyKeys(2L);
        }

        @Test
        @DisplayName("Bulk publish-now reports every item when the run cannot start")
        void shouldFailAllWhenRunBlocked() {
            when(publishQueue.validateManualTarget(anyLong())).thenReturn(item(1, ApprovalState.APPROVED, false));
            when(scheduler.trigger(eq("publish"), any())).thenReturn(TickOutcome.LOCKED_ELSEWHERE);

            BulkResult result = adminService.bulkPublishNow(List.of(1L, 2L));

            assertThat(result.succeeded()).isEmpty();
            assertThat(result.failed()).containsOnlyKeys(1L, 2L);
        }
    }

    @Nested
    @DisplayName("Media")
    class MediaTests {

        @Test
        @DisplayName("Should open the artifact and mark the item downloaded")
        void shouldDownload() {
            when(lifecycleService.get(5L)).thenReturn(item(5, ApprovalState.APPROVED, true));
            when(mediaStorage.exists("5.png")).thenReturn(true);
            when(mediaStorage.size("5.png")).thenReturn(3L);
            InputStream content = new ByteArrayInputStream(new byte[]{1, 2, 3});
            when(mediaStorage.open("5.png")).thenReturn(content);

            MediaDownload download = adminService.downloadMedia(5L);

            assertThat(download.fileName()).isEqualTo("5.png");
            assertThat(download.content()).isSameAs(content);
            verify(lifecycleService).markDownloaded(5L);
        }

        @Test
        @DisplayName("Should refuse download before publication")
        void shouldRefuseUnpublishedDownload() {
            when(lifecycleService.get(5L)).thenReturn(item(5, ApprovalState.APPROVED, false));

            assertThatThrownBy(() -> adminService.downloadMedia(5L))
                    .isInstanceOf(PreconditionViolationException.class);
            verify(lifecycleService, never()).markDownloaded(anyLong());
        }

        @Test
        @DisplayName("Should report a reclaimed artifact as not found")
        void shouldReportMissingArtifact() {
            ContentItem reclaimed = item(5, ApprovalState.APPROVED, true);
            reclaimed.setMediaRef(null);
            reclaimed.setDownloaded(true);
            when(lifecycleService.get(5L)).thenReturn(reclaimed);

            assertThatThrownBy(() -> adminService.downloadMedia(5L))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Should store an upload under an item-prefixed name")
        void shouldUpload() {
            ContentItem scraped = ContentItem.builder().id(4L).wordCount(10).build();
            when(lifecycleService.get(4L)).thenReturn(scraped);
            when(mediaStorage.put(eq("4_card.png"), any())).thenReturn("4_card.png");

            adminService.uploadMedia(4L, "card.png", new ByteArrayInputStream(new byte[]{1}));

            verify(lifecycleService).markMediaGenerated(4L, "4_card.png");
        }

        @Test
        @DisplayName("Should not store an upload for an item that already has media")
        void shouldRefuseSecondUpload() {
            when(lifecycleService.get(4L)).thenReturn(item(4, ApprovalState.UNSET, false));

            assertThatThrownBy(() -> adminService.uploadMedia(4L, "card.png", new ByteArrayInputStream(new byte[]{1})))
                    .isInstanceOf(PreconditionViolationException.class);
            verify(mediaStorage, never()).put(anyString(), any());
        }

        @Test
        @DisplayName("Should surface a lost race as a conflict")
        void shouldSurfaceConflict() {
            when(lifecycleService.markMediaGenerated(4L, "4.png"))
                    .thenThrow(new OptimisticLockingFailureException("stale"));

            assertThatThrownBy(() -> adminService.markMediaGenerated(4L, "4.png"))
                    .isInstanceOf(PersistenceConflictException.class);
        }
    }
}
