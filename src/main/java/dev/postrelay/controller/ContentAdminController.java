package dev.postrelay.controller;

import dev.postrelay.dto.ApprovalRequest;
import dev.postrelay.dto.BulkActionRequest;
import dev.postrelay.dto.ContentItemView;
import dev.postrelay.dto.IngestRequest;
import dev.postrelay.dto.MediaGeneratedRequest;
import dev.postrelay.dto.PageView;
import dev.postrelay.model.BulkResult;
import dev.postrelay.model.LifecycleBucket;
import dev.postrelay.model.MediaDownload;
import dev.postrelay.model.RawContent;
import dev.postrelay.service.ContentAdminService;
import dev.postrelay.service.IngestionService;
import dev.postrelay.service.IngestionService.IngestionResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamResource;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Admin and collaborator API for content items.
 */
@Slf4j
@RestController
@RequestMapping("/api/content")
@RequiredArgsConstructor
public class ContentAdminController {

    private static final int MAX_PAGE_SIZE = 200;

    private final ContentAdminService adminService;
    private final IngestionService ingestionService;

    /**
     * Count of items per lifecycle bucket.
     */
    @GetMapping("/stats")
    public Map<LifecycleBucket, Long> stats() {
        return adminService.stats();
    }

    /**
     * Items of one bucket, newest first.
     *
     * Example:
     * GET /api/content?bucket=APPROVED_AUTO&page=0&size=50
     */
    @GetMapping
    public PageView<ContentItemView> list(@RequestParam(defaultValue = "ALL") LifecycleBucket bucket,
                                          @RequestParam(defaultValue = "0") int page,
                                          @RequestParam(defaultValue = "50") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
                Sort.by(Sort.Direction.DESC, "scrapedAt", "id"));
        return PageView.of(adminService.list(bucket, pageable), ContentItemView::from);
    }

    @GetMapping("/{id}")
    public ContentItemView get(@PathVariable Long id) {
        return ContentItemView.from(adminService.get(id));
    }

    /**
     * Ingestion callback of the scraper.
     *
     * Example:
     * POST /api/content/ingest
     * {
     *   "sourceRef": "some.profile",
     *   "posts": [{"text": "..."}]
     * }
     */
    @PostMapping("/ingest")
    public ResponseEntity<IngestionResult> ingest(@Valid @RequestBody IngestRequest request) {
        List<RawContent> posts = request.getPosts().stream()
                .map(post -> new RawContent(request.getSourceRef(), post.getText(), post.getMediaUrl()))
                .toList();
        IngestionResult result = ingestionService.ingestBatch(request.getSourceRef(), posts);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    /**
     * Callback of the media generator once an artifact is stored.
     */
    @PostMapping("/{id}/media-generated")
    public ContentItemView mediaGenerated(@PathVariable Long id, @Valid @RequestBody MediaGeneratedRequest request) {
        return ContentItemView.from(adminService.markMediaGenerated(id, request.getMediaRef()));
    }

    /**
     * Upload the artifact itself instead of a reference to an already stored one.
     */
    @PostMapping(path = "/{id}/media", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ContentItemView uploadMedia(@PathVariable Long id, @RequestParam("file") MultipartFile file)
            throws IOException {
        String fileName = file.getOriginalFilename() != null ? file.getOriginalFilename() : "media";
        return ContentItemView.from(adminService.uploadMedia(id, fileName, file.getInputStream()));
    }

    @GetMapping("/{id}/media")
    public ResponseEntity<InputStreamResource> downloadMedia(@PathVariable Long id) {
        MediaDownload download = adminService.downloadMedia(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(download.fileName()).build().toString())
                .contentLength(download.size())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(new InputStreamResource(download.content()));
    }

    @PostMapping("/{id}/approve")
    public ContentItemView approve(@PathVariable Long id, @RequestBody(required = false) ApprovalRequest request) {
        ApprovalRequest approval = request != null ? request : new ApprovalRequest();
        return ContentItemView.from(adminService.approve(id, approval.isAutoPost(), approval.getPriority()));
    }

    @PostMapping("/{id}/reject")
    public ContentItemView reject(@PathVariable Long id) {
        return ContentItemView.from(adminService.reject(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        adminService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/publish-now")
    public ResponseEntity<Void> publishNow(@PathVariable Long id) {
        adminService.publishNow(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/bulk/approve")
    public BulkResult bulkApprove(@Valid @RequestBody BulkActionRequest request) {
        return adminService.bulkApprove(request.getIds(), request.isAutoPost(), request.getPriority());
    }

    @PostMapping("/bulk/reject")
    public BulkResult bulkReject(@Valid @RequestBody BulkActionRequest request) {
        return adminService.bulkReject(request.getIds());
    }

    @PostMapping("/bulk/delete")
    public BulkResult bulkDelete(@Valid @RequestBody BulkActionRequest request) {
        return adminService.bulkDelete(request.getIds());
    }

    @PostMapping("/bulk/publish-now")
    public ResponseEntity<BulkResult> bulkPublishNow(@Valid @RequestBody BulkActionRequest request) {
        return ResponseEntity.accepted().body(adminService.bulkPublishNow(request.getIds()));
    }
}
