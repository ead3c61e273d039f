package com.example.slides.controller;

import com.example.slides.api.ApiResponse;
import com.example.slides.config.StorageRoots;
import com.example.slides.controller.dto.ExportRequest;
import com.example.slides.controller.dto.JobView;
import com.example.slides.export.ImageFolderExporter;
import com.example.slides.export.PdfSlideExporter;
import com.example.slides.orchestrator.ExtractionJob;
import com.example.slides.orchestrator.ExtractionJobService;
import com.example.slides.orchestrator.ExtractionRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Submit extraction jobs, poll them, review the retained slides and export a
 * selection as a PDF or as numbered image files. Video and export paths are
 * confined to the configured roots.
 */
@RestController
@RequestMapping("/api/slides/jobs")
public class SlideExtractionController {

    private static final Logger log = LoggerFactory.getLogger(SlideExtractionController.class);

    private final ExtractionJobService jobService;
    private final PdfSlideExporter pdfExporter;
    private final ImageFolderExporter imageExporter;
    private final StorageRoots storageRoots;

    public SlideExtractionController(ExtractionJobService jobService,
                                     PdfSlideExporter pdfExporter,
                                     ImageFolderExporter imageExporter,
                                     StorageRoots storageRoots) {
        this.jobService = jobService;
        this.pdfExporter = pdfExporter;
        this.imageExporter = imageExporter;
        this.storageRoots = storageRoots;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<JobView>> submit(@Valid @RequestBody ExtractionRequest request) {
        ExtractionJob job = jobService.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.ok("Extraction started", JobView.from(job)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<JobView>>> list() {
        List<JobView> views = jobService.list().stream().map(JobView::from).collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.ok(views));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<ApiResponse<JobView>> status(@PathVariable String jobId) {
        return ResponseEntity.ok(ApiResponse.ok(JobView.from(jobService.get(jobId))));
    }

    /**
     * Raw bytes of one retained slide, for reviewing before export
     */
    @GetMapping("/{jobId}/slides/{index}")
    public ResponseEntity<byte[]> slide(@PathVariable String jobId, @PathVariable int index) throws IOException {
        Path slide = jobService.slide(jobId, index);
        MediaType type = MediaTypeFactory.getMediaType(slide.getFileName().toString())
            .orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok().contentType(type).body(Files.readAllBytes(slide));
    }

    @PostMapping("/{jobId}/pdf")
    public ResponseEntity<ApiResponse<Map<String, Object>>> exportPdf(@PathVariable String jobId,
                                                                      @Valid @RequestBody ExportRequest request) {
        Path destination = storageRoots.resolveExport(request.getDestination());
        List<Path> slides = jobService.selectSlides(jobId, request.getSelected());
        Path pdf = pdfExporter.export(slides, destination);
        log.info("Job {}: exported {} slide(s) to PDF {}", jobId, slides.size(), pdf);
        return ResponseEntity.ok(ApiResponse.ok("PDF saved",
            Map.of("path", pdf.toString(), "pages", slides.size())));
    }

    @PostMapping("/{jobId}/images")
    public ResponseEntity<ApiResponse<Map<String, Object>>> exportImages(@PathVariable String jobId,
                                                                         @Valid @RequestBody ExportRequest request) {
        Path directory = storageRoots.resolveExport(request.getDestination());
        List<Path> slides = jobService.selectSlides(jobId, request.getSelected());
        List<Path> written = imageExporter.export(slides, directory);
        log.info("Job {}: exported {} image(s) to {}", jobId, written.size(), directory);
        return ResponseEntity.ok(ApiResponse.ok(written.size() + " image(s) saved",
            Map.of("directory", directory.toString(),
                   "files", written.stream().map(Path::toString).collect(Collectors.toList()))));
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String jobId) {
        jobService.delete(jobId);
        return ResponseEntity.ok(ApiResponse.ok("Job deleted", null));
    }
}
