package com.shiv.pdfredact.controller;

import com.shiv.pdfredact.dto.JobStatusResponse;
import com.shiv.pdfredact.dto.RedactResponse;
import com.shiv.pdfredact.service.RedactionJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RedactController {

    private final RedactionJobService jobService;

    @PostMapping(value = "/redact", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RedactResponse> redact(
            @RequestParam("file") MultipartFile file,
            @RequestParam("words") String words,
            @RequestParam(value = "clientId", required = false) String clientId
    ) throws IOException {
        return ResponseEntity.accepted().body(jobService.submit(file, words, clientId));
    }

    @GetMapping(value = "/redact/{runId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public JobStatusResponse status(@PathVariable("runId") String runId) {
        return jobService.status(runId);
    }

    @PostMapping(value = "/redact/{runId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public JobStatusResponse cancel(@PathVariable("runId") String runId) {
        return jobService.cancel(runId);
    }

    @GetMapping("/download/{runId}")
    public ResponseEntity<Resource> download(@PathVariable("runId") String runId) {
        Path output = jobService.output(runId);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + output.getFileName() + "\"")
                .body(new FileSystemResource(output));
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
