package com.titlesearch.pipeline.api;

import com.titlesearch.pipeline.model.BatchDetail;
import com.titlesearch.pipeline.model.BatchUpload;
import com.titlesearch.pipeline.service.BatchIntakeService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/batches")
public class BatchController {
    private final BatchIntakeService batchIntake;

    public BatchController(BatchIntakeService batchIntake) {
        this.batchIntake = batchIntake;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public BatchUpload upload(@RequestParam("file") MultipartFile file) {
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return batchIntake.upload(file.getOriginalFilename(), reader);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage());
        } catch (IOException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read upload: " + e.getMessage());
        }
    }

    @GetMapping
    public List<BatchUpload> recent() {
        return batchIntake.recent();
    }

    @GetMapping("/{id}")
    public BatchDetail detail(@PathVariable("id") long id) {
        return batchIntake.detail(id);
    }

    @PostMapping("/{id}/process")
    public BatchUpload process(@PathVariable("id") long id) {
        return batchIntake.startProcessing(id);
    }

    @PostMapping("/{id}/cancel")
    public BatchUpload cancel(@PathVariable("id") long id) {
        return batchIntake.cancel(id);
    }
}
