package com.demo.churn.controller;

import com.demo.churn.model.CustomerRecord;
import com.demo.churn.service.batch.BatchJob;
import com.demo.churn.service.batch.BatchProcessor;
import com.demo.churn.service.batch.BatchProgressListener;
import com.demo.churn.service.batch.CsvCustomerReader;
import com.demo.churn.service.batch.CustomerRowMapper;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/batch")
@RequiredArgsConstructor
public class BatchController {

    private final BatchProcessor processor;
    private final CsvCustomerReader csvReader;
    private final CustomerRowMapper rowMapper;

    /** Upload a CSV of customers; returns the job to poll. */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> submitCsv(@RequestParam("file") MultipartFile file,
                                         @RequestParam(defaultValue = "en") String locale) {
        if (file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded file is empty");
        }
        List<CustomerRecord> records;
        try (InputStream in = file.getInputStream()) {
            records = csvReader.read(in);
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unreadable CSV: " + e.getMessage(), e);
        }
        return view(submit(records, locale), false);
    }

    /** JSON array of customer objects; badly typed values fail their own row only. */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> submitJson(@RequestBody List<JsonNode> rows,
                                          @RequestParam(defaultValue = "en") String locale) {
        List<CustomerRecord> records = rows.stream().map(rowMapper::fromJson).toList();
        return view(submit(records, locale), false);
    }

    @GetMapping
    public List<Map<String, Object>> list() {
        return processor.jobs().stream().map(j -> view(j, false)).toList();
    }

    /** Progress of a job, and its report once finished. */
    @GetMapping("/{id}")
    public Map<String, Object> status(@PathVariable("id") String id) {
        return view(processor.job(id), true);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> cancel(@PathVariable("id") String id) {
        return view(processor.cancel(id), false);
    }

    private BatchJob submit(List<CustomerRecord> records, String locale) {
        if (records.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Batch contains no records");
        }
        try {
            return processor.submit(records, locale, BatchProgressListener.NONE);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    private static Map<String, Object> view(BatchJob job, boolean withReport) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("jobId", job.getId());
        out.put("status", job.getStatus());
        out.put("total", job.getTotal());
        out.put("done", job.getDone());
        out.put("percentComplete", job.getPercentComplete());
        out.put("createdAt", job.getCreatedAt());
        if (withReport && job.getReport() != null) {
            out.put("report", job.getReport());
        }
        return out;
    }
}
