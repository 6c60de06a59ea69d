package dev.aparikh.annotationsearch.indexing.controller;

import dev.aparikh.annotationsearch.indexing.model.BulkRequest;
import dev.aparikh.annotationsearch.indexing.model.BulkResponse;
import dev.aparikh.annotationsearch.indexing.service.BulkIngestService;
import dev.aparikh.annotationsearch.record.model.TaskType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for bulk ingestion of annotation records.
 */
@RestController
@RequestMapping("/api/datasets")
@Tag(name = "Ingestion", description = "API for creating and merging annotation records in bulk")
class BulkController {

    private final BulkIngestService bulkIngestService;

    BulkController(BulkIngestService bulkIngestService) {
        this.bulkIngestService = bulkIngestService;
    }

    /**
     * Creates or merges a batch of records.
     *
     * @param name    the dataset name
     * @param task    the task path name, e.g. {@code TextClassification}
     * @param request tags, metadata and records
     * @return processed and failed counts
     */
    @PostMapping("/{name}/{task}:bulk")
    @Operation(
            summary = "Ingest records in bulk",
            description = "Creates the dataset if needed and merges the given tags and metadata into it. " +
                    "Each record is created, or merged into the stored record with the same id. " +
                    "Invalid records are counted as failed without stopping the batch."
    )
    public BulkResponse bulk(
            @Parameter(description = "Dataset name", required = true, example = "sentiment")
            @PathVariable String name,
            @Parameter(description = "Task of the records", required = true, example = "TextClassification")
            @PathVariable String task,
            @Parameter(description = "Records with optional dataset tags and metadata", required = true)
            @RequestBody BulkRequest request) {
        return bulkIngestService.bulk(name, TaskType.fromPathName(task), request);
    }
}
