package dev.aparikh.annotationsearch.dataset.controller;

import dev.aparikh.annotationsearch.dataset.model.Dataset;
import dev.aparikh.annotationsearch.dataset.repository.DatasetRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/datasets")
@Tag(name = "Datasets", description = "API for reading and deleting datasets")
class DatasetController {

    private final DatasetRegistry datasetRegistry;

    DatasetController(DatasetRegistry datasetRegistry) {
        this.datasetRegistry = datasetRegistry;
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get a dataset", description = "Returns the dataset with its tags and metadata.")
    public Dataset get(
            @Parameter(description = "Dataset name", required = true, example = "sentiment")
            @PathVariable String name) {
        return datasetRegistry.get(name);
    }

    @DeleteMapping("/{name}")
    @Operation(summary = "Delete a dataset",
            description = "Deletes the dataset and all its records. Deleting a missing dataset succeeds.")
    public void delete(
            @Parameter(description = "Dataset name", required = true, example = "sentiment")
            @PathVariable String name) {
        datasetRegistry.delete(name);
    }
}
