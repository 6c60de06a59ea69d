package dev.aparikh.annotationsearch.search.controller;

import dev.aparikh.annotationsearch.error.ErrorResponse;
import dev.aparikh.annotationsearch.record.model.TaskType;
import dev.aparikh.annotationsearch.search.model.SearchRequest;
import dev.aparikh.annotationsearch.search.model.SearchResults;
import dev.aparikh.annotationsearch.search.service.SearchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/datasets")
@Tag(name = "Search", description = "API for searching and aggregating annotation records")
class SearchController {

    private final SearchService searchService;

    SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @Operation(
        summary = "Search records of a dataset",
        description = "Matches records by free text and structured filters, sorts and paginates them. " +
                "The first page also carries value counts over all matching records."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Search completed successfully",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = SearchResults.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid query text, sort id or pagination",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(responseCode = "404", description = "Dataset not found"),
        @ApiResponse(responseCode = "503", description = "Search backend unavailable")
    })
    @PostMapping("/{name}/{task}:search")
    public SearchResults search(
            @Parameter(description = "Dataset name", required = true, example = "sentiment")
            @PathVariable String name,
            @Parameter(description = "Task of the dataset", required = true, example = "TextClassification")
            @PathVariable String task,
            @Parameter(description = "Offset of the first record", example = "0")
            @RequestParam(name = "from", defaultValue = "0") int from,
            @Parameter(description = "Number of records to return", example = "50")
            @RequestParam(name = "limit", required = false) @Nullable Integer limit,
            @Parameter(description = "Query and sort criteria")
            @RequestBody(required = false) @Nullable SearchRequest request) {
        return searchService.search(name, TaskType.fromPathName(task),
                request != null ? request : SearchRequest.empty(), from, limit);
    }
}
