package dev.aparikh.annotationsearch.dataset.repository;

import com.fasterxml.jackson.databind.JsonNode;
import dev.aparikh.annotationsearch.dataset.model.Dataset;
import dev.aparikh.annotationsearch.record.model.TaskType;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registry of datasets and their tags and metadata.
 */
public interface DatasetRegistry {

    Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9_-]*$");

    /**
     * Creates the dataset or merges {@code tags} and {@code metadata} into the existing one. Keys
     * already present are overwritten; keys not mentioned are kept.
     *
     * @throws dev.aparikh.annotationsearch.error.BadRequestException if the name is invalid or the
     *         dataset exists for another task
     */
    Dataset createOrUpdate(String name, TaskType task, Map<String, String> tags, Map<String, JsonNode> metadata);

    Optional<Dataset> find(String name);

    /**
     * @throws dev.aparikh.annotationsearch.error.NotFoundException if no dataset has that name
     */
    Dataset get(String name);

    /**
     * Deletes the dataset and all its records. Deleting a missing dataset succeeds.
     */
    void delete(String name);
}
