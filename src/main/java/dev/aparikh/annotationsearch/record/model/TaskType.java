package dev.aparikh.annotationsearch.record.model;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.aparikh.annotationsearch.error.BadRequestException;

import java.util.Arrays;

public enum TaskType {
    TEXT_CLASSIFICATION("TextClassification"),
    TOKEN_CLASSIFICATION("TokenClassification");

    private final String pathName;

    TaskType(String pathName) {
        this.pathName = pathName;
    }

    @JsonValue
    public String pathName() {
        return pathName;
    }

    /**
     * Resolves the task named in a request path, e.g. {@code TextClassification}.
     *
     * @throws BadRequestException if no task has that name
     */
    public static TaskType fromPathName(String pathName) {
        return Arrays.stream(values())
                .filter(task -> task.pathName.equals(pathName))
                .findFirst()
                .orElseThrow(() -> new BadRequestException("Unknown task " + pathName + ". Valid values are: "
                        + Arrays.stream(values()).map(TaskType::pathName).toList()));
    }
}
