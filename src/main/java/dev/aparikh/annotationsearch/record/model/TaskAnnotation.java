package dev.aparikh.annotationsearch.record.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The labels an agent assigned to a record, used for both predictions and annotations.
 *
 * @param agent  who produced the labels, e.g. a model name or an annotator
 * @param labels the assigned labels; prediction labels are kept in descending score order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskAnnotation(@Nullable String agent, List<Label> labels) {

    public TaskAnnotation {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
