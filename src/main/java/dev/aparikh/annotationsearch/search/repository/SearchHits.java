package dev.aparikh.annotationsearch.search.repository;

import dev.aparikh.annotationsearch.record.model.AnnotationRecord;

import java.util.List;

/**
 * One page of hits as returned by the backend, plus the total match count.
 */
public record SearchHits(long total, List<AnnotationRecord> records) {
}
