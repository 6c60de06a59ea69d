/**
 * Annotation Search Application.
 *
 * <p>This package and all subpackages are null-marked, meaning:
 * <ul>
 *   <li>All reference types are non-null by default</li>
 *   <li>Use {@code @Nullable} to explicitly allow null values</li>
 * </ul>
 *
 * @see org.jspecify.annotations.NullMarked
 */
@NullMarked
package dev.aparikh.annotationsearch;

import org.jspecify.annotations.NullMarked;
