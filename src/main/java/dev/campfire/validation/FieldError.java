package dev.campfire.validation;

import org.jspecify.annotations.Nullable;

/**
 * A problem found with one field of an extracted record.
 *
 * @param field the field key ({@code startDate}, {@code location}, {@code dateRange}...)
 * @param message human-readable explanation
 * @param attemptedValue the raw value that could not be used, preserved for debugging
 */
public record FieldError(String field, String message, @Nullable String attemptedValue) {}
