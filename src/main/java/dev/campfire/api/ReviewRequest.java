package dev.campfire.api;

import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/** @param decision {@code approved} or {@code rejected} */
public record ReviewRequest(
    @NotBlank String decision, @NotBlank String reviewer, @Nullable String notes) {}
