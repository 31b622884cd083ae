package dev.campfire.api;

import jakarta.validation.constraints.NotNull;

public record ParsingNotesRequest(@NotNull String notes) {}
