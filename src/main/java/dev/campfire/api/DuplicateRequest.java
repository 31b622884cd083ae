package dev.campfire.api;

import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

public record DuplicateRequest(@NotBlank String reviewer, @Nullable UUID duplicateOfSourceId) {}
