package dev.campfire.source;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/** Extra page of a source the extractor should also visit, e.g. a second schedule page. */
@Embeddable
public record AdditionalUrl(@Column(name = "url", nullable = false) String url, String label) {}
