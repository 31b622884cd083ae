package dev.campfire.catalog;

import jakarta.persistence.Embeddable;

/** Postal address of a {@link Location}. Every part is optional. */
@Embeddable
public record Address(String street, String city, String state, String zip) {}
