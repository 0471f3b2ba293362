package io.b2mash.boq.taxonomy;

import java.time.Instant;
import java.util.UUID;

/** A subcategory joined with the name of its category. */
public record SubcategoryView(
    UUID id, String name, UUID categoryId, String categoryName, Instant createdAt) {}
