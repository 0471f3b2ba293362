package io.b2mash.boq.submission;

import java.math.BigDecimal;
import java.util.UUID;

/** A supplier's offer for a template, before it is stored. */
public record NewSubmission(
    UUID templateId,
    UUID shopId,
    BigDecimal rate,
    String unit,
    String brandName,
    String modelNumber,
    String subcategory,
    String technicalSpecification) {}
