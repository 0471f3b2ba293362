package io.b2mash.boq.material;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/** Editable fields of a material. On update, null fields keep their current value. */
public record MaterialDetails(
    String name,
    String code,
    BigDecimal rate,
    UUID shopId,
    String unit,
    UUID categoryId,
    UUID subcategoryId,
    UUID productId,
    String brandName,
    String modelNumber,
    String technicalSpecification,
    String image,
    Map<String, Object> attributes) {

  public MaterialDetails mergeOnto(Material material) {
    return new MaterialDetails(
        name != null ? name : material.getName(),
        code != null ? code : material.getCode(),
        rate != null ? rate : material.getRate(),
        shopId != null ? shopId : material.getShopId(),
        unit != null ? unit : material.getUnit(),
        categoryId != null ? categoryId : material.getCategoryId(),
        subcategoryId != null ? subcategoryId : material.getSubcategoryId(),
        productId != null ? productId : material.getProductId(),
        brandName != null ? brandName : material.getBrandName(),
        modelNumber != null ? modelNumber : material.getModelNumber(),
        technicalSpecification != null
            ? technicalSpecification
            : material.getTechnicalSpecification(),
        image != null ? image : material.getImage(),
        attributes != null ? attributes : material.getAttributes());
  }
}
