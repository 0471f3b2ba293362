package io.b2mash.boq.shop;

import java.math.BigDecimal;
import java.util.List;

/** Editable fields of a shop. On update, null fields keep their current value. */
public record ShopDetails(
    String name,
    String location,
    String phoneCountryCode,
    String contactNumber,
    String city,
    String state,
    String country,
    String pincode,
    String image,
    BigDecimal rating,
    List<String> categories,
    String gstNo) {

  /** Fills the fields left null in this patch from the shop's current state. */
  public ShopDetails mergeOnto(Shop shop) {
    return new ShopDetails(
        name != null ? name : shop.getName(),
        location != null ? location : shop.getLocation(),
        phoneCountryCode != null ? phoneCountryCode : shop.getPhoneCountryCode(),
        contactNumber != null ? contactNumber : shop.getContactNumber(),
        city != null ? city : shop.getCity(),
        state != null ? state : shop.getState(),
        country != null ? country : shop.getCountry(),
        pincode != null ? pincode : shop.getPincode(),
        image != null ? image : shop.getImage(),
        rating != null ? rating : shop.getRating(),
        categories != null ? categories : shop.getCategories(),
        gstNo != null ? gstNo : shop.getGstNo());
  }
}
