package io.b2mash.boq.shop;

import io.b2mash.boq.approval.Approvable;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "shops")
public class Shop implements Approvable {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "location", columnDefinition = "TEXT")
  private String location;

  @Column(name = "phone_country_code", length = 10)
  private String phoneCountryCode;

  @Column(name = "contact_number", length = 30)
  private String contactNumber;

  @Column(name = "city", length = 100)
  private String city;

  @Column(name = "state", length = 100)
  private String state;

  @Column(name = "country", length = 100)
  private String country;

  @Column(name = "pincode", length = 20)
  private String pincode;

  @Column(name = "image", columnDefinition = "TEXT")
  private String image;

  @Column(name = "rating", precision = 3, scale = 1)
  private BigDecimal rating;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "categories", columnDefinition = "jsonb")
  private List<String> categories = new ArrayList<>();

  @Column(name = "gst_no", length = 30)
  private String gstNo;

  @Column(name = "owner_id", nullable = false)
  private String ownerId;

  @Column(name = "approved", nullable = false)
  private boolean approved;

  @Column(name = "approval_reason", columnDefinition = "TEXT")
  private String approvalReason;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Shop() {}

  /** New shops always start unapproved, whoever submits them. */
  public Shop(String name, String ownerId) {
    this.name = name;
    this.ownerId = ownerId;
    this.approved = false;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @Override
  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getLocation() {
    return location;
  }

  public String getPhoneCountryCode() {
    return phoneCountryCode;
  }

  public String getContactNumber() {
    return contactNumber;
  }

  public String getCity() {
    return city;
  }

  public String getState() {
    return state;
  }

  public String getCountry() {
    return country;
  }

  public String getPincode() {
    return pincode;
  }

  public String getImage() {
    return image;
  }

  public BigDecimal getRating() {
    return rating;
  }

  public List<String> getCategories() {
    return categories;
  }

  public String getGstNo() {
    return gstNo;
  }

  public String getOwnerId() {
    return ownerId;
  }

  @Override
  public boolean isApproved() {
    return approved;
  }

  @Override
  public String getApprovalReason() {
    return approvalReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isOwnedBy(String actorId) {
    return actorId != null && actorId.equals(ownerId);
  }

  public void updateDetails(
      String name,
      String location,
      String phoneCountryCode,
      String contactNumber,
      String city,
      String state,
      String country,
      String pincode) {
    this.name = name;
    this.location = location;
    this.phoneCountryCode = phoneCountryCode;
    this.contactNumber = contactNumber;
    this.city = city;
    this.state = state;
    this.country = country;
    this.pincode = pincode;
    this.updatedAt = Instant.now();
  }

  public void updateProfile(
      String image, BigDecimal rating, List<String> categories, String gstNo) {
    this.image = image;
    this.rating = rating;
    this.categories = categories != null ? new ArrayList<>(categories) : new ArrayList<>();
    this.gstNo = gstNo;
    this.updatedAt = Instant.now();
  }
}
