package io.b2mash.boq.shop;

import io.b2mash.boq.security.ActorContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ShopController {

  private final ShopService shopService;

  public ShopController(ShopService shopService) {
    this.shopService = shopService;
  }

  @GetMapping("/api/shops")
  public ResponseEntity<ShopListResponse> listShops() {
    var shops = shopService.listApprovedShops().stream().map(ShopResponse::from).toList();
    return ResponseEntity.ok(new ShopListResponse(shops));
  }

  @GetMapping("/api/shops/{id}")
  public ResponseEntity<ShopEnvelope> getShop(@PathVariable UUID id) {
    return ResponseEntity.ok(new ShopEnvelope(ShopResponse.from(shopService.getShop(id))));
  }

  @GetMapping("/api/shops-pending-approval")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<PendingShopListResponse> listPendingShops() {
    var entries =
        shopService.listPendingShops().stream()
            .map(shop -> new PendingShopEntry(shop.getId(), "pending", ShopResponse.from(shop)))
            .toList();
    return ResponseEntity.ok(new PendingShopListResponse(entries));
  }

  @GetMapping("/api/supplier/my-shops")
  @PreAuthorize("hasRole('SUPPLIER')")
  public ResponseEntity<ShopListResponse> listMyShops() {
    var shops =
        shopService.listShopsForOwner(ActorContext.getActorId()).stream()
            .map(ShopResponse::from)
            .toList();
    return ResponseEntity.ok(new ShopListResponse(shops));
  }

  @PostMapping("/api/shops")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<ShopEnvelope> submitShop(@Valid @RequestBody CreateShopRequest request) {
    var shop = shopService.submitShop(request.toDetails());
    return ResponseEntity.created(URI.create("/api/shops/" + shop.getId()))
        .body(new ShopEnvelope(ShopResponse.from(shop)));
  }

  @PutMapping("/api/shops/{id}")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<ShopEnvelope> updateShop(
      @PathVariable UUID id, @Valid @RequestBody UpdateShopRequest request) {
    var shop = shopService.updateShop(id, request.toDetails());
    return ResponseEntity.ok(new ShopEnvelope(ShopResponse.from(shop)));
  }

  @DeleteMapping("/api/shops/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<MessageResponse> deleteShop(@PathVariable UUID id) {
    shopService.deleteShop(id);
    return ResponseEntity.ok(new MessageResponse("deleted"));
  }

  @PostMapping("/api/shops/{id}/approve")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<ShopEnvelope> approveShop(@PathVariable UUID id) {
    return ResponseEntity.ok(new ShopEnvelope(ShopResponse.from(shopService.approveShop(id))));
  }

  @PostMapping("/api/shops/{id}/reject")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<ShopEnvelope> rejectShop(
      @PathVariable UUID id, @RequestBody(required = false) RejectRequest request) {
    String reason = request != null ? request.reason() : null;
    return ResponseEntity.ok(
        new ShopEnvelope(ShopResponse.from(shopService.rejectShop(id, reason))));
  }

  public record CreateShopRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      String location,
      @Size(max = 10) String phoneCountryCode,
      @Size(max = 30) String contactNumber,
      @Size(max = 100) String city,
      @Size(max = 100) String state,
      @Size(max = 100) String country,
      @Size(max = 20) String pincode,
      String image,
      @DecimalMin("0.0") @DecimalMax("99.9") BigDecimal rating,
      List<String> categories,
      @Size(max = 30) String gstNo) {

    ShopDetails toDetails() {
      return new ShopDetails(
          name,
          location,
          phoneCountryCode,
          contactNumber,
          city,
          state,
          country,
          pincode,
          image,
          rating,
          categories,
          gstNo);
    }
  }

  public record UpdateShopRequest(
      @Size(max = 255, message = "name must be at most 255 characters") String name,
      String location,
      @Size(max = 10) String phoneCountryCode,
      @Size(max = 30) String contactNumber,
      @Size(max = 100) String city,
      @Size(max = 100) String state,
      @Size(max = 100) String country,
      @Size(max = 20) String pincode,
      String image,
      @DecimalMin("0.0") @DecimalMax("99.9") BigDecimal rating,
      List<String> categories,
      @Size(max = 30) String gstNo) {

    ShopDetails toDetails() {
      return new ShopDetails(
          name,
          location,
          phoneCountryCode,
          contactNumber,
          city,
          state,
          country,
          pincode,
          image,
          rating,
          categories,
          gstNo);
    }
  }

  public record RejectRequest(String reason) {}

  public record ShopResponse(
      UUID id,
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
      String gstNo,
      String ownerId,
      boolean approved,
      String approvalReason,
      Instant createdAt,
      Instant updatedAt) {

    public static ShopResponse from(Shop shop) {
      return new ShopResponse(
          shop.getId(),
          shop.getName(),
          shop.getLocation(),
          shop.getPhoneCountryCode(),
          shop.getContactNumber(),
          shop.getCity(),
          shop.getState(),
          shop.getCountry(),
          shop.getPincode(),
          shop.getImage(),
          shop.getRating(),
          shop.getCategories(),
          shop.getGstNo(),
          shop.getOwnerId(),
          shop.isApproved(),
          shop.getApprovalReason(),
          shop.getCreatedAt(),
          shop.getUpdatedAt());
    }
  }

  public record ShopListResponse(List<ShopResponse> shops) {}

  public record ShopEnvelope(ShopResponse shop) {}

  public record PendingShopEntry(UUID id, String status, ShopResponse shop) {}

  public record PendingShopListResponse(List<PendingShopEntry> shops) {}

  public record MessageResponse(String message) {}
}
