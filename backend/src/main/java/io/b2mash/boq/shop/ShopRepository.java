package io.b2mash.boq.shop;

import io.b2mash.boq.approval.ApprovableRepository;
import java.util.List;

public interface ShopRepository extends ApprovableRepository<Shop> {

  List<Shop> findByOwnerIdOrderByCreatedAtDesc(String ownerId);
}
