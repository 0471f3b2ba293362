package io.b2mash.boq.message;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MessageRepository extends JpaRepository<Message, UUID> {

  List<Message> findAllByOrderByCreatedAtDesc();

  List<Message> findBySenderIdOrderByCreatedAtDesc(String senderId);
}
