package com.ledgersync.repository;

import com.ledgersync.model.PaymentMethod;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PaymentMethodRepository extends JpaRepository<PaymentMethod, String> {
  Optional<PaymentMethod> findByName(String name);

  List<PaymentMethod> findAllByOrderByNameAsc();
}
