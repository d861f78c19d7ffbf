package com.ledgersync.service;

import com.ledgersync.dto.PaymentMethodResponse;
import com.ledgersync.exception.MissingFieldException;
import com.ledgersync.exception.PaymentMethodAlreadyExistsException;
import com.ledgersync.exception.PaymentMethodNotFoundException;
import com.ledgersync.model.PaymentMethod;
import com.ledgersync.model.PaymentMethodType;
import com.ledgersync.repository.PaymentMethodRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PaymentMethodService {
  private static final Logger log = LoggerFactory.getLogger(PaymentMethodService.class);

  private final PaymentMethodRepository paymentMethodRepository;

  public PaymentMethodService(PaymentMethodRepository paymentMethodRepository) {
    this.paymentMethodRepository = paymentMethodRepository;
  }

  @Transactional(readOnly = true)
  public List<PaymentMethodResponse> list() {
    return paymentMethodRepository.findAllByOrderByNameAsc().stream()
        .map(PaymentMethodService::toResponse)
        .toList();
  }

  @Transactional
  public PaymentMethodResponse create(String name, PaymentMethodType type) {
    String trimmed = name == null ? "" : name.trim();
    if (trimmed.isEmpty()) {
      throw new MissingFieldException("name", "payment method");
    }
    if (type == null) {
      throw new MissingFieldException("type", "payment method " + trimmed);
    }
    if (paymentMethodRepository.findByName(trimmed).isPresent()) {
      throw new PaymentMethodAlreadyExistsException(trimmed);
    }
    PaymentMethod paymentMethod = new PaymentMethod();
    paymentMethod.setName(trimmed);
    paymentMethod.setType(type);
    PaymentMethod saved = paymentMethodRepository.save(paymentMethod);
    log.info("Created payment method {} ({})", saved.getName(), saved.getId());
    return toResponse(saved);
  }

  public PaymentMethod require(String id) {
    if (id == null || id.isBlank()) {
      throw new MissingFieldException("payment_method_id", "manual transaction");
    }
    return paymentMethodRepository.findById(id.trim())
        .orElseThrow(() -> new PaymentMethodNotFoundException(id));
  }

  private static PaymentMethodResponse toResponse(PaymentMethod paymentMethod) {
    return new PaymentMethodResponse(
        paymentMethod.getId(),
        paymentMethod.getName(),
        paymentMethod.getType(),
        paymentMethod.isActive());
  }
}
