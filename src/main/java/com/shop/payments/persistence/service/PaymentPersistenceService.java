package com.shop.payments.persistence.service;

import com.shop.payments.domain.PaymentSearchCriteria;
import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.domain.PaymentView;
import com.shop.payments.persistence.entity.PaymentEntity;
import com.shop.payments.persistence.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Service for writing new ledger entries and reading them back as {@link PaymentView}s.
 * Status changes of existing entries are made by the resolver only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;

    /**
     * Inserts a PENDING entry and flushes immediately so that a duplicate active payment for
     * the same order fails here with a
     * {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    @Transactional
    public PaymentView insertPending(PaymentEntity entity) {
        entity.setStatus(PaymentStatus.PENDING);
        entity.setActiveOrderId(entity.getOrderId());
        PaymentEntity saved = paymentRepository.saveAndFlush(entity);
        log.debug("Persisted pending payment: reference={}, orderId={}", saved.getReference(), saved.getOrderId());
        return saved.toView();
    }

    @Transactional(readOnly = true)
    public Optional<PaymentView> findByReference(String reference) {
        return paymentRepository.findByReference(reference).map(PaymentEntity::toView);
    }

    /**
     * The PENDING or SUCCESS payment currently holding the order, if any.
     */
    @Transactional(readOnly = true)
    public Optional<PaymentView> findActiveForOrder(String orderId) {
        return paymentRepository.findByActiveOrderId(orderId).map(PaymentEntity::toView);
    }

    /**
     * @param page 1-based page number
     */
    @Transactional(readOnly = true)
    public Page<PaymentView> search(PaymentSearchCriteria criteria, int page, int limit) {
        PageRequest pageable = PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
        return paymentRepository.search(criteria.getUserId(), criteria.getStatus(),
                        criteria.getStartDate(), criteria.getEndDate(), pageable)
                .map(PaymentEntity::toView);
    }
}
