package uk.gegc.imagestudio.features.payment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.AuditLogWriter;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.payment.api.dto.SubscriptionDto;
import uk.gegc.imagestudio.features.payment.application.SubscriptionService;
import uk.gegc.imagestudio.features.payment.domain.model.Subscription;
import uk.gegc.imagestudio.features.payment.infra.mapping.SubscriptionMapper;
import uk.gegc.imagestudio.features.payment.infra.repository.SubscriptionRepository;
import uk.gegc.imagestudio.shared.store.StoreTransactionExecutor;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionServiceImpl implements SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionMapper subscriptionMapper;
    private final StoreTransactionExecutor storeExecutor;
    private final AuditLogWriter auditLogWriter;
    private final Clock clock;

    @Override
    public boolean activate(String subscriptionCode, String userId, String planId, String customerEmail, String emailToken) {
        boolean changed = storeExecutor.execute("subscription-activate", () -> {
            Instant now = clock.instant();
            Optional<Subscription> existing = subscriptionRepository.findBySubscriptionCode(subscriptionCode);
            if (existing.isPresent()) {
                Subscription subscription = existing.get();
                if (subscription.isActive()
                        && subscription.getUserId().equals(userId)
                        && Objects.equals(subscription.getPlanId(), planId)) {
                    return false;
                }
                subscription.setUserId(userId);
                subscription.setPlanId(planId);
                subscription.setCustomerEmail(customerEmail);
                subscription.setEmailToken(emailToken);
                subscription.activate(now);
                return true;
            }
            Subscription subscription = new Subscription();
            subscription.setSubscriptionCode(subscriptionCode);
            subscription.setUserId(userId);
            subscription.setPlanId(planId);
            subscription.setCustomerEmail(customerEmail);
            subscription.setEmailToken(emailToken);
            subscription.setCreatedAt(now);
            subscription.activate(now);
            subscriptionRepository.save(subscription);
            return true;
        });

        if (changed) {
            log.info("Subscription {} active for user {} on plan {}", subscriptionCode, userId, planId);
            auditLogWriter.record(AuditEntry.builder()
                    .eventType(AuditEventType.SUBSCRIPTION_CREATED)
                    .userId(userId)
                    .action("subscription:" + subscriptionCode)
                    .detail("subscriptionCode", subscriptionCode)
                    .detail("planId", planId)
                    .build());
        }
        return changed;
    }

    @Override
    public boolean cancel(String subscriptionCode) {
        Optional<Subscription> cancelled = storeExecutor.execute("subscription-cancel", () -> {
            Optional<Subscription> existing = subscriptionRepository.findBySubscriptionCode(subscriptionCode);
            if (existing.isEmpty() || !existing.get().isActive()) {
                return Optional.<Subscription>empty();
            }
            existing.get().cancel(clock.instant());
            return existing;
        });

        cancelled.ifPresent(subscription -> {
            log.info("Subscription {} cancelled for user {}", subscriptionCode, subscription.getUserId());
            auditLogWriter.record(AuditEntry.builder()
                    .eventType(AuditEventType.SUBSCRIPTION_CANCELLED)
                    .userId(subscription.getUserId())
                    .action("subscription:" + subscriptionCode)
                    .detail("subscriptionCode", subscriptionCode)
                    .detail("planId", subscription.getPlanId())
                    .build());
        });
        return cancelled.isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubscriptionDto> listForUser(String userId) {
        return subscriptionMapper.toDtos(subscriptionRepository.findByUserIdOrderByCreatedAtDesc(userId));
    }
}
