package uk.gegc.imagestudio.features.payment.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.imagestudio.features.payment.domain.model.Subscription;
import uk.gegc.imagestudio.features.payment.domain.model.SubscriptionStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findBySubscriptionCode(String subscriptionCode);

    List<Subscription> findByUserIdOrderByCreatedAtDesc(String userId);

    long countByUserIdAndStatus(String userId, SubscriptionStatus status);
}
