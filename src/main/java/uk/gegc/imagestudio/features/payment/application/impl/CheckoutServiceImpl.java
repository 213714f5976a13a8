package uk.gegc.imagestudio.features.payment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntrySource;
import uk.gegc.imagestudio.features.payment.api.dto.CheckoutRequest;
import uk.gegc.imagestudio.features.payment.api.dto.CheckoutResponse;
import uk.gegc.imagestudio.features.payment.application.CheckoutService;
import uk.gegc.imagestudio.features.payment.application.PaymentGatewayClient;
import uk.gegc.imagestudio.features.payment.application.PaystackProperties;
import uk.gegc.imagestudio.features.payment.domain.model.CheckoutType;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutServiceImpl implements CheckoutService {

    private final PaystackProperties paystackProperties;
    private final PaymentGatewayClient paymentGatewayClient;
    private final CreditLedgerService creditLedgerService;

    @Override
    public CheckoutResponse initiate(AuthenticatedIdentity identity, CheckoutRequest request) {
        boolean subscription = request.type() == CheckoutType.SUBSCRIPTION;
        String productId = request.productId().trim();
        PaystackProperties.CatalogItem item = (subscription
                ? paystackProperties.findPlan(productId)
                : paystackProperties.findPackage(productId))
                .orElseThrow(() -> new IllegalArgumentException(
                        (subscription ? "Unknown plan: " : "Unknown credit package: ") + productId));

        String email = StringUtils.hasText(request.email()) ? request.email() : identity.email();
        if (!StringUtils.hasText(email)) {
            throw new IllegalArgumentException("An e-mail address is required for checkout");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("userId", identity.userId());
        metadata.put(subscription ? "planId" : "packageId", productId);
        metadata.put("credits", item.getCredits());
        metadata.put("type", request.type().wireName());

        PaymentGatewayClient.InitializedTransaction transaction = paymentGatewayClient.initializeTransaction(
                new PaymentGatewayClient.TransactionRequest(
                        email,
                        item.getPrice() * 100,
                        paystackProperties.getCurrency(),
                        paystackProperties.getCallbackUrl(),
                        subscription ? item.getPlanCode() : null,
                        metadata));

        Map<String, Object> pendingMeta = new LinkedHashMap<>();
        pendingMeta.put(subscription ? "planId" : "packageId", productId);
        pendingMeta.put("price", item.getPrice());
        pendingMeta.put("currency", paystackProperties.getCurrency());
        creditLedgerService.recordPending(
                identity.userId(),
                item.getCredits(),
                transaction.reference(),
                subscription ? LedgerEntrySource.SUBSCRIPTION : LedgerEntrySource.PAYMENT,
                pendingMeta);

        log.info("Checkout started for user {}: {} {} reference={}",
                identity.userId(), request.type().wireName(), productId, transaction.reference());

        return new CheckoutResponse(
                transaction.authorizationUrl(),
                transaction.reference(),
                productId,
                item.getName(),
                request.type(),
                item.getCredits(),
                item.getPrice(),
                paystackProperties.getCurrency());
    }
}
