package uk.gegc.imagestudio.features.payment.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.imagestudio.features.payment.api.dto.SubscriptionDto;
import uk.gegc.imagestudio.features.payment.domain.model.Subscription;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SubscriptionMapper {
    SubscriptionDto toDto(Subscription entity);
    List<SubscriptionDto> toDtos(List<Subscription> entities);
}
