package uk.gegc.imagestudio.features.ledger.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.imagestudio.features.ledger.api.dto.ManualReconciliationDto;
import uk.gegc.imagestudio.features.ledger.domain.model.ManualReconciliationRecord;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ManualReconciliationMapper {
    ManualReconciliationDto toDto(ManualReconciliationRecord entity);
}
