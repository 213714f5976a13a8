package uk.gegc.imagestudio.features.ledger.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.imagestudio.features.ledger.api.dto.BalanceDto;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerAccount;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface LedgerAccountMapper {
    BalanceDto toDto(LedgerAccount account);
}
