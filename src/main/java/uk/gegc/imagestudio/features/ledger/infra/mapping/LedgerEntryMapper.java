package uk.gegc.imagestudio.features.ledger.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.imagestudio.features.ledger.api.dto.LedgerEntryDto;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntry;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface LedgerEntryMapper {
    LedgerEntryDto toDto(LedgerEntry entity);
    List<LedgerEntryDto> toDtos(List<LedgerEntry> entities);
}
