package uk.gegc.imagestudio.features.audit.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.imagestudio.features.audit.api.dto.AuditRecordDto;
import uk.gegc.imagestudio.features.audit.domain.model.AuditRecord;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface AuditRecordMapper {

    @Mapping(target = "details", source = "detailsJson")
    AuditRecordDto toDto(AuditRecord record);
}
