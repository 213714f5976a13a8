package uk.gegc.imagestudio.features.admission.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.imagestudio.features.admission.api.dto.AdmissionDto;
import uk.gegc.imagestudio.features.admission.domain.model.Admission;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface AdmissionMapper {
    AdmissionDto toDto(Admission admission);
}
