package uk.gegc.aimeter.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.aimeter.features.billing.api.dto.ChargeReceiptDto;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReceipt;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ChargeReceiptMapper {
    ChargeReceiptDto toDto(ChargeReceipt entity);
    List<ChargeReceiptDto> toDtos(List<ChargeReceipt> entities);
}
