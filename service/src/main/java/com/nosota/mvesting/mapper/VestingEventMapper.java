package com.nosota.mvesting.mapper;

import com.nosota.mvesting.api.dto.VestingEventDTO;
import com.nosota.mvesting.model.VestingEvent;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for VestingEvent entity to VestingEventDTO conversion.
 */
@Mapper
public interface VestingEventMapper {

    VestingEventMapper INSTANCE = Mappers.getMapper(VestingEventMapper.class);

    VestingEventDTO toDTO(VestingEvent event);

    List<VestingEventDTO> toDTOList(List<VestingEvent> events);
}
