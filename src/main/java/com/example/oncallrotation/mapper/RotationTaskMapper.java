package com.example.oncallrotation.mapper;

import com.example.oncallrotation.domain.entity.RotationTask;
import com.example.oncallrotation.dto.RotationTaskResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface RotationTaskMapper {

    @Mapping(target = "retired", expression = "java(task.isRetired())")
    @Mapping(target = "hasPagerDutyToken", expression = "java(task.getPagerDutyToken() != null)")
    RotationTaskResponse toResponse(RotationTask task);

    List<RotationTaskResponse> toResponseList(List<RotationTask> tasks);
}
