package com.example.cronishe.mapper;

import com.example.cronishe.domain.entity.JobRun;
import com.example.cronishe.dto.RunResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper for converting runs to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface RunMapper {

    RunResponse toResponse(JobRun run);
}
