package com.alphaguard.mapper;

import com.alphaguard.audit.AuditLogEntry;
import com.alphaguard.entity.GovernanceAuditLogEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between {@link AuditLogEntry} and {@link GovernanceAuditLogEntity}.
 *
 * <p>actionDetails is a Map in the domain model and a JSON string in the entity;
 * conversion goes through {@link JsonHelper}.
 */
@Mapper(componentModel = "spring")
public interface GovernanceAuditMapper {

    @Mapping(source = "actionDetails", target = "actionDetails", qualifiedByName = "mapToJson")
    GovernanceAuditLogEntity toEntity(AuditLogEntry entry);

    @Mapping(source = "actionDetails", target = "actionDetails", qualifiedByName = "jsonToMap")
    AuditLogEntry toDomain(GovernanceAuditLogEntity entity);

    List<AuditLogEntry> toDomainList(List<GovernanceAuditLogEntity> entities);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> details) {
        return JsonHelper.toJson(details);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.toMap(json);
    }
}
