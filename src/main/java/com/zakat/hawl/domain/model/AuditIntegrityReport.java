package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditIntegrityReport {

    private UUID recordId;
    private int totalEvents;

    @Builder.Default
    private Map<AuditEventType, Integer> eventCounts = new EnumMap<>(AuditEventType.class);

    private Instant earliest;
    private Instant latest;

    @Builder.Default
    private List<String> anomalies = new ArrayList<>();

    public boolean isClean() {
        return anomalies.isEmpty();
    }
}
