package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditTrail {

    private UUID recordId;

    @Builder.Default
    private List<AuditTrailEntryView> entries = new ArrayList<>();

    private AuditIntegrityReport integrity;
}
