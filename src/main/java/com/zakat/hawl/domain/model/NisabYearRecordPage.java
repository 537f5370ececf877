package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NisabYearRecordPage {

    @Builder.Default
    private List<NisabYearRecordView> records = new ArrayList<>();

    private long total;
    private int limit;
    private long offset;
}
