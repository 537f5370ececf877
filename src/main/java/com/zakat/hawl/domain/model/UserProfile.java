package com.zakat.hawl.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * The per-user settings the Hawl engine needs: reporting currency and preferred Nisab basis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {

    private UUID userId;
    private String currency;
    private NisabBasis nisabBasis;
}
