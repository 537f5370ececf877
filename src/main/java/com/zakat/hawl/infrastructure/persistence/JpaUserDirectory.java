package com.zakat.hawl.infrastructure.persistence;

import com.zakat.hawl.domain.model.NisabBasis;
import com.zakat.hawl.domain.model.RecordStatus;
import com.zakat.hawl.domain.model.UserProfile;
import com.zakat.hawl.domain.service.UserDirectory;
import com.zakat.hawl.infrastructure.persistence.repository.AssetRepository;
import com.zakat.hawl.infrastructure.persistence.repository.NisabYearRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Derives the user population from the asset table and from open windows.
 *
 * Users holding a draft are included even with no assets left, otherwise a window
 * whose wealth dropped to zero would never be seen as interrupted.
 */
@Slf4j
@Component
public class JpaUserDirectory implements UserDirectory {

    private final AssetRepository assetRepository;
    private final NisabYearRecordRepository recordRepository;
    private final String defaultCurrency;
    private final NisabBasis defaultBasis;

    public JpaUserDirectory(AssetRepository assetRepository,
                            NisabYearRecordRepository recordRepository,
                            @Value("${app.nisab.default-currency:USD}") String defaultCurrency,
                            @Value("${app.nisab.default-basis:GOLD}") NisabBasis defaultBasis) {
        this.assetRepository = assetRepository;
        this.recordRepository = recordRepository;
        this.defaultCurrency = defaultCurrency.toUpperCase(Locale.ROOT);
        this.defaultBasis = defaultBasis;
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserProfile> findUsersToEvaluate() {
        Set<UUID> userIds = new LinkedHashSet<>(assetRepository.findUserIdsWithActiveAssets());
        userIds.addAll(recordRepository.findUserIdsWithStatus(RecordStatus.DRAFT));

        log.debug("Resolved {} users to evaluate", userIds.size());

        return userIds.stream()
                .map(this::profileOf)
                .collect(Collectors.toList());
    }

    @Override
    public UserProfile profileOf(UUID userId) {
        return UserProfile.builder()
                .userId(userId)
                .currency(defaultCurrency)
                .nisabBasis(defaultBasis)
                .build();
    }
}
