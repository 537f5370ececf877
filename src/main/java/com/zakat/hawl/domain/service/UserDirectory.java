package com.zakat.hawl.domain.service;

import com.zakat.hawl.domain.model.UserProfile;

import java.util.List;
import java.util.UUID;

/**
 * Source of the user population the detection job walks, and of each user's
 * reporting currency and Nisab basis.
 */
public interface UserDirectory {

    /**
     * Every user that may need evaluation: anyone holding active assets or an open window.
     */
    List<UserProfile> findUsersToEvaluate();

    UserProfile profileOf(UUID userId);
}
