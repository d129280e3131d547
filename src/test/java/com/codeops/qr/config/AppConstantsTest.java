package com.codeops.qr.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for AppConstants verifying accessibility and expected values.
 */
class AppConstantsTest {

    @Test
    void constants_areAccessibleAndNonNull() {
        assertThat(AppConstants.API_PREFIX).isEqualTo("/v1");
        assertThat(AppConstants.SERVICE_NAME).isEqualTo("codeops-qr");
        assertThat(AppConstants.TOKEN_TYPE).isEqualTo("bearer");
        assertThat(AppConstants.DEFAULT_TOKEN_TTL_SECONDS).isEqualTo(1800);
        assertThat(AppConstants.MAX_DATA_LENGTH).isEqualTo(2000);
        assertThat(AppConstants.MIN_SECRET_LENGTH).isEqualTo(32);
    }

    @Test
    void smallestSizeFitsQuietZoneAtMinimumModuleSize() {
        int quietZone = 2 * AppConstants.QR_MARGIN_MODULES;
        assertThat((quietZone + 21) * AppConstants.MIN_PIXELS_PER_MODULE).isLessThan(150);
        assertThat(AppConstants.MIN_PIXELS_PER_MODULE).isGreaterThanOrEqualTo(2);
    }
}
