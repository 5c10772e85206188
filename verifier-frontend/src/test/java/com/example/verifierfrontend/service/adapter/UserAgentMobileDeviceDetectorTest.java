package com.example.verifierfrontend.service.adapter;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class UserAgentMobileDeviceDetectorTest {

    // analyzer start-up loads the full rule set, so one instance serves all cases
    private static final UserAgentMobileDeviceDetector DETECTOR = new UserAgentMobileDeviceDetector();

    @ParameterizedTest
    @ValueSource(strings = {
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_4 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Mobile/15E148 Safari/604.1",
            "Mozilla/5.0 (Linux; Android 14; Pixel 8) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Mobile Safari/537.36"
    })
    void phonesAreMobile(String userAgent) {
        assertThat(DETECTOR.isMobile(userAgent)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Mozilla/5.0 (iPad; CPU OS 17_4 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Mobile/15E148 Safari/604.1",
            "Mozilla/5.0 (Linux; Android 13; SM-X700) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_4) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15"
    })
    void tabletsAndDesktopsAreNotMobile(String userAgent) {
        assertThat(DETECTOR.isMobile(userAgent)).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    void blankUserAgentIsNotMobile(String userAgent) {
        assertThat(DETECTOR.isMobile(userAgent)).isFalse();
    }

}
