package com.example.verifierfrontend.service.adapter;

import com.example.verifierfrontend.service.port.MobileDeviceDetector;
import nl.basjes.parse.useragent.UserAgent;
import nl.basjes.parse.useragent.UserAgentAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Classifies a User-Agent with YAUAA. Only phones count as mobile: tablets get the cross-device
 * (QR code) flow like desktops.
 */
@Component
public class UserAgentMobileDeviceDetector implements MobileDeviceDetector {

    private static final Logger logger = LoggerFactory.getLogger(UserAgentMobileDeviceDetector.class);

    private static final String PHONE = "Phone";

    private final UserAgentAnalyzer analyzer;

    public UserAgentMobileDeviceDetector() {
        this.analyzer = UserAgentAnalyzer.newBuilder()
                .hideMatcherLoadStats()
                .withField(UserAgent.DEVICE_CLASS)
                .withCache(10_000)
                .build();
    }

    @Override
    public boolean isMobile(String userAgent) {
        if (!StringUtils.hasText(userAgent)) {
            return false;
        }
        String deviceClass = analyzer.parse(userAgent).getValue(UserAgent.DEVICE_CLASS);
        logger.debug("User-Agent device class: {}", deviceClass);
        return PHONE.equals(deviceClass);
    }

}
