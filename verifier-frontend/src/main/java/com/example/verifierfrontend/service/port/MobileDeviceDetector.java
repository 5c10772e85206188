package com.example.verifierfrontend.service.port;

@FunctionalInterface
public interface MobileDeviceDetector {

    boolean isMobile(String userAgent);

}
