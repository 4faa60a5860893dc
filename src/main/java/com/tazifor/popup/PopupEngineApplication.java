package com.tazifor.popup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Popup Engine - storefront popup decision service
 *
 * Decides, for each storefront page view, whether to show a marketing popup,
 * which one, and which experiment variant:
 * - Targeting by page, audience, device and country
 * - Atomic per-visitor frequency capping
 * - Sticky, hash-based A/B assignment
 * - Priority arbitration per display surface
 *
 * Built with Spring Boot and Aerospike.
 */
@SpringBootApplication
public class PopupEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PopupEngineApplication.class, args);
    }
}
