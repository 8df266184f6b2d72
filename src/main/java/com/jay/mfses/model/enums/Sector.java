package com.jay.mfses.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.List;
import java.util.Locale;

/**
 * Sector buckets used by the sentiment sector table.
 * Providers usually hand back a free-text industry description (e.g. an SIC description
 * such as "Semiconductor Manufacturing"); {@link #fromDescription(String)} buckets it.
 */
public enum Sector {
    TECHNOLOGY("COMPUTER", "SOFTWARE", "SEMICONDUCTOR", "ELECTRONIC", "TECH", "DATA PROCESSING"),
    COMMUNICATION("TELEPHONE", "TELECOM", "BROADCAST", "CABLE", "COMMUNICATION"),
    HEALTHCARE("PHARMA", "BIOLOG", "MEDICAL", "HEALTH", "HOSPITAL"),
    FINANCIAL("BANK", "INSURANCE", "FINANCE", "FINANCIAL", "SECURITIES", "INVESTMENT"),
    ENERGY("PETROLEUM", "CRUDE", "NATURAL GAS", "OIL", "COAL", "ENERGY"),
    UTILITIES("ELECTRIC SERVICES", "UTILIT", "WATER SUPPLY"),
    REAL_ESTATE("REAL ESTATE", "REIT"),
    MATERIALS("CHEMICAL", "MINING", "STEEL", "METAL", "PAPER", "MATERIAL"),
    CONSUMER("RETAIL", "MOTOR VEHICLE", "FOOD", "BEVERAGE", "APPAREL", "RESTAURANT", "CATALOG", "HOTEL", "CONSUMER"),
    INDUSTRIAL("WAREHOUS", "MACHINERY", "AIRCRAFT", "TRUCKING", "CONSTRUCTION", "TRANSPORT", "INDUSTRIAL"),
    UNKNOWN();

    private final List<String> keywords;

    Sector(String... keywords) {
        this.keywords = List.of(keywords);
    }

    /**
     * Accepts either an enum name ("Technology", "real_estate") or a provider description.
     * Keywords are matched in declaration order, first hit wins; anything else is UNKNOWN.
     */
    @JsonCreator
    public static Sector fromDescription(String description) {
        if (description == null || description.isBlank()) return UNKNOWN;
        String normalized = description.trim().toUpperCase(Locale.ROOT);
        String asName = normalized.replace(' ', '_').replace('-', '_');
        for (Sector sector : values()) {
            if (sector.name().equals(asName)) return sector;
        }
        for (Sector sector : values()) {
            for (String keyword : sector.keywords) {
                if (normalized.contains(keyword)) return sector;
            }
        }
        return UNKNOWN;
    }
}
