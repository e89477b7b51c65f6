package dev.pairreview.domain.enums;

public enum ConfigType {
    SINGLE, COUNCIL
}
