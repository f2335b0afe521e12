package org.carball.xtd.config;

public enum OutputFormat {
    DDL,
    RELATIONS
}
