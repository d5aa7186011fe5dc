package com.searchnexus.model;

public enum ValidationMode {
    CREATE,
    UPDATE
}
