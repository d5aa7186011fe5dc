package com.searchnexus.util;

@FunctionalInterface
public interface MemoryReporter {

    long totalMemoryBytes();
}
