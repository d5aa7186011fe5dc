package com.searchnexus.util;

import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

@Component
public class OsMemoryReporter implements MemoryReporter {

    @Override
    public long totalMemoryBytes() {
        OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (bean instanceof com.sun.management.OperatingSystemMXBean) {
            return ((com.sun.management.OperatingSystemMXBean) bean).getTotalMemorySize();
        }
        return Runtime.getRuntime().maxMemory();
    }
}
