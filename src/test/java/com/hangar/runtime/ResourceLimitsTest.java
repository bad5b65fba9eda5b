package com.hangar.runtime;

import com.hangar.core.error.ValidationException;
import com.hangar.core.model.EnabledFeatures;
import com.hangar.core.model.ProjectConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourceLimitsTest {

    @Test
    @DisplayName("Memory suffixes k, m and g are binary multiples")
    void memoryBytes() {
        assertEquals(512L * 1024, ResourceLimits.memoryBytes("512k"));
        assertEquals(256L * 1024 * 1024, ResourceLimits.memoryBytes("256m"));
        assertEquals(1024L * 1024 * 1024, ResourceLimits.memoryBytes("1G"));
        assertEquals(1000L, ResourceLimits.memoryBytes("1000"));
    }

    @Test
    @DisplayName("Unparseable limits fall back to the defaults")
    void fallbacks() {
        assertEquals(ResourceLimits.DEFAULT_MEMORY_BYTES, ResourceLimits.memoryBytes("lots"));
        assertEquals(ResourceLimits.DEFAULT_NANO_CPUS, ResourceLimits.nanoCpus("fast"));
    }

    @Test
    @DisplayName("CPU cores convert to whole nano-CPUs")
    void nanoCpus() {
        assertEquals(500_000_000L, ResourceLimits.nanoCpus("0.5"));
        assertEquals(2_000_000_000L, ResourceLimits.nanoCpus("2"));
        assertEquals(250_000_000L, ResourceLimits.nanoCpus("0.25"));
    }

    @Test
    @DisplayName("validate rejects malformed limits")
    void validate() {
        var ok = new ProjectConfig("256m", "0.5", true, null, null, EnabledFeatures.allEnabled());
        assertDoesNotThrow(() -> ResourceLimits.validate(ok));

        var badMemory = new ProjectConfig("256mb", "0.5", true, null, null, EnabledFeatures.allEnabled());
        assertThrows(ValidationException.class, () -> ResourceLimits.validate(badMemory));

        var badCpu = new ProjectConfig("256m", "-1", true, null, null, EnabledFeatures.allEnabled());
        assertThrows(ValidationException.class, () -> ResourceLimits.validate(badCpu));
    }
}
