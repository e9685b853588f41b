package com.firehose.infrastructure.system;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessMemoryProbeTest {

    @Test
    void readRssMegabytes_parsesVmRssLine() {
        List<String> status = List.of(
                "Name:\tjava",
                "VmPeak:\t 4194304 kB",
                "VmRSS:\t  1258291 kB",
                "Threads:\t42");

        assertEquals(1228, ProcessMemoryProbe.readRssMegabytes(status));
    }

    @Test
    void readRssMegabytes_missingFieldFails() {
        assertThrows(NumberFormatException.class,
                () -> ProcessMemoryProbe.readRssMegabytes(List.of("Name:\tjava")));
    }

    @Test
    void residentMegabytes_readsStatusFile(@TempDir Path dir) throws Exception {
        Path status = dir.resolve("status");
        Files.write(status, List.of("Name:\tjava", "VmRSS:\t 524288 kB"));

        assertEquals(512, new ProcessMemoryProbe(status).residentMegabytes());
    }

    @Test
    void residentMegabytes_fallsBackToJvmMemoryWithoutProcfs(@TempDir Path dir) {
        ProcessMemoryProbe probe = new ProcessMemoryProbe(dir.resolve("missing"));

        assertTrue(probe.residentMegabytes() > 0);
    }

    @Test
    void residentMegabytes_fallsBackWhenStatusHasNoRss(@TempDir Path dir) throws Exception {
        Path status = dir.resolve("status");
        Files.write(status, List.of("Name:\tjava"));
        ProcessMemoryProbe probe = new ProcessMemoryProbe(status);

        assertTrue(probe.residentMegabytes() > 0);
    }
}
