package com.firehose.infrastructure.system;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads resident set size from {@code /proc/self/status} (VmRSS).
 * 
 * Where procfs is unavailable the committed heap plus non-heap memory of the
 * JVM is used instead, which underestimates RSS but tracks it.
 */
@Slf4j
@Component
public class ProcessMemoryProbe implements MemoryProbe {
    
    private static final Path PROC_STATUS = Path.of("/proc/self/status");
    private static final String RSS_FIELD = "VmRSS:";
    
    private final Path statusFile;
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private volatile boolean procfsAvailable;
    
    public ProcessMemoryProbe() {
        this(PROC_STATUS);
    }
    
    ProcessMemoryProbe(Path statusFile) {
        this.statusFile = statusFile;
        this.procfsAvailable = Files.isReadable(statusFile);
        if (!procfsAvailable) {
            log.info("{} not readable, using JVM committed memory for backpressure", statusFile);
        }
    }
    
    @Override
    public long residentMegabytes() {
        if (procfsAvailable) {
            try {
                return readRssMegabytes(Files.readAllLines(statusFile));
            } catch (IOException | NumberFormatException e) {
                procfsAvailable = false;
                log.warn("Cannot read RSS from {}, falling back to JVM committed memory: {}", statusFile, e.getMessage());
            }
        }
        long committed = memoryBean.getHeapMemoryUsage().getCommitted()
                + memoryBean.getNonHeapMemoryUsage().getCommitted();
        return committed / (1024 * 1024);
    }
    
    static long readRssMegabytes(List<String> statusLines) {
        for (String line : statusLines) {
            if (line.startsWith(RSS_FIELD)) {
                String[] parts = line.substring(RSS_FIELD.length()).trim().split("\\s+");
                return Long.parseLong(parts[0]) / 1024;
            }
        }
        throw new NumberFormatException(RSS_FIELD + " not present");
    }
}
