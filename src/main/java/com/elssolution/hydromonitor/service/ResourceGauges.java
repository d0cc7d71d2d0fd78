package com.elssolution.hydromonitor.service;

import org.springframework.stereotype.Component;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/** Host/JVM usage figures reported in the system status. All percentages are 0..100. */
@Component
public class ResourceGauges {

    private final File volume = new File(".");

    public double cpuUsage() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        double load = os.getSystemLoadAverage(); // -1 when unavailable (Windows)
        if (load < 0) return 0.0;
        return round1(clampPct(load / Math.max(1, os.getAvailableProcessors()) * 100.0));
    }

    public double memoryUsage() {
        Runtime rt = Runtime.getRuntime();
        long used = rt.totalMemory() - rt.freeMemory();
        return round1(clampPct(used * 100.0 / Math.max(1L, rt.maxMemory())));
    }

    public double storageUsage() {
        long total = volume.getTotalSpace();
        if (total <= 0) return 0.0;
        return round1(clampPct((total - volume.getUsableSpace()) * 100.0 / total));
    }

    public String uptime() {
        return humanUptime(ManagementFactory.getRuntimeMXBean().getUptime());
    }

    /** "3d 14h 22m" style; days omitted when zero. */
    static String humanUptime(long uptimeMs) {
        long totalMin = Math.max(0, uptimeMs) / 60_000;
        long d = totalMin / (24 * 60);
        long h = (totalMin / 60) % 24;
        long m = totalMin % 60;
        return d > 0 ? d + "d " + h + "h " + m + "m" : h + "h " + m + "m";
    }

    private static double clampPct(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }

    private static double round1(double v) { return Math.round(v * 10.0) / 10.0; }
}
