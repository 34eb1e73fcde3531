package com.lineagescope.core.scanner.impl.hadoop;

import com.lineagescope.core.scanner.ScanContext;

import java.nio.file.Path;
import java.util.Set;

/**
 * Locates the workflow a Hadoop file belongs to.
 *
 * <p>Workflow repositories keep one directory per workflow with a subdirectory per
 * technology ({@code daily_orders/oozie/workflow.xml},
 * {@code daily_orders/hive/load.hql}, {@code daily_orders/spark/enrich.py},
 * {@code daily_orders/pig/clean.pig}). Files in such a subdirectory belong to its
 * parent; any other file belongs to its own directory. Adapters that agree on the
 * workflow directory agree on the process.
 */
final class WorkflowLayout {

    private static final Set<String> TECHNOLOGY_DIRECTORIES = Set.of("oozie", "hive", "spark", "pig");

    private WorkflowLayout() {
    }

    static Path workflowDirectory(Path file) {
        Path parent = file.toAbsolutePath().normalize().getParent();
        if (parent == null) {
            return file;
        }
        Path name = parent.getFileName();
        if (name != null && TECHNOLOGY_DIRECTORIES.contains(name.toString()) && parent.getParent() != null) {
            return parent.getParent();
        }
        return parent;
    }

    static String workflowName(Path file, ScanContext context) {
        Path directory = workflowDirectory(file);
        Path name = directory.getFileName();
        if (name == null || directory.equals(context.rootPath().toAbsolutePath().normalize())) {
            return context.scanName();
        }
        return name.toString();
    }

    static String scanIdentifier(Path file, ScanContext context) {
        Path root = context.rootPath().toAbsolutePath().normalize();
        String relative = root.relativize(workflowDirectory(file)).toString().replace('\\', '/');
        return "hadoop:" + (relative.isEmpty() ? "." : relative);
    }

    static String relativeDirectory(Path file, ScanContext context) {
        Path root = context.rootPath().toAbsolutePath().normalize();
        String relative = root.relativize(workflowDirectory(file)).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }
}
