package io.tally.core.fs;

import io.tally.api.report.ModuleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Assigns a report file to every module.
 * <p>
 * Module names become file stems with path separators, characters reserved on
 * common filesystems and control characters replaced by {@code _}. When two
 * modules map to the same stem, later modules get a numeric suffix, so the
 * assignment depends only on the order of the input. Stems differing only in
 * case collide when the target directory is on a case-insensitive filesystem.
 */
public final class ReportFileNamer {

    private static final Logger log = LoggerFactory.getLogger(ReportFileNamer.class);

    private static final String RESERVED = "/\\:*?\"<>|";

    public List<ReportFile> assign(List<ModuleReport> reports, Path directory, String extension) {
        return assign(reports, directory, extension, isCaseInsensitive(directory));
    }

    public List<ReportFile> assign(List<ModuleReport> reports, Path directory, String extension,
                                   boolean ignoreCase) {
        Set<String> taken = new HashSet<>();
        List<ReportFile> files = new ArrayList<>(reports.size());

        for (ModuleReport report : reports) {
            String stem = sanitize(report.name());
            String candidate = stem;
            int suffix = 2;
            while (!taken.add(ignoreCase ? candidate.toLowerCase(Locale.ROOT) : candidate)) {
                candidate = stem + "-" + suffix++;
            }
            files.add(new ReportFile(report, directory.resolve(candidate + "." + extension)));
        }
        return files;
    }

    /**
     * Checks whether the filesystem holding {@code directory} ignores case, by
     * looking up the nearest existing path element that contains letters under
     * its case-swapped name. Without such an element the filesystem is treated
     * as case-sensitive.
     */
    static boolean isCaseInsensitive(Path directory) {
        Path current = directory.toAbsolutePath().normalize();
        while (current != null && current.getFileName() != null) {
            String name = current.getFileName().toString();
            String swapped = swapCase(name);
            if (!swapped.equals(name) && Files.exists(current)) {
                Path other = current.resolveSibling(swapped);
                try {
                    return Files.exists(other) && Files.isSameFile(current, other);
                } catch (IOException e) {
                    log.debug("Could not compare {} with {}, assuming case-sensitive names", current, other, e);
                    return false;
                }
            }
            current = current.getParent();
        }
        return false;
    }

    private static String swapCase(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isUpperCase(c) ? Character.toLowerCase(c) : Character.toUpperCase(c));
        }
        return sb.toString();
    }

    static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(c < 0x20 || c == 0x7F || RESERVED.indexOf(c) >= 0 ? '_' : c);
        }
        String stem = sb.toString();
        if (stem.isBlank() || stem.equals(".") || stem.equals("..")) {
            return "_" + stem.trim();
        }
        return stem;
    }

    /**
     * A module report together with the file it is written to.
     */
    public record ReportFile(ModuleReport report, Path path) {}
}
