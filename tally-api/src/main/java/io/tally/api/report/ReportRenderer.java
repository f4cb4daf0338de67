package io.tally.api.report;

/**
 * Renders one module's report into the text of a report file.
 * Implementations are pure and never touch the filesystem.
 */
public interface ReportRenderer {

    /**
     * @param report the finalized module report
     * @return the rendered document
     */
    String render(ModuleReport report);

    /**
     * @return file extension without the dot (e.g., "xml")
     */
    String extension();
}
