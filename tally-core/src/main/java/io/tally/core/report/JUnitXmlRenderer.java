package io.tally.core.report;

import io.tally.api.error.ReportRenderException;
import io.tally.api.report.Failure;
import io.tally.api.report.ModuleReport;
import io.tally.api.report.ReportRenderer;
import io.tally.api.report.TestCaseReport;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;

/**
 * Renders a module report as a JUnit XML document, for integration with JUnit
 * compatible tools like Jenkins.
 * <p>
 * One {@code <testsuite>} per document, one {@code <testcase>} per test, and a
 * nested {@code <failure>} carrying the message and backtrace of failed tests.
 * Assertion failures and errors share the {@code <failure>} element; only the
 * suite counters tell them apart. Characters that XML 1.0 cannot carry are
 * replaced with U+FFFD. Rendering the same report always yields the same text.
 */
public class JUnitXmlRenderer implements ReportRenderer {

    static final char REPLACEMENT = '\uFFFD';

    @Override
    public String render(ModuleReport report) {
        Document doc = newDocument();

        Element root = doc.createElement("testsuite");
        root.setAttribute("name", clean(report.name()));
        root.setAttribute("errors", String.valueOf(report.errorCount()));
        root.setAttribute("failures", String.valueOf(report.failureCount()));
        root.setAttribute("tests", String.valueOf(report.tests()));
        doc.appendChild(root);

        for (TestCaseReport testcase : report.testcases()) {
            Element test = doc.createElement("testcase");
            test.setAttribute("name", clean(testcase.name()));

            testcase.failureIfAny().ifPresent(failure -> test.appendChild(failureElement(doc, failure)));

            root.appendChild(test);
        }
        return serialize(doc, report.name());
    }

    private static Element failureElement(Document doc, Failure failure) {
        Element element = doc.createElement("failure");
        element.setAttribute("message", clean(failure.message()));
        if (failure.type() != null) {
            element.setAttribute("type", clean(failure.type()));
        }
        String backtrace = clean(failure.backtrace());
        if (!backtrace.isEmpty()) {
            element.appendChild(doc.createTextNode(backtrace));
        }
        return element;
    }

    @Override
    public String extension() {
        return "xml";
    }

    private static Document newDocument() {
        try {
            DocumentBuilder docBuilder = DocumentBuilderFactory.newInstance().newDocumentBuilder();
            Document doc = docBuilder.newDocument();
            doc.setXmlStandalone(true);
            return doc;
        } catch (ParserConfigurationException e) {
            throw new ReportRenderException("Failed to create XML document builder", e);
        }
    }

    private static String serialize(Document doc, String moduleName) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new ReportRenderException("Failed to render report for module " + moduleName, e);
        }
    }

    /**
     * Replaces every code point XML 1.0 forbids with U+FFFD. Null becomes empty.
     */
    static String clean(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = null;
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            int width = Character.charCount(cp);
            if (!isXmlChar(cp)) {
                if (sb == null) {
                    sb = new StringBuilder(value.length());
                    sb.append(value, 0, i);
                }
                sb.append(REPLACEMENT);
            } else if (sb != null) {
                sb.appendCodePoint(cp);
            }
            i += width;
        }
        return sb == null ? value : sb.toString();
    }

    private static boolean isXmlChar(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }
}
