package io.tally.core.report;

import io.tally.api.report.Failure;
import io.tally.api.report.ModuleReport;
import io.tally.api.report.TestCaseReport;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JUnitXmlRendererTest {

    private final JUnitXmlRenderer renderer = new JUnitXmlRenderer();

    private static Document parse(String xml) throws Exception {
        return DocumentBuilderFactory.newInstance()
                .newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    private static ModuleReport mathModule() {
        return new ModuleReport("math", 1, 0, 2, List.of(
                TestCaseReport.passed("addsNumbers"),
                new TestCaseReport("dividesByZero",
                        new Failure("unexpected exception", "ArithmeticException: / by zero\n\tat Math.divide", "ArithmeticException"))));
    }

    // ─── Structure ───

    @Test
    void shouldRenderSuiteWithCounters() throws Exception {
        String xml = renderer.render(mathModule());

        assertThat(xml).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");

        Element suite = parse(xml).getDocumentElement();
        assertThat(suite.getTagName()).isEqualTo("testsuite");
        assertThat(suite.getAttribute("name")).isEqualTo("math");
        assertThat(suite.getAttribute("errors")).isEqualTo("1");
        assertThat(suite.getAttribute("failures")).isEqualTo("0");
        assertThat(suite.getAttribute("tests")).isEqualTo("2");
    }

    @Test
    void shouldRenderTestcasesInOrderWithFailureOnlyWhereRecorded() throws Exception {
        Document doc = parse(renderer.render(mathModule()));

        NodeList testcases = doc.getElementsByTagName("testcase");
        assertThat(testcases.getLength()).isEqualTo(2);

        Element passed = (Element) testcases.item(0);
        assertThat(passed.getAttribute("name")).isEqualTo("addsNumbers");
        assertThat(passed.getElementsByTagName("failure").getLength()).isZero();

        Element failed = (Element) testcases.item(1);
        assertThat(failed.getAttribute("name")).isEqualTo("dividesByZero");
        Element failure = (Element) failed.getElementsByTagName("failure").item(0);
        assertThat(failure.getAttribute("message")).isEqualTo("unexpected exception");
        assertThat(failure.getAttribute("type")).isEqualTo("ArithmeticException");
        assertThat(failure.getTextContent()).isEqualTo("ArithmeticException: / by zero\n\tat Math.divide");
    }

    @Test
    void shouldRenderEmptySuite() throws Exception {
        Document doc = parse(renderer.render(new ModuleReport("empty", 0, 0, 0, List.of())));

        assertThat(doc.getDocumentElement().getAttribute("tests")).isEqualTo("0");
        assertThat(doc.getElementsByTagName("testcase").getLength()).isZero();
    }

    @Test
    void shouldRenderMissingMessageAsEmptyAttribute() throws Exception {
        var report = new ModuleReport("m", 1, 0, 1,
                List.of(new TestCaseReport("t", new Failure(null, "", null))));

        Element failure = (Element) parse(renderer.render(report)).getElementsByTagName("failure").item(0);

        assertThat(failure.hasAttribute("message")).isTrue();
        assertThat(failure.getAttribute("message")).isEmpty();
        assertThat(failure.hasAttribute("type")).isFalse();
        assertThat(failure.getTextContent()).isEmpty();
    }

    // ─── Escaping ───

    @Test
    void shouldEscapeMarkupCharacters() throws Exception {
        String nasty = "a < b && c > \"d\" 'e'";
        var report = new ModuleReport(nasty, 0, 1, 1,
                List.of(new TestCaseReport(nasty, new Failure(nasty, "<![CDATA[ ]]> " + nasty, "AssertionError"))));

        String xml = renderer.render(report);
        Document doc = parse(xml);

        assertThat(xml).doesNotContain("a < b");
        assertThat(doc.getDocumentElement().getAttribute("name")).isEqualTo(nasty);
        Element testcase = (Element) doc.getElementsByTagName("testcase").item(0);
        assertThat(testcase.getAttribute("name")).isEqualTo(nasty);
        Element failure = (Element) testcase.getElementsByTagName("failure").item(0);
        assertThat(failure.getAttribute("message")).isEqualTo(nasty);
        assertThat(failure.getTextContent()).isEqualTo("<![CDATA[ ]]> " + nasty);
    }

    @Test
    void shouldReplaceCharactersXmlCannotCarry() throws Exception {
        var report = new ModuleReport("bell\u0007", 1, 0, 1,
                List.of(new TestCaseReport("nul\u0000", new Failure("esc\u001B[31m", "trace\uFFFE", "Error"))));

        String xml = renderer.render(report);
        Document doc = parse(xml);

        assertThat(doc.getDocumentElement().getAttribute("name")).isEqualTo("bell\uFFFD");
        Element testcase = (Element) doc.getElementsByTagName("testcase").item(0);
        assertThat(testcase.getAttribute("name")).isEqualTo("nul\uFFFD");
        Element failure = (Element) testcase.getElementsByTagName("failure").item(0);
        assertThat(failure.getAttribute("message")).isEqualTo("esc\uFFFD[31m");
        assertThat(failure.getTextContent()).isEqualTo("trace\uFFFD");
    }

    @Test
    void shouldKeepSupplementaryCharacters() {
        assertThat(JUnitXmlRenderer.clean("emoji \uD83D\uDE00")).isEqualTo("emoji \uD83D\uDE00");
        assertThat(JUnitXmlRenderer.clean("lone \uD83D surrogate")).isEqualTo("lone \uFFFD surrogate");
        assertThat(JUnitXmlRenderer.clean(null)).isEmpty();
    }

    // ─── Determinism ───

    @Test
    void shouldRenderIdenticalOutputForSameReport() {
        assertThat(renderer.render(mathModule())).isEqualTo(renderer.render(mathModule()));
    }

    @Test
    void shouldUseXmlExtension() {
        assertThat(renderer.extension()).isEqualTo("xml");
    }
}
