package arbor.core.output;

import arbor.core.result.Outcome;
import arbor.core.result.TestCaseResult;
import arbor.core.result.TestSuiteResult;
import arbor.core.result.Timer;
import arbor.core.util.ObjectChecker;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.Writer;

/**
 * Renders a result tree as a JUnit XML report.
 *
 * JUnit XML cannot nest suites, so the tree is flattened first (see {@link ResultFlattener}). The document holds one
 * {@code testsuite} element per flat suite inside a single {@code testsuites} element. PASS and XFAIL are both reported
 * as plain passing test cases. Characters that XML 1.0 does not allow, such as the escape codes of colored messages,
 * are replaced with {@code '?'}.
 */
public final class JUnitFormatter implements ResultFormatter {
    private static final int TIME_SCALE = 6;
    private static final char REPLACEMENT = '?';
    private final boolean translateNames;

    private JUnitFormatter(boolean translateNames) {
        this.translateNames = translateNames;
    }

    /**
     * Returns a formatter that translates '/' into '.' and '.' into '-' in every name it writes.
     *
     * @return the formatter.
     */
    public static JUnitFormatter translatingNames() {
        return new JUnitFormatter(true);
    }

    /**
     * Returns a formatter that writes names exactly as they are.
     *
     * @return the formatter.
     */
    public static JUnitFormatter keepingNames() {
        return new JUnitFormatter(false);
    }

    @Override
    public void format(TestSuiteResult root, Writer writer) throws IOException {
        ObjectChecker.assertNonNull(root, writer);
        try {
            Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            Element testSuites = document.createElement("testsuites");
            document.appendChild(testSuites);

            for (FlatSuite suite : ResultFlattener.flatten(root)) {
                testSuites.appendChild(convertSuite(document, suite));
            }

            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            writer.flush();
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IOException("unable to render JUnit report: " + e.getMessage(), e);
        }
    }

    private Element convertSuite(Document document, FlatSuite suite) {
        String suiteName = translate(suite.name);
        Element xmlSuite = document.createElement("testsuite");
        xmlSuite.setAttribute("name", suiteName);
        xmlSuite.setAttribute("time", Timer.nanosToSecondsString(suite.elapsedNanos, TIME_SCALE));
        xmlSuite.setAttribute("errors", String.valueOf(suite.count(Outcome.ERROR)));
        xmlSuite.setAttribute("failures", String.valueOf(suite.count(Outcome.FAIL)));
        xmlSuite.setAttribute("skipped", String.valueOf(suite.count(Outcome.SKIP)));
        xmlSuite.setAttribute("tests", String.valueOf(suite.getTests().size()));

        for (TestCaseResult test : suite.getTests()) {
            xmlSuite.appendChild(convertTest(document, suiteName, test));
        }
        return xmlSuite;
    }

    private Element convertTest(Document document, String suiteName, TestCaseResult test) {
        Element xmlTest = document.createElement("testcase");
        xmlTest.setAttribute("name", translate(test.getName()));
        xmlTest.setAttribute("classname", suiteName);
        xmlTest.setAttribute("time", test.getTimer().toSecondsString(TIME_SCALE));

        String stateElement = stateElementFor(test.getOutcome());
        if (stateElement != null) {
            Element xmlState = document.createElement(stateElement);
            if (test.getReason() != null) {
                String reason = toXmlText(test.getReason());
                xmlState.setAttribute("message", reason);
                xmlState.setTextContent(reason);
            }
            xmlTest.appendChild(xmlState);
        }
        return xmlTest;
    }

    // Returns null for outcomes that JUnit reports as passing.
    private static String stateElementFor(Outcome outcome) {
        if (outcome == null || outcome.isPassing()) {
            return null;
        }
        switch (outcome) {
            case SKIP:
                return "skipped";
            case ERROR:
                return "error";
            case FAIL:
                return "failure";
            default:
                return null;
        }
    }

    static String toXmlText(String text) {
        StringBuilder cleaned = new StringBuilder(text.length());
        int index = 0;
        while (index < text.length()) {
            int codePoint = text.codePointAt(index);
            if (isXmlCharacter(codePoint)) {
                cleaned.appendCodePoint(codePoint);
            } else {
                cleaned.append(REPLACEMENT);
            }
            index += Character.charCount(codePoint);
        }
        return cleaned.toString();
    }

    private static boolean isXmlCharacter(int codePoint) {
        return codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
                || (codePoint >= 0x20 && codePoint <= 0xD7FF)
                || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
                || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
    }

    String translate(String name) {
        if (!this.translateNames) {
            return toXmlText(name);
        }
        name = toXmlText(name);
        StringBuilder translated = new StringBuilder(name.length());
        for (char character : name.toCharArray()) {
            if (character == '/') {
                translated.append('.');
            } else if (character == '.') {
                translated.append('-');
            } else {
                translated.append(character);
            }
        }
        return translated.toString();
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { translate names: " + this.translateNames + " }";
    }
}
