package arbor.core.output;

import arbor.core.exception.ParseException;
import arbor.core.exception.UnreachableException;
import arbor.core.result.Outcome;
import arbor.core.result.ResultNode;
import arbor.core.result.TestCaseResult;
import arbor.core.result.TestSuiteResult;
import arbor.core.type.NodeKind;
import arbor.core.util.ObjectChecker;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * Persists a complete result tree as JSON and reads it back, so that a later run can pick up where an earlier one left
 * off (for instance to rerun only what failed).
 *
 * Every node is written as an object with a name, uid, kind, outcome and elapsed time. Suites carry their children in
 * order. Tests may carry a reason, and so may suites that errored without being entered. The outcome of a suite is written for readers of the file but ignored when
 * reading, since it is always recomputed from the children.
 */
public final class ResultSnapshot implements ResultFormatter {
    private static final String NAME_KEY = "name";
    private static final String UID_KEY = "uid";
    private static final String KIND_KEY = "kind";
    private static final String OUTCOME_KEY = "outcome";
    private static final String ELAPSED_KEY = "elapsed_nanos";
    private static final String REASON_KEY = "reason";
    private static final String CHILDREN_KEY = "children";
    private final Gson gson;

    private ResultSnapshot(Gson gson) {
        this.gson = gson;
    }

    public static ResultSnapshot create() {
        return new ResultSnapshot(new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create());
    }

    @Override
    public void format(TestSuiteResult root, Writer writer) throws IOException {
        ObjectChecker.assertNonNull(root, writer);
        try {
            this.gson.toJson(toJson(root), writer);
        } catch (JsonIOException e) {
            throw new IOException("unable to write result snapshot: " + e.getMessage(), e);
        }
        writer.flush();
    }

    /**
     * Reads a result tree previously written by {@link ResultSnapshot#format(TestSuiteResult, Writer)}.
     *
     * @param reader The source.
     * @return the sealed result tree.
     * @throws ParseException If the content is not a valid snapshot.
     * @throws IOException If reading fails.
     */
    public TestSuiteResult read(Reader reader) throws ParseException, IOException {
        ObjectChecker.assertNonNull(reader);
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                throw new ParseException("snapshot is not a JSON object");
            }
            ResultNode root = fromJson(parsed.getAsJsonObject());
            if (root.kind() != NodeKind.SUITE) {
                throw new ParseException("snapshot root must be a " + NodeKind.SUITE + " but was a " + root.kind());
            }
            root.seal();
            return root.asSuite();
        } catch (JsonIOException e) {
            throw new IOException("unable to read result snapshot: " + e.getMessage(), e);
        } catch (JsonSyntaxException e) {
            throw new ParseException("malformed JSON: " + e.getMessage(), e);
        }
    }

    private static JsonObject toJson(ResultNode node) {
        JsonObject json = new JsonObject();
        json.addProperty(NAME_KEY, node.getName());
        json.addProperty(UID_KEY, node.getUid());
        json.addProperty(KIND_KEY, node.kind().name());
        json.addProperty(OUTCOME_KEY, String.valueOf(node.getOutcome()));
        json.addProperty(ELAPSED_KEY, node.getElapsedNanos());

        switch (node.kind()) {
            case TEST:
                if (node.asTest().getReason() != null) {
                    json.addProperty(REASON_KEY, node.asTest().getReason());
                }
                break;
            case SUITE:
                if (node.asSuite().getErrorReason() != null) {
                    json.addProperty(REASON_KEY, node.asSuite().getErrorReason());
                }
                JsonArray children = new JsonArray();
                for (ResultNode child : node.asSuite().getResults()) {
                    children.add(toJson(child));
                }
                json.add(CHILDREN_KEY, children);
                break;
            default:
                throw new UnreachableException("unknown result kind: " + node.kind());
        }
        return json;
    }

    private static ResultNode fromJson(JsonObject json) throws ParseException {
        String name = parseAsString(json, NAME_KEY);
        String uid = parseAsString(json, UID_KEY);
        NodeKind kind = parseAsEnum(NodeKind.class, json, KIND_KEY);
        long elapsedNanos = parseAsLong(json, ELAPSED_KEY);

        switch (kind) {
            case TEST:
                Outcome outcome = parseAsEnum(Outcome.class, json, OUTCOME_KEY);
                String reason = json.has(REASON_KEY) ? parseAsString(json, REASON_KEY) : null;
                return TestCaseResult.restored(name, uid, outcome, elapsedNanos, reason);
            case SUITE:
                TestSuiteResult suite = TestSuiteResult.restored(name, uid, elapsedNanos);
                if (json.has(REASON_KEY)) {
                    suite.markError(parseAsString(json, REASON_KEY));
                }
                for (JsonElement child : parseAsJsonArray(json, CHILDREN_KEY)) {
                    if (!child.isJsonObject()) {
                        throw new ParseException("expected every element of " + CHILDREN_KEY + " to be a JSON Object");
                    }
                    suite.addResult(fromJson(child.getAsJsonObject()));
                }
                return suite;
            default:
                throw new UnreachableException("unknown result kind: " + kind);
        }
    }

    private static <E extends Enum<E>> E parseAsEnum(Class<E> type, JsonObject json, String attribute) throws ParseException {
        String value = parseAsString(json, attribute);
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            throw new ParseException("unknown " + attribute + ": " + value, e);
        }
    }

    private static long parseAsLong(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new ParseException("expected " + attribute + " to be a Number");
        }
        long value = element.getAsLong();
        if (value < 0) {
            throw new ParseException("expected " + attribute + " to be non-negative");
        }
        return value;
    }

    private static String parseAsString(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonPrimitive()) {
            throw new ParseException("expected " + attribute + " to be a String");
        }
        return element.getAsString();
    }

    private static JsonArray parseAsJsonArray(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonArray()) {
            throw new ParseException("expected " + attribute + " to be a JSON Array");
        }
        return element.getAsJsonArray();
    }

    private static JsonElement getElementFromAttribute(JsonObject json, String attribute) throws ParseException {
        if (!json.has(attribute) || json.get(attribute).isJsonNull()) {
            throw new ParseException("missing " + attribute);
        }
        return json.get(attribute);
    }
}
