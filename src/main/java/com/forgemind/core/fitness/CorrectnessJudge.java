package com.forgemind.core.fitness;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgemind.core.llm.Completion;
import com.forgemind.core.llm.LanguageModelClient;
import com.forgemind.core.llm.LenientJson;
import com.forgemind.core.llm.LlmEmptyResponseException;
import com.forgemind.core.llm.LlmParseException;
import com.forgemind.core.model.Action;
import com.forgemind.core.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores one action output against a test case.
 * <p>
 * Cases with an expected answer are compared directly: exact text match, or a JSON
 * subset comparison when the expected answer is JSON. Open-ended cases are judged by the
 * language model on a 0-10 scale; if its JSON cannot be parsed, a {@code Score: X/10}
 * line in the raw text is used instead.
 */
@Component
public class CorrectnessJudge {

    private static final Logger log = LoggerFactory.getLogger(CorrectnessJudge.class);

    private static final Pattern SCORE_PATTERN =
            Pattern.compile("(?i)score\"?\\s*[:=]\\s*(\\d{1,2}(?:\\.\\d+)?)(?:\\s*/\\s*10)?");

    private static final String JUDGE_SYSTEM_PROMPT =
            "You grade the output of an automated assistant action.\n" +
            "Compare the OUTPUT to the EXPECTATION for the given INPUT.\n" +
            "Score 10 when the output fully satisfies the expectation, 5 when it is partially right, " +
            "0 when it is wrong or missing.\n" +
            "Respond with JSON: {\"score\": <integer 0-10>, \"reasoning\": \"<one sentence>\"}";

    private final LanguageModelClient llm;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CorrectnessJudge(LanguageModelClient llm) {
        this.llm = llm;
    }

    public Judgment judge(Action action, TestCase testCase, String output) {
        if (output == null || output.isBlank()) {
            return Judgment.of(0.0, "empty output");
        }
        if (!testCase.openEnded()) {
            return compare(testCase.expectedOutput(), output);
        }
        return askModel(action, testCase, output);
    }

    // ── direct comparison ─────────────────────────────────────────

    Judgment compare(String expected, String output) {
        if (normalize(expected).equals(normalize(output))) {
            return Judgment.of(1.0, "exact match");
        }
        JsonNode expectedJson = readJson(expected);
        if (expectedJson == null || !expectedJson.isContainerNode()) {
            return Judgment.of(0.0, "output differs from expected answer");
        }
        JsonNode actualJson = readJson(LenientJson.stripFences(output));
        if (actualJson == null) {
            return Judgment.of(0.0, "output is not JSON");
        }
        if (expectedJson.isArray()) {
            return expectedJson.equals(actualJson)
                    ? Judgment.of(1.0, "JSON arrays equal")
                    : Judgment.of(0.0, "JSON arrays differ");
        }
        int total = expectedJson.size();
        if (total == 0) {
            return Judgment.of(actualJson.isObject() ? 1.0 : 0.0, "empty expected object");
        }
        int matched = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = expectedJson.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            if (subsetOf(field.getValue(), actualJson.get(field.getKey()))) {
                matched++;
            }
        }
        return Judgment.of((double) matched / total, matched + " of " + total + " expected fields matched");
    }

    private static boolean subsetOf(JsonNode expected, JsonNode actual) {
        if (actual == null) {
            return false;
        }
        if (expected.isObject() && actual.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                if (!subsetOf(field.getValue(), actual.get(field.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (expected.isTextual() && actual.isTextual()) {
            return normalize(expected.asText()).equals(normalize(actual.asText()));
        }
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }
        return expected.equals(actual);
    }

    private JsonNode readJson(String text) {
        String trimmed = text.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return null;
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    // ── model judgment ────────────────────────────────────────────

    private Judgment askModel(Action action, TestCase testCase, String output) {
        String expectation = testCase.rubric() != null && !testCase.rubric().isBlank()
                ? testCase.rubric()
                : "A correct, complete response for the action '" + action.name() + "'"
                  + (action.outputSchema().isEmpty() ? "" : " providing " + String.join(", ", action.outputSchema().keySet()));
        String user = "ACTION: " + action.name() + "\n\n"
                + "INPUT:\n" + LlmActionExecutor.formatInput(testCase.input()) + "\n\n"
                + "EXPECTATION:\n" + expectation + "\n\n"
                + "OUTPUT:\n" + output;

        Completion completion = llm.complete(JUDGE_SYSTEM_PROMPT, user);
        String raw = completion.text();
        try {
            JudgeResponse parsed = LenientJson.parse(raw, JudgeResponse.class);
            return Judgment.of(parsed.score() / 10.0, parsed.reasoning());
        } catch (LlmParseException | LlmEmptyResponseException e) {
            Matcher m = SCORE_PATTERN.matcher(raw);
            if (m.find()) {
                double score = Double.parseDouble(m.group(1));
                log.info("Extracted judge score {} via regex for case {}", score, testCase.id());
                return Judgment.of(score / 10.0, "score extracted from unstructured judgment");
            }
            log.warn("Judge response for case {} had no score, treating as incorrect", testCase.id());
            return Judgment.of(0.0, "unparseable judgment");
        }
    }

    record JudgeResponse(double score, String reasoning) {}
}
