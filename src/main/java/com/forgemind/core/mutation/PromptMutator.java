package com.forgemind.core.mutation;

import com.forgemind.core.llm.LanguageModelClient;
import com.forgemind.core.llm.LlmEmptyResponseException;
import com.forgemind.core.llm.LlmParseException;
import com.forgemind.core.metrics.ForgemindMetrics;
import com.forgemind.core.model.Action;
import com.forgemind.core.model.MutationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

/**
 * Produces prompt variants through the language model.
 * <p>
 * Every request frames the rewrite so that the action's declared output fields, its core
 * intent and the behavior's style constraints survive. An output that drops an output
 * field or repeats a parent verbatim is rejected and the request is retried once; a second
 * rejection yields {@link Optional#empty()}.
 */
@Service
public class PromptMutator {

    private static final Logger log = LoggerFactory.getLogger(PromptMutator.class);

    public static final String CROSSOVER = "CROSSOVER";
    private static final int MAX_ATTEMPTS = 2;

    private static final String SYSTEM_PROMPT = """
            You improve instruction prompts for an automated assistant.
            Rules:
            - Keep the core intent of the instruction.
            - Keep every output field name listed under OUTPUT FIELDS, spelled exactly as given.
            - Keep any {{placeholder}} tokens that appear in the original.
            - Follow every STYLE CONSTRAINT.
            Return JSON: {"prompt": "<the full new instruction>", "changeDescription": "<one sentence>"}
            """;

    private final LanguageModelClient llm;
    private final ForgemindMetrics metrics;

    public PromptMutator(LanguageModelClient llm, ForgemindMetrics metrics) {
        this.llm = llm;
        this.metrics = metrics;
    }

    public MutationStrategy chooseStrategy(Random random) {
        MutationStrategy[] strategies = MutationStrategy.values();
        return strategies[random.nextInt(strategies.length)];
    }

    public Optional<MutationOutcome> mutate(String prompt, MutationStrategy strategy, Action action,
                                            List<String> styleConstraints) {
        String user = "OPERATION: " + strategy.name() + "\n"
                + strategy.directive() + "\n\n"
                + context(action, styleConstraints)
                + "ORIGINAL INSTRUCTION:\n" + prompt;
        return request(user, action, strategy.name(), List.of(prompt));
    }

    /**
     * Merges structural elements of both parents into one instruction.
     */
    public Optional<MutationOutcome> crossover(String promptA, String promptB, Action action,
                                               List<String> styleConstraints) {
        String user = "OPERATION: CROSSOVER\n"
                + "Combine the strongest structural elements of both instructions into a single coherent "
                + "instruction. It must differ from each of them.\n\n"
                + context(action, styleConstraints)
                + "INSTRUCTION A:\n" + promptA + "\n\n"
                + "INSTRUCTION B:\n" + promptB;
        return request(user, action, CROSSOVER, List.of(promptA, promptB));
    }

    private Optional<MutationOutcome> request(String user, Action action, String operation, List<String> parents) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            MutationResponse response;
            try {
                response = llm.structuredCall(SYSTEM_PROMPT, user, MutationResponse.class);
            } catch (LlmParseException | LlmEmptyResponseException e) {
                log.warn("{} attempt {} returned unusable output: {}", operation, attempt, e.getMessage());
                metrics.incrementMutationRejections(operation);
                continue;
            }
            String rejection = rejectionReason(response, action, parents);
            if (rejection == null) {
                String description = response.changeDescription() != null && !response.changeDescription().isBlank()
                        ? response.changeDescription()
                        : operation.toLowerCase(Locale.ROOT);
                return Optional.of(new MutationOutcome(response.prompt().trim(), description, operation));
            }
            log.info("{} attempt {} rejected: {}", operation, attempt, rejection);
            metrics.incrementMutationRejections(operation);
        }
        return Optional.empty();
    }

    static String rejectionReason(MutationResponse response, Action action, List<String> parents) {
        if (response == null || response.prompt() == null || response.prompt().isBlank()) {
            return "empty prompt";
        }
        List<String> missing = OutputSchemaGuard.missingFields(response.prompt(), action);
        if (!missing.isEmpty()) {
            return "dropped output fields " + missing;
        }
        String normalized = normalize(response.prompt());
        for (String parent : parents) {
            if (normalized.equals(normalize(parent))) {
                return "identical to a parent";
            }
        }
        return null;
    }

    private static String context(Action action, List<String> styleConstraints) {
        StringBuilder sb = new StringBuilder();
        sb.append("ACTION: ").append(action.name()).append("\n");
        if (!action.outputSchema().isEmpty()) {
            sb.append("OUTPUT FIELDS: ").append(String.join(", ", action.outputSchema().keySet())).append("\n");
        }
        if (styleConstraints != null && !styleConstraints.isEmpty()) {
            sb.append("STYLE CONSTRAINTS:\n");
            styleConstraints.forEach(c -> sb.append("- ").append(c).append("\n"));
        }
        return sb.append("\n").toString();
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }

    record MutationResponse(String prompt, String changeDescription) {}
}
