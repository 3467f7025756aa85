// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.validation;

import static sh.pollkit.core.validation.Rules.isBlank;
import static sh.pollkit.core.validation.Rules.prefix;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pollkit.core.DebugLogger;
import sh.pollkit.core.SurveyProtocol;
import sh.pollkit.core.model.EligibilityRole;
import sh.pollkit.core.model.Lifecycle;
import sh.pollkit.core.model.NumericConstraints;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Question;
import sh.pollkit.core.model.ReferenceAction;
import sh.pollkit.core.model.VoteWeighting;
import sh.pollkit.primitives.Hex;

/**
 * Checks a survey definition against the label 17 structural rules.
 *
 * <p>Every violated rule is reported, in a stable order: poll-level text fields,
 * then questions in list order, then optional poll fields. Errors about a question
 * from a {@code questions} list are prefixed with its id, or with
 * {@code questions[i]} when it has none. Every listed question needs its own
 * id, even in a one-element list. Errors about a legacy single-question
 * definition carry no prefix.
 *
 * <p>Option elements must be non-null whatever the method, so that a valid
 * definition always encodes. Method rules are skipped for a question without a
 * {@code methodType}; the missing type is reported instead.
 */
public final class DefinitionValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DefinitionValidator.class);

    private DefinitionValidator() {
    }

    /**
     * Validates a definition.
     *
     * @param definition the definition
     * @return the verdict
     */
    public static ValidationResult validate(final PollDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        final List<String> errors = new ArrayList<>();

        if (isBlank(definition.title())) {
            errors.add("title is required");
        }
        if (isBlank(definition.description())) {
            errors.add("description is required");
        }

        if (definition.hasQuestionList()) {
            if (definition.hasLegacyFields()) {
                errors.add("question, methodType and method fields must be absent when questions is present");
            }
            validateQuestionList(definition.questions(), errors);
        } else if (definition.hasLegacyFields()) {
            validateQuestion(definition.legacyQuestion(), "", errors);
        } else {
            errors.add("at least one question is required");
        }

        validateEligibility(definition.eligibility(), errors);
        if (definition.voteWeighting() != null
                && VoteWeighting.fromWireName(definition.voteWeighting()).isEmpty()) {
            errors.add("Invalid voteWeighting: " + definition.voteWeighting());
        }
        if (definition.referenceAction() != null) {
            validateReferenceAction(definition.referenceAction(), errors);
        }
        if (definition.lifecycle() != null) {
            validateLifecycle(definition.lifecycle(), errors);
        }

        final ValidationResult result = ValidationResult.of(errors);
        LOG.debug("Definition '{}' validated: {} error(s)", definition.title(), errors.size());
        DebugLogger.logValidation("[VALIDATE] definition title=%s valid=%s errors=%s",
                definition.title(), result.valid(), errors);
        return result;
    }

    private static void validateQuestionList(final List<Question> questions, final List<String> errors) {
        final Set<String> seen = new HashSet<>();
        for (int i = 0; i < questions.size(); i++) {
            final Question question = questions.get(i);
            final String fallback = "questions[" + i + "]";
            if (question == null) {
                errors.add(fallback + ": question entry is required");
                continue;
            }
            final String label = isBlank(question.questionId()) ? fallback : question.questionId();
            if (isBlank(question.questionId())) {
                errors.add(label + ": questionId is required");
            } else if (!seen.add(question.questionId())) {
                errors.add(label + ": duplicate questionId");
            }
            validateQuestion(question, label, errors);
        }
    }

    private static void validateQuestion(final Question question, final String label, final List<String> errors) {
        final String p = prefix(label);
        if (isBlank(question.question())) {
            errors.add(p + "question is required");
        }
        if (question.options() != null) {
            for (int i = 0; i < question.options().size(); i++) {
                if (question.options().get(i) == null) {
                    errors.add(p + "options[" + i + "] must be a string");
                }
            }
        }
        if (isBlank(question.methodType())) {
            errors.add(p + "methodType is required");
            return;
        }

        switch (question.methodKind()) {
            case SINGLE_CHOICE -> validateSingleChoice(question, p, errors);
            case MULTI_SELECT -> validateMultiSelect(question, p, errors);
            case NUMERIC_RANGE -> validateNumericRange(question, p, errors);
            case CUSTOM -> validateCustom(question, p, errors);
        }
    }

    private static void validateSingleChoice(final Question question, final String p, final List<String> errors) {
        if (countOptions(question.options()) < 2) {
            errors.add(p + "single-choice requires options with at least 2 non-blank values");
        }
        if (question.maxSelections() != null && question.maxSelections() != 1) {
            errors.add(p + "single-choice: maxSelections must be absent or 1");
        }
        if (question.numericConstraints() != null) {
            errors.add(p + "single-choice: numericConstraints must be absent");
        }
    }

    private static void validateMultiSelect(final Question question, final String p, final List<String> errors) {
        if (countOptions(question.options()) < 2) {
            errors.add(p + "multi-select requires options with at least 2 non-blank values");
        }
        final Integer max = question.maxSelections();
        if (max == null || max < 1) {
            errors.add(p + "multi-select: maxSelections is required and must be >= 1");
        } else if (question.options() != null && max > question.options().size()) {
            errors.add(p + "multi-select: maxSelections must be <= number of options");
        }
        if (question.numericConstraints() != null) {
            errors.add(p + "multi-select: numericConstraints must be absent");
        }
    }

    private static void validateNumericRange(final Question question, final String p, final List<String> errors) {
        final NumericConstraints constraints = question.numericConstraints();
        if (constraints == null) {
            errors.add(p + "numeric-range requires numericConstraints");
        } else {
            if (constraints.minValue() == null) {
                errors.add(p + "numericConstraints.minValue is required");
            }
            if (constraints.maxValue() == null) {
                errors.add(p + "numericConstraints.maxValue is required");
            }
            if (constraints.minValue() != null && constraints.maxValue() != null
                    && constraints.minValue() > constraints.maxValue()) {
                errors.add(p + "numericConstraints: minValue must be <= maxValue");
            }
            if (constraints.step() != null && constraints.step() < 1) {
                errors.add(p + "numericConstraints.step must be a positive integer");
            }
        }
        if (question.options() != null) {
            errors.add(p + "numeric-range: options must be absent");
        }
        if (question.maxSelections() != null) {
            errors.add(p + "numeric-range: maxSelections must be absent");
        }
    }

    private static void validateCustom(final Question question, final String p, final List<String> errors) {
        if (isBlank(question.methodSchemaUri())) {
            errors.add(p + "Custom methods require methodSchemaUri");
        }
        if (!SurveyProtocol.HASH_ALGORITHM.equals(question.hashAlgorithm())) {
            errors.add(p + "Custom methods require hashAlgorithm set to \"" + SurveyProtocol.HASH_ALGORITHM + "\"");
        }
        if (isBlank(question.methodSchemaHash())) {
            errors.add(p + "Custom methods require methodSchemaHash");
        }
    }

    private static void validateEligibility(final List<String> eligibility, final List<String> errors) {
        if (eligibility == null) {
            return;
        }
        for (final String role : eligibility) {
            if (EligibilityRole.fromWireName(role).isEmpty()) {
                errors.add("Invalid eligibility role: " + role);
            }
        }
    }

    private static void validateReferenceAction(final ReferenceAction action, final List<String> errors) {
        if (!Hex.isHex(action.transactionId(), SurveyProtocol.TX_ID_LENGTH_HEX)) {
            errors.add("referenceAction.transactionId must be a 64-char hex string");
        }
        if (action.actionIndex() == null || action.actionIndex() < 0) {
            errors.add("referenceAction.actionIndex must be a non-negative integer");
        }
    }

    private static void validateLifecycle(final Lifecycle lifecycle, final List<String> errors) {
        for (final Map.Entry<String, Object> entry : lifecycle.entries().entrySet()) {
            final Object value = entry.getValue();
            if (Lifecycle.END_EPOCH.equals(entry.getKey())) {
                if (!(value instanceof Long epoch) || epoch < 0) {
                    errors.add("lifecycle: endEpoch must be a non-negative integer");
                }
            } else if (!(value instanceof Long) && !(value instanceof String)) {
                errors.add("lifecycle." + entry.getKey() + " must be an integer or string");
            }
        }
    }

    private static int countOptions(final List<String> options) {
        if (options == null) {
            return 0;
        }
        int count = 0;
        for (final String option : options) {
            if (!isBlank(option)) {
                count++;
            }
        }
        return count;
    }
}
