// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.validation;

import static sh.pollkit.core.validation.Rules.isBlank;
import static sh.pollkit.core.validation.Rules.prefix;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pollkit.core.DebugLogger;
import sh.pollkit.core.SurveyProtocol;
import sh.pollkit.core.model.Answer;
import sh.pollkit.core.model.AnswerValues;
import sh.pollkit.core.model.NumericConstraints;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Question;
import sh.pollkit.core.model.Response;
import sh.pollkit.primitives.Hex;

/**
 * Checks a response against the survey it answers.
 *
 * <p>A response either carries one value at the top level, answering a
 * single-question survey, or an {@code answers} list naming each question it
 * answers. Values are then checked against the method of the matched question:
 * <ul>
 * <li>single-choice: {@code selection} holding exactly one index within the options</li>
 * <li>multi-select: {@code selection} holding 1 to {@code maxSelections} distinct indices within the options</li>
 * <li>numeric-range: {@code numericValue} within the bounds and on the step grid anchored at {@code minValue}</li>
 * <li>anything else: any one value</li>
 * </ul>
 *
 * <p>The response's {@code surveyHash} is only checked for shape here; use
 * {@code SurveyHasher.verify} to bind it to the definition.
 */
public final class ResponseValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseValidator.class);

    private ResponseValidator() {
    }

    /**
     * Validates a response.
     *
     * @param response   the response
     * @param definition the survey it answers
     * @return the verdict
     */
    public static ValidationResult validate(final Response response, final PollDefinition definition) {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(definition, "definition");
        final List<String> errors = new ArrayList<>();

        if (isBlank(response.specVersion())) {
            errors.add("specVersion is required");
        }
        if (!Hex.isHex(response.surveyTxId(), SurveyProtocol.TX_ID_LENGTH_HEX)) {
            errors.add("surveyTxId must be a 64-char hex string");
        }
        if (!Hex.isHex(response.surveyHash(), SurveyProtocol.HASH_LENGTH_HEX)) {
            errors.add("surveyHash must be a 64-char hex string");
        }

        if (response.hasAnswers()) {
            if (response.valueCount() > 0) {
                errors.add("selection, numericValue and customValue must be absent when answers is present");
            }
            validateAnswers(response.answers(), definition, errors);
        } else {
            final List<Question> questions = definition.effectiveQuestions();
            if (questions.size() > 1) {
                errors.add("answers is required for a survey with " + questions.size() + " questions");
            } else if (questions.isEmpty() || questions.get(0) == null) {
                errors.add("survey has no question to answer");
            } else {
                validateValue(response, questions.get(0), "", errors);
            }
        }

        final ValidationResult result = ValidationResult.of(errors);
        LOG.debug("Response to survey {} validated: {} error(s)", response.surveyTxId(), errors.size());
        DebugLogger.logValidation("[VALIDATE] response surveyTxId=%s valid=%s errors=%s",
                response.surveyTxId(), result.valid(), errors);
        return result;
    }

    private static void validateAnswers(
            final List<Answer> answers, final PollDefinition definition, final List<String> errors) {
        final Set<String> answered = new HashSet<>();
        for (int i = 0; i < answers.size(); i++) {
            final Answer answer = answers.get(i);
            final String label = "answers[" + i + "]";
            if (answer == null) {
                errors.add(label + ": answer entry is required");
                continue;
            }
            if (isBlank(answer.questionId())) {
                errors.add(label + ": questionId is required");
                continue;
            }
            final Question question = definition.findQuestion(answer.questionId());
            if (question == null) {
                errors.add(label + ": unknown questionId '" + answer.questionId() + "'");
                continue;
            }
            if (!answered.add(answer.questionId())) {
                errors.add(label + ": question '" + answer.questionId() + "' is already answered");
                continue;
            }
            validateValue(answer, question, answer.questionId(), errors);
        }
    }

    private static void validateValue(
            final AnswerValues value, final Question question, final String label, final List<String> errors) {
        final String p = prefix(label);
        if (value.valueCount() != 1) {
            errors.add(p + "Exactly one of selection, numericValue, or customValue must be present");
            return;
        }

        switch (question.methodKind()) {
            case SINGLE_CHOICE -> validateSingleChoice(value.selection(), question, p, errors);
            case MULTI_SELECT -> validateMultiSelect(value.selection(), question, p, errors);
            case NUMERIC_RANGE -> validateNumeric(value.numericValue(), question, p, errors);
            case CUSTOM -> {
                // any single value is acceptable
            }
        }
    }

    private static void validateSingleChoice(
            final List<Integer> selection, final Question question, final String p, final List<String> errors) {
        if (selection == null) {
            errors.add(p + "single-choice response must use selection");
        } else if (selection.size() != 1) {
            errors.add(p + "single-choice response must have exactly 1 selection");
        } else {
            checkIndex(selection.get(0), question, p, errors);
        }
    }

    private static void validateMultiSelect(
            final List<Integer> selection, final Question question, final String p, final List<String> errors) {
        if (selection == null) {
            errors.add(p + "multi-select response must use selection");
            return;
        }
        if (selection.isEmpty()) {
            errors.add(p + "multi-select response must have at least 1 selection");
        }
        final Integer max = question.maxSelections();
        if (max != null && selection.size() > max) {
            errors.add(p + "Too many selections: " + selection.size() + " > maxSelections " + max);
        }
        final Set<Integer> seen = new HashSet<>();
        for (final Integer index : selection) {
            checkIndex(index, question, p, errors);
            if (index != null && !seen.add(index)) {
                errors.add(p + "Duplicate selection index " + index);
            }
        }
    }

    private static void validateNumeric(
            final Long value, final Question question, final String p, final List<String> errors) {
        if (value == null) {
            errors.add(p + "numeric-range response must use numericValue");
            return;
        }
        final NumericConstraints constraints = question.numericConstraints();
        if (constraints == null || constraints.minValue() == null || constraints.maxValue() == null) {
            // reported by DefinitionValidator
            return;
        }
        final long min = constraints.minValue();
        final long max = constraints.maxValue();
        if (value < min || value > max) {
            errors.add(p + "numericValue " + value + " is outside range [" + min + ", " + max + "]");
        }
        final Long step = constraints.step();
        if (step != null && step >= 1 && Math.floorMod(value, step) != Math.floorMod(min, step)) {
            errors.add(p + "numericValue " + value + " does not satisfy step constraint (step="
                    + step + ", base=" + min + ")");
        }
    }

    private static void checkIndex(
            final Integer index, final Question question, final String p, final List<String> errors) {
        final int optionCount = question.options() == null ? 0 : question.options().size();
        if (index == null || index < 0 || index >= optionCount) {
            errors.add(p + "Selection index " + index + " is out of range");
        }
    }
}
