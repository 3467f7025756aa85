// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import sh.pollkit.core.SurveyProtocol;

/**
 * A survey definition as published under metadata label 17 ({@code surveyDetails}).
 *
 * <p>Two payload shapes exist:
 * <ul>
 * <li><b>Multi-question</b>: an ordered {@link #questions()} list.</li>
 * <li><b>Legacy</b>: a single question written directly on the definition through
 * {@code question}, {@code methodType} and the method-specific fields.</li>
 * </ul>
 * A non-empty {@code questions} list is authoritative; the legacy fields are then
 * ignored by the normalizer (and reported by the validator). Use
 * {@link #effectiveQuestions()} to see the survey as a list either way.
 *
 * <p>{@code eligibility} and {@code voteWeighting} hold the metadata spellings so
 * that unknown values survive binding and can be reported; see
 * {@link EligibilityRole} and {@link VoteWeighting} for the fixed sets.
 *
 * <p>Example:
 * <pre>{@code
 * PollDefinition poll = PollDefinition.builder()
 *     .title("Treasury priorities")
 *     .description("Which areas should the next treasury cycle fund?")
 *     .question(Question.multiSelect("q1", "Pick up to two", List.of("Tooling", "Education", "Research"), 2))
 *     .eligibility(EligibilityRole.DREP, EligibilityRole.STAKEHOLDER)
 *     .voteWeighting(VoteWeighting.STAKE_BASED)
 *     .lifecycle(Lifecycle.endingAt(560))
 *     .build();
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PollDefinition(
        @Nullable String specVersion,
        @Nullable String title,
        @Nullable String description,
        @Nullable List<Question> questions,
        @Nullable String question,
        @Nullable String methodType,
        @Nullable List<String> options,
        @Nullable Integer maxSelections,
        @Nullable NumericConstraints numericConstraints,
        @Nullable String methodSchemaUri,
        @Nullable String hashAlgorithm,
        @Nullable String methodSchemaHash,
        @Nullable List<String> eligibility,
        @Nullable String voteWeighting,
        @Nullable ReferenceAction referenceAction,
        @Nullable Lifecycle lifecycle) {

    public PollDefinition {
        questions = ModelCopies.list(questions);
        options = ModelCopies.list(options);
        eligibility = ModelCopies.list(eligibility);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether the {@code questions} list is present and non-empty.
     */
    @JsonIgnore
    public boolean hasQuestionList() {
        return questions != null && !questions.isEmpty();
    }

    /**
     * Whether any legacy single-question field is set.
     */
    @JsonIgnore
    public boolean hasLegacyFields() {
        return question != null
                || methodType != null
                || options != null
                || maxSelections != null
                || numericConstraints != null
                || methodSchemaUri != null
                || hashAlgorithm != null
                || methodSchemaHash != null;
    }

    /**
     * Whether this definition is written in the legacy single-question shape.
     */
    @JsonIgnore
    public boolean isLegacyShape() {
        return !hasQuestionList() && hasLegacyFields();
    }

    /**
     * Returns the legacy single question lifted into a {@link Question} with id
     * {@value SurveyProtocol#LEGACY_QUESTION_ID}.
     */
    @JsonIgnore
    public Question legacyQuestion() {
        return new Question(SurveyProtocol.LEGACY_QUESTION_ID, question, methodType, options,
                maxSelections, numericConstraints, methodSchemaUri, hashAlgorithm, methodSchemaHash);
    }

    /**
     * Resolves the two payload shapes into one list of questions.
     *
     * @return the {@code questions} list when non-empty; otherwise the lifted legacy
     *         question when any legacy field is set; otherwise an empty list
     */
    @JsonIgnore
    public List<Question> effectiveQuestions() {
        if (hasQuestionList()) {
            return questions;
        }
        if (hasLegacyFields()) {
            return List.of(legacyQuestion());
        }
        return List.of();
    }

    /**
     * Finds a question by id among the effective questions.
     *
     * @param questionId the id to look for
     * @return the question, or {@code null}
     * @throws NullPointerException if {@code questionId} is null
     */
    public @Nullable Question findQuestion(final String questionId) {
        Objects.requireNonNull(questionId, "questionId");
        for (final Question q : effectiveQuestions()) {
            if (q != null && questionId.equals(q.questionId())) {
                return q;
            }
        }
        return null;
    }

    /**
     * Builder for {@link PollDefinition}. Adding questions selects the
     * multi-question shape; the {@code legacy*} setters write the legacy shape.
     */
    public static final class Builder {
        private String specVersion = SurveyProtocol.SPEC_VERSION;
        private String title;
        private String description;
        private List<Question> questions;
        private Question legacy;
        private List<String> eligibility;
        private String voteWeighting;
        private ReferenceAction referenceAction;
        private Lifecycle lifecycle;

        private Builder() {
        }

        public Builder specVersion(final String specVersion) {
            this.specVersion = specVersion;
            return this;
        }

        public Builder title(final String title) {
            this.title = title;
            return this;
        }

        public Builder description(final String description) {
            this.description = description;
            return this;
        }

        public Builder question(final Question question) {
            if (questions == null) {
                questions = new ArrayList<>();
            }
            questions.add(question);
            return this;
        }

        public Builder questions(final List<Question> questions) {
            this.questions = questions == null ? null : new ArrayList<>(questions);
            return this;
        }

        /**
         * Writes {@code question} in the legacy single-question shape. Its
         * {@code questionId} is not part of that shape and is dropped.
         */
        public Builder legacyQuestion(final Question question) {
            this.legacy = question;
            return this;
        }

        public Builder eligibility(final EligibilityRole... roles) {
            final List<String> names = new ArrayList<>(roles.length);
            for (final EligibilityRole role : roles) {
                names.add(role.wireName());
            }
            this.eligibility = names;
            return this;
        }

        public Builder eligibility(final List<String> eligibility) {
            this.eligibility = eligibility;
            return this;
        }

        public Builder voteWeighting(final VoteWeighting voteWeighting) {
            this.voteWeighting = voteWeighting == null ? null : voteWeighting.wireName();
            return this;
        }

        public Builder voteWeighting(final String voteWeighting) {
            this.voteWeighting = voteWeighting;
            return this;
        }

        public Builder referenceAction(final ReferenceAction referenceAction) {
            this.referenceAction = referenceAction;
            return this;
        }

        public Builder lifecycle(final Lifecycle lifecycle) {
            this.lifecycle = lifecycle;
            return this;
        }

        public PollDefinition build() {
            final Question l = legacy;
            return new PollDefinition(
                    specVersion,
                    title,
                    description,
                    questions,
                    l == null ? null : l.question(),
                    l == null ? null : l.methodType(),
                    l == null ? null : l.options(),
                    l == null ? null : l.maxSelections(),
                    l == null ? null : l.numericConstraints(),
                    l == null ? null : l.methodSchemaUri(),
                    l == null ? null : l.hashAlgorithm(),
                    l == null ? null : l.methodSchemaHash(),
                    eligibility,
                    voteWeighting,
                    referenceAction,
                    lifecycle);
        }
    }
}
