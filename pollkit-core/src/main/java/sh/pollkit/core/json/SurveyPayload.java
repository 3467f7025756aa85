// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.json;

import java.util.List;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Response;

/**
 * Content of a label 17 metadata document: optional message lines plus either a
 * survey definition or a response.
 *
 * @param msg            human-readable lines; a single string (as restored from
 *                       chain metadata) binds as one line
 * @param surveyDetails  the survey, when the document publishes one
 * @param surveyResponse the response, when the document answers one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SurveyPayload(
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) @Nullable List<String> msg,
        @Nullable PollDefinition surveyDetails,
        @Nullable Response surveyResponse) {

    @JsonIgnore
    public boolean isDefinition() {
        return surveyDetails != null;
    }

    @JsonIgnore
    public boolean isResponse() {
        return surveyResponse != null;
    }
}
