// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core;

/**
 * Fixed constants of the label-17 survey protocol.
 *
 * <p>None of these are configurable: two parties can only agree on a survey hash
 * if they agree on every value here.
 */
public final class SurveyProtocol {
    private SurveyProtocol() {}

    /** Transaction metadata label carrying survey definitions and responses. */
    public static final int METADATA_LABEL = 17;

    /** Spec version written by this library into new payloads. */
    public static final String SPEC_VERSION = "1.0.0";

    /** Digest name required on caller-defined methods and used for the survey hash. */
    public static final String HASH_ALGORITHM = "blake2b-256";

    /** Survey hash length in bytes (Blake2b-256). */
    public static final int HASH_LENGTH_BYTES = 32;

    /** Survey hash length as lowercase hex characters. */
    public static final int HASH_LENGTH_HEX = HASH_LENGTH_BYTES * 2;

    /** Transaction id length as hex characters. */
    public static final int TX_ID_LENGTH_HEX = 64;

    /** Cardano limit on a single metadata text string, in UTF-8 bytes. */
    public static final int MAX_METADATA_STRING_BYTES = 64;

    /** Id given to the question lifted out of a legacy single-question definition. */
    public static final String LEGACY_QUESTION_ID = "q1";

    /** Envelope key of a survey definition. */
    public static final String SURVEY_DETAILS_KEY = "surveyDetails";

    /** Envelope key of a survey response. */
    public static final String SURVEY_RESPONSE_KEY = "surveyResponse";

    /** Envelope key of the free-form display message, never hashed. */
    public static final String MESSAGE_KEY = "msg";
}
