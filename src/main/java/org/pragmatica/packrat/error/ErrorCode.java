package org.pragmatica.packrat.error;

/**
 * Numeric codes of all diagnostics the engine emits.
 *
 * <p>The severity follows from the number: codes below 100 are notices, codes below
 * 1000 are warnings and everything from 1000 upward is an error.
 */
public enum ErrorCode {
    RESUME_NOTICE(50),

    OPTIONAL_REDUNDANTLY_NESTED_WARNING(310),
    CAPTURE_STACK_NOT_EMPTY_WARNING(330),
    ZERO_LENGTH_CAPTURE_POSSIBLE_WARNING(340),
    CAPTURE_DROPPED_CONTENT_WARNING(350),

    MANDATORY_CONTINUATION(1010),
    MANDATORY_CONTINUATION_AT_EOF(1015),
    MANDATORY_CONTINUATION_AT_EOF_NON_ROOT(1017),
    PARSER_NEVER_TOUCHES_DOCUMENT(1020),
    PARSER_LOOKAHEAD_FAILURE_ONLY(1030),
    PARSER_STOPPED_BEFORE_END(1040),
    PARSER_LOOKAHEAD_MATCH_ONLY(1045),
    PARSER_STOPPED_ON_RETRY(1046),
    CAPTURE_STACK_NOT_EMPTY(1050),
    CAPTURE_STACK_NOT_EMPTY_NON_ROOT_ONLY(1051),
    AUTOCAPTURED_SYMBOL_NOT_CLEARED(1055),
    AUTOCAPTURED_SYMBOL_NOT_CLEARED_NON_ROOT(1056),
    MALFORMED_ERROR_STRING(1060),
    UNDEFINED_RETRIEVE(1090),
    CAPTURE_WITHOUT_PARSERNAME(1120),
    LOOKAHEAD_WITH_OPTIONAL_PARSER(1130),
    BADLY_NESTED_OPTIONAL_PARSER(1140),
    BAD_MANDATORY_SETUP(1150),
    DUPLICATE_PARSERS_IN_ALTERNATIVE(1160),
    BAD_ORDER_OF_ALTERNATIVES(1170),
    BAD_REPETITION_COUNT(1180),
    ERROR_WHILE_RECOVERING_FROM_ERROR(1190),
    RECURSION_DEPTH_LIMIT_HIT(1200);

    private static final int WARNING_LEVEL = 100;
    private static final int ERROR_LEVEL = 1000;

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public Diagnostic.Severity severity() {
        if (code >= ERROR_LEVEL) {
            return Diagnostic.Severity.ERROR;
        }
        return code >= WARNING_LEVEL ? Diagnostic.Severity.WARNING : Diagnostic.Severity.INFO;
    }

    public boolean isError() {
        return code >= ERROR_LEVEL;
    }

    @Override
    public String toString() {
        return name() + "(" + code + ")";
    }
}
