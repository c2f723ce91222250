package com.github.tarcv.u4jgrep;

public enum RegexErrorCode {
    INTERNAL_ERROR,             /**< An internal error (bug) was detected.              */
    BAD_ESCAPE_SEQUENCE,        /**< Backslash at the end of the pattern                */
    MISMATCHED_PAREN,           /**< Incorrectly nested parentheses in regexp pattern.  */
    NOTHING_TO_REPEAT,          /**< Quantifier with no preceding atom to apply to.     */
    NUMBER_TOO_BIG,             /**< Decimal number is too large.                       */
    MAX_LT_MIN,                 /**< In {min,max}, max is less than min.                */
    INVALID_BACK_REF,           /**< Back-reference to a non-existent capture group.    */
    MISSING_CLOSE_BRACKET,      /**< Missing closing bracket on a bracket expression.   */
    INVALID_RANGE,              /**< In a character range [x-y], x is greater than y.   */
    PATTERN_TOO_BIG,            /**< Pattern exceeds limits on size or nesting depth.   */
    STACK_OVERFLOW,             /**< Regular expression backtrack stack overflow.       */
    TIME_OUT,                   /**< Maximum allowed match steps exceeded               */
}
