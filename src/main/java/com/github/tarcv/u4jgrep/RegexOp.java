package com.github.tarcv.u4jgrep;

/**
 * Operations of the compiled pattern. Each program word holds the operation in its high
 * byte and a 24 bit operand in the rest; a few operations are followed by raw operand words.
 */
enum RegexOp {
    END,            // Successful end of pattern.
    ONECHAR,        // Literal code point, operand is the code point.
    DOTANY,         // Any code point.
    SETREF,         // Operand is an index into the pattern's sets.
    STATE_SAVE,     // Push a choice point resuming at the operand address.
    JMP,            // Jump to the operand address.
    START_CAPTURE,  // Operand is the frame offset of the group's variables.
    END_CAPTURE,    // Operand is the frame offset of the group's variables.
    BACKREF,        // Operand is the frame offset of the referenced group's variables.
    CARET,          // ^
    DOLLAR,         // $
    CTR_INIT,       // Loop start. Operand is the frame offset of the loop's counter.
                    //   Followed by three raw words: min, max (-1 for no limit), exit address.
    CTR_LOOP;       // Loop end. Operand is the frame offset of the loop's counter.
                    //   Followed by one raw word, the address of the loop body.

    static final int MAX_OPERAND = 0x00ffffff;

    private static final RegexOp[] VALUES = values();

    static int buildOp(final RegexOp type, final int operand) {
        if (operand < 0 || operand > MAX_OPERAND) {
            throw new RegexException(RegexErrorCode.PATTERN_TOO_BIG, "Operand out of range: " + operand);
        }
        return (type.ordinal() << 24) | operand;
    }

    static RegexOp typeOf(final int op) {
        return VALUES[op >>> 24];
    }

    static int operandOf(final int op) {
        return op & MAX_OPERAND;
    }
}
