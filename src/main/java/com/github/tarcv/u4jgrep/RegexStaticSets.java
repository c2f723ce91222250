package com.github.tarcv.u4jgrep;

import com.ibm.icu.text.UnicodeSet;

enum RegexStaticSets { // 'enum' here implements the singleton pattern
    INSTANCE;

    // "Rule Char" Characters are those with special meaning, and therefore
    //    need to be escaped to appear as literals in a regexp.
    final static String gRuleSet_rule_chars = "*?+[(){}^$|\\.";

    //
    //  Unicode Set pattern for Regular Expression  \d
    //
    final static String gIsDigitPattern = "[\\p{Nd}]";

    //
    //  Unicode Set pattern for Regular Expression  \w
    //
    final static String gIsWordPattern = "[\\p{Alphabetic}\\p{Nd}_]";

    //
    //  Unicode Set Definitions for Regular Expression  \s
    //
    final static String gIsSpacePattern = "[\\p{WhiteSpace}]";

    final UnicodeSet fDigitSet;
    final UnicodeSet fWordSet;
    final UnicodeSet fSpaceSet;
    final UnicodeSet fRuleChars;
    final UnicodeSet fAsciiDigits;

    RegexStaticSets() {
        fDigitSet = new UnicodeSet().applyPattern(gIsDigitPattern).freeze();
        fWordSet = new UnicodeSet().applyPattern(gIsWordPattern).freeze();
        fSpaceSet = new UnicodeSet().applyPattern(gIsSpacePattern).freeze();
        fRuleChars = new UnicodeSet().addAll(gRuleSet_rule_chars).freeze();
        fAsciiDigits = new UnicodeSet().add('0', '9').freeze();
    }

    /**
     * The set behind a shorthand class letter ({@code d}, {@code w} or {@code s},
     * either case), or null if the letter is not one.
     */
    UnicodeSet shorthandSet(final int letter) {
        switch (Character.toLowerCase(letter)) {
            case 'd':
                return fDigitSet;
            case 'w':
                return fWordSet;
            case 's':
                return fSpaceSet;
            default:
                return null;
        }
    }

    static boolean isNegatedShorthand(final int letter) {
        return letter == 'D' || letter == 'W' || letter == 'S';
    }
}
