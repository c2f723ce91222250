package com.github.tarcv.u4jgrep;

enum StartOfMatch {
    START_NO_INFO,             // No hint available.
    START_CHAR,                // Match starts with a literal code point.
    START_START                // Match starts at start of input only (^)
}
