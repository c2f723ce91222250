// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
package com.github.tarcv.u4jgrep;

import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayList;

import static com.github.tarcv.u4jgrep.RegexCompile.FRAME_HEADER_SIZE;
import static com.github.tarcv.u4jgrep.RegexOp.operandOf;
import static com.github.tarcv.u4jgrep.RegexOp.typeOf;

/**
 * class RegexMatcher bundles together a regular expression pattern and
 * input text to which the expression can be applied.  It includes methods
 * for testing for matches and for finding successive matches.
 * <p>
 * The engine is a backtracking interpreter of the compiled pattern. All pending
 * alternatives live on an explicit stack of frames, so deeply nested or long running
 * matches never grow the Java call stack. Each frame carries its own copy of the capture
 * group variables; backtracking to a frame therefore restores exactly the captures that were
 * in effect when the alternative was deferred.
 */
public final class RegexMatcher {
    /**
     * Default limit for the size of the back track stack, to avoid system
     * failures caused by heap exhaustion.  Units are stack slots (longs), not bytes.
     */
    private static final int DEFAULT_BACKTRACK_STACK_CAPACITY = 8000000;

    // Frame header slots.
    private static final int INPUT_IDX = 0;
    private static final int PAT_IDX = 1;

    private final RegexPattern fPattern;

    /**
     * The text being matched. Is never null.
     */
    private CharSequence fInputText;
    private int fInputLength;

    /**
     * True if the last attempted match was successful.
     */
    private boolean fMatch;
    /**
     * Position of the start of the most recent match
     */
    private int fMatchStart;
    /**
     * First position after the end of the most recent match
     * Zero if no previous match.
     */
    private int fMatchEnd;

    private final BacktrackStack fStack;
    /**
     * After finding a match, a copy of the last active stack frame,
     * which contains the capture group results.
     */
    private long[] fFrame;

    /**
     * Max number of choice points a single search may push.
     * Zero for unlimited.
     */
    private int fTimeLimit;

    /**
     * Choice points pushed so far by the current search.
     */
    private int fTime;

    RegexMatcher(final RegexPattern fPattern, final CharSequence input) {
        if (fPattern == null) {
            throw new IllegalArgumentException();
        }
        this.fPattern = fPattern;
        fStack = new BacktrackStack();
        fTimeLimit = 0;
        setStackLimit(DEFAULT_BACKTRACK_STACK_CAPACITY);
        reset(input);
    }

    /**
     * Resets this matcher.  The effect is to remove any memory of previous matches,
     * and to cause subsequent find() operations to begin at the beginning of
     * the input string.
     *
     * @return this RegexMatcher.
     */
    public RegexMatcher reset() {
        fMatch = false;
        fMatchStart = 0;
        fMatchEnd = 0;
        fFrame = null;
        return this;
    }

    /**
     * Resets this matcher with a new input string.  This allows instances of RegexMatcher
     * to be reused, which is more efficient than creating a new RegexMatcher for
     * each input string to be processed.
     *
     * @param input The new string on which subsequent pattern matches will operate.
     * @return this RegexMatcher.
     */
    public RegexMatcher reset(final CharSequence input) {
        if (input == null) {
            throw new IllegalArgumentException("input is null");
        }
        fInputText = input;
        fInputLength = input.length();
        return reset();
    }

    /**
     *  Find the next pattern match in the input string.
     *  The find begins searching the input at the location following the end of
     *  the previous match, or at the start of the string if there is no previous match.
     *  If a match is found, {@link #start()}, {@link #end()} and {@link #group()}
     *  will provide more information regarding the match.
     *  @return  true if a match is found.
     *  @throws RegexException if a step or stack limit was exceeded
     */
    public boolean find() {
        int startPos = fMatchEnd;
        if (fMatch && fMatchStart == fMatchEnd) {
            // Previous match had zero length.  Move start position up one position
            //  to avoid sending find() into a loop on zero-length matches.
            if (startPos >= fInputLength) {
                fMatch = false;
                return false;
            }
            startPos += Character.charCount(Character.codePointAt(fInputText, startPos));
        }
        return findFrom(startPos);
    }

    /**
     *   Resets this RegexMatcher and then attempts to find the next substring of the
     *   input string that matches the pattern, starting at the specified index.
     *
     *   @param start     The (native) index in the input string to begin the search.
     *   @return  true if a match is found.
     *   @throws IndexOutOfBoundsException if start is outside the input
     */
    public boolean find(final int start) {
        if (start < 0 || start > fInputLength) {
            throw new IndexOutOfBoundsException("start " + start + " outside input of length " + fInputLength);
        }
        reset();
        return findFrom(start);
    }

    private boolean findFrom(final int startPos) {
        fMatch = false;
        fTime = 0;
        switch (fPattern.fStartType) {
            case START_START:
                // Matches may begin only at the start of input.
                return startPos == 0 && matchAt(0, false);

            case START_CHAR: {
                int pos = startPos;
                while (pos < fInputLength) {
                    int c = Character.codePointAt(fInputText, pos);
                    if (c == fPattern.fInitialChar && matchAt(pos, false)) {
                        return true;
                    }
                    pos += Character.charCount(c);
                }
                return false;
            }

            default: {
                int pos = startPos;
                for (;;) {
                    if (matchAt(pos, false)) {
                        return true;
                    }
                    if (pos >= fInputLength) {
                        return false;
                    }
                    pos += Character.charCount(Character.codePointAt(fInputText, pos));
                }
            }
        }
    }

    /**
     *   Attempts to match the input string, starting from the beginning,
     *   against the pattern.  Like the {@link #matches()} function, but the match
     *   does not need to extend to the end of the input.
     *
     *    @return true if there is a match at the start of the input string.
     */
    public boolean lookingAt() {
        reset();
        fTime = 0;
        return matchAt(0, false);
    }

    /**
     *   Attempts to match the entire input string against the pattern.
     *    @return true if there is a match
     */
    public boolean matches() {
        reset();
        fTime = 0;
        return matchAt(0, true);
    }

    /**
     *    Returns the index in the input string of the start of the text matched
     *    during the previous match operation.
     *    @throws IllegalStateException if no match has been attempted or the last match failed
     */
    public int start() {
        return start(0);
    }

    /**
     *   Returns the index in the input string of the start of the text matched by the
     *    specified capture group during the previous match operation.  Return -1 if
     *    the capture group exists in the pattern, but was not part of the last match.
     *
     *    @param  group       the capture group number
     *    @throws IllegalStateException if no match has been attempted or the last match failed
     *    @throws IndexOutOfBoundsException for a bad capture group number
     */
    public int start(final int group) {
        checkGroup(group);
        if (group == 0) {
            return fMatchStart;
        }
        return (int) fFrame[FRAME_HEADER_SIZE + RegexCompile.groupSlot(group)];
    }

    public int end() {
        return end(0);
    }

    /**
     *    Returns the index in the input string of the character following the
     *    text matched by the specified capture group during the previous match operation.
     *    Return -1 if the capture group exists in the pattern but was not part of the match.
     *
     *    @param group  the capture group number
     *    @throws IllegalStateException if no match has been attempted or the last match failed
     *    @throws IndexOutOfBoundsException for a bad capture group number
     */
    public int end(final int group) {
        checkGroup(group);
        if (group == 0) {
            return fMatchEnd;
        }
        int s = (int) fFrame[FRAME_HEADER_SIZE + RegexCompile.groupSlot(group)];
        return s < 0 ? -1 : (int) fFrame[FRAME_HEADER_SIZE + RegexCompile.groupSlot(group) + 1];
    }

    public String group() {
        return group(0);
    }

    /**
     * Returns the text captured by {@code group} in the previous match, null if the group
     * was not part of the match.
     */
    public String group(final int group) {
        int s = start(group);
        if (s < 0) {
            return null;
        }
        return fInputText.subSequence(s, end(group)).toString();
    }

    public int groupCount() {
        return fPattern.fGroupCount;
    }

    /**
     * An immutable copy of the state of the previous successful match.
     *
     * @throws IllegalStateException if no match has been attempted or the last match failed
     */
    public MatchResult toMatchResult() {
        int[] spans = new int[2 * (groupCount() + 1)];
        for (int g = 0; g <= groupCount(); g++) {
            spans[2 * g] = start(g);
            spans[2 * g + 1] = end(g);
        }
        return new MatchResult(fInputText, spans);
    }

    public RegexPattern pattern() {
        return fPattern;
    }

    /**
     * Set a processing limit for match operations on this RegexMatcher.
     * <p>
     * The units of the limit are choice points, points where the engine
     * saves its state so that it can come back to try an alternative. A single
     * search (one call of find, matches or lookingAt), across all start positions it
     * tries, may not save more states than this.
     *
     * @param limit The limit value, or 0 for no limit.
     */
    public void setTimeLimit(final int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit is negative");
        }
        fTimeLimit = limit;
    }

    public int getTimeLimit() {
        return fTimeLimit;
    }

    /**
     * Set the amount of heap storage available for use by the match backtracking stack.
     *
     * @param limit  The maximum size, in stack slots, of the matching backtrack stack.
     *               A value of zero means no limit.
     */
    public void setStackLimit(final int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit is negative");
        }
        // Reset the matcher.  This is needed here in case there is a current match
        //    whose final stack frame (containing the match results, pointed to by fFrame)
        //    would be lost by resizing to a smaller stack size.
        reset();
        fStack.setMaxCapacity(limit);
    }

    public int getStackLimit() {
        return fStack.getMaxCapacity();
    }

    private void checkGroup(final int group) {
        if (!fMatch) {
            throw new IllegalStateException("No match available");
        }
        if (group < 0 || group > fPattern.fGroupCount) {
            throw new IndexOutOfBoundsException("No group " + group + ", pattern has " + fPattern.fGroupCount);
        }
    }

    /**
     * Make a new stack frame, initialized as a copy of the current stack frame.
     * Set the pattern index in the original stack frame to {@code savePatIdx}.
     * Execution of the engine continues with the state in the newly created stack frame.
     * If execution ever back-tracks out of the new frame, the original frame is where
     * it continues from, at {@code savePatIdx}.
     *
     * @return The new frame index.
     */
    private int StateSave(final int savePatIdx) {
        int fp = fStack.pushCopy();
        fStack.set(fp - fPattern.fFrameSize + PAT_IDX, savePatIdx);
        fTime++;
        if (fTimeLimit > 0 && fTime > fTimeLimit) {
            throw new RegexException(RegexErrorCode.TIME_OUT,
                    "Match step limit of " + fTimeLimit + " exceeded");
        }
        return fp;
    }

    /**
     * This is the actual matching engine.
     * @param startIdx    begin matching a this index.
     * @param toEnd       if true, match must extend to end of the input
     * @return whether a match was found; sets up the match state either way
     */
    private boolean matchAt(final int startIdx, final boolean toEnd) {
        final int[] pat = fPattern.fCompiledPat;
        final ArrayList<UnicodeSet> sets = fPattern.fSets;
        final CharSequence input = fInputText;
        final int frameSize = fPattern.fFrameSize;

        int fp = fStack.reset(frameSize);
        fStack.set(fp + INPUT_IDX, startIdx);
        fStack.set(fp + PAT_IDX, 0);

        boolean isMatch = false;

        //
        //  Main loop for interpreting the compiled pattern.
        //  One iteration of the loop per pattern operation performed.
        //
        breakFromLoop:
        for (;;) {
            int patIdx = (int) fStack.get(fp + PAT_IDX);
            int inputIdx = (int) fStack.get(fp + INPUT_IDX);
            int op = pat[patIdx];
            int opValue = operandOf(op);
            fStack.set(fp + PAT_IDX, patIdx + 1);

            boolean fail = false;
            switch (typeOf(op)) {
                case END:
                    // The match loop will exit via this path on a successful match,
                    //   when we reach the end of the pattern.
                    if (toEnd && inputIdx != fInputLength) {
                        // The pattern matched, but not to the end of input.  Try some more.
                        fail = true;
                        break;
                    }
                    isMatch = true;
                    break breakFromLoop;

                case ONECHAR:
                    if (inputIdx < fInputLength) {
                        int c = Character.codePointAt(input, inputIdx);
                        if (c == opValue) {
                            fStack.set(fp + INPUT_IDX, inputIdx + Character.charCount(c));
                            break;
                        }
                    }
                    fail = true;
                    break;

                case DOTANY:
                    if (inputIdx < fInputLength) {
                        int c = Character.codePointAt(input, inputIdx);
                        fStack.set(fp + INPUT_IDX, inputIdx + Character.charCount(c));
                        break;
                    }
                    fail = true;
                    break;

                case SETREF:
                    if (inputIdx < fInputLength) {
                        int c = Character.codePointAt(input, inputIdx);
                        if (sets.get(opValue).contains(c)) {
                            fStack.set(fp + INPUT_IDX, inputIdx + Character.charCount(c));
                            break;
                        }
                    }
                    fail = true;
                    break;

                case STATE_SAVE:
                    fp = StateSave(opValue);
                    break;

                case JMP:
                    fStack.set(fp + PAT_IDX, opValue);
                    break;

                // Capture group variables are laid out like this:
                //  opValue     - The start of a completed capture group
                //  opValue+1   - The end   of a completed capture group
                //  opValue+2   - the start of a capture group whose end
                //                has not yet been reached (and might not ever be).
                case START_CAPTURE:
                    fStack.set(fp + FRAME_HEADER_SIZE + opValue + 2, inputIdx);
                    break;

                case END_CAPTURE: {
                    int extra = fp + FRAME_HEADER_SIZE + opValue;
                    assert (fStack.get(extra + 2) >= 0);            // Start pos for this group must be set.
                    fStack.set(extra, fStack.get(extra + 2));         // Tentative start becomes real.
                    fStack.set(extra + 1, inputIdx);                  // End position
                    break;
                }

                case BACKREF: {
                    int extra = fp + FRAME_HEADER_SIZE + opValue;
                    int groupStartIdx = (int) fStack.get(extra);
                    int groupEndIdx = (int) fStack.get(extra + 1);
                    if (groupStartIdx < 0) {
                        // This capture group has not participated in the match thus far,
                        fail = true;   // FAIL, no match.
                        break;
                    }
                    //   Note: if the capture group match was of an empty string the backref
                    //         match succeeds.
                    int len = groupEndIdx - groupStartIdx;
                    if (inputIdx + len > fInputLength) {
                        fail = true;
                        break;
                    }
                    for (int i = 0; i < len; i++) {
                        if (input.charAt(groupStartIdx + i) != input.charAt(inputIdx + i)) {
                            fail = true;
                            break;
                        }
                    }
                    if (!fail) {
                        fStack.set(fp + INPUT_IDX, inputIdx + len);
                    }
                    break;
                }

                case CARET:
                    if (inputIdx != 0) {
                        fail = true;
                    }
                    break;

                case DOLLAR:
                    if (inputIdx != fInputLength) {
                        fail = true;
                    }
                    break;

                // Counted loop variables:
                //  opValue     - Iterations completed so far
                //  opValue+1   - Input position at the start of the current iteration
                case CTR_INIT: {
                    int extra = fp + FRAME_HEADER_SIZE + opValue;
                    int minCount = pat[patIdx + 1];
                    int loopExit = pat[patIdx + 3];
                    fStack.set(extra, 0);
                    fStack.set(extra + 1, inputIdx);
                    fStack.set(fp + PAT_IDX, patIdx + 4);
                    if (minCount == 0) {
                        // Zero iterations is the least preferred alternative.
                        fp = StateSave(loopExit);
                    }
                    break;
                }

                case CTR_LOOP: {
                    int extra = fp + FRAME_HEADER_SIZE + opValue;
                    int loopTop = pat[patIdx + 1];
                    int initOp = loopTop - 4;
                    int minCount = pat[initOp + 1];
                    int maxCount = pat[initOp + 2];
                    long count = fStack.get(extra) + 1;
                    fStack.set(extra, count);
                    fStack.set(fp + PAT_IDX, patIdx + 2);
                    if (count < minCount) {
                        // Not enough iterations yet, go around again unconditionally.
                        fStack.set(extra + 1, inputIdx);
                        fStack.set(fp + PAT_IDX, loopTop);
                        break;
                    }
                    if (maxCount != RegexNode.UNBOUNDED && count >= maxCount) {
                        break;
                    }
                    if (fStack.get(extra + 1) == inputIdx) {
                        // The iteration matched the empty string. Another one would do the same.
                        break;
                    }
                    fStack.set(extra + 1, inputIdx);
                    fp = StateSave(patIdx + 2);
                    fStack.set(fp + PAT_IDX, loopTop);
                    break;
                }

                default:
                    // Trouble.  The compiled pattern contains an entry with an
                    //           unrecognized type tag.
                    throw new RegexException(RegexErrorCode.INTERNAL_ERROR, "Bad op " + Integer.toHexString(op));
            }

            if (fail) {
                fp = fStack.popFrame();
                if (fp < 0) {
                    break;
                }
            }
        }

        fMatch = isMatch;
        if (isMatch) {
            fMatchStart = startIdx;
            fMatchEnd = (int) fStack.get(fp + INPUT_IDX);
            fFrame = fStack.copyFrame(fp);
        } else {
            fFrame = null;
        }
        return isMatch;
    }
}
