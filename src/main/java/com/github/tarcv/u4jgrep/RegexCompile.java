package com.github.tarcv.u4jgrep;

import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import static com.github.tarcv.u4jgrep.RegexOp.*;

/**
 * Lowers a parsed pattern tree into the program run by {@link RegexMatcher}.
 * <p>
 * Backtrack stack frame layout:
 * <pre>
 *   [0]                     input index
 *   [1]                     program index
 *   [2 + 3*(g-1)]           start of the last completed match of capture group g, -1 if none
 *   [2 + 3*(g-1) + 1]       end of that match
 *   [2 + 3*(g-1) + 2]       start of the current, not yet completed, match of group g
 *   [2 + 3*groups + 2*l]    iteration count of counted loop l
 *   [2 + 3*groups + 2*l + 1] input index at the start of the current iteration of loop l
 * </pre>
 * Operands that address frame variables are offsets from index 2.
 */
final class RegexCompile implements RegexNode.Visitor<Void> {
    private static final Logger LOGGER = Logger.getLogger(RegexCompile.class.getName());

    static final int FRAME_HEADER_SIZE = 2;
    static final int SLOTS_PER_GROUP = 3;
    static final int SLOTS_PER_LOOP = 2;

    /**
     * Deepest tree accepted. Quantifiers cannot stack and alternation needs a group,
     * so a pattern within the parser's group nesting limit never reaches it.
     */
    static final int MAX_COMPILE_DEPTH = 3 * RegexParser.MAX_NESTING_DEPTH + 2;

    private final String pattern;
    private final int groupCount;
    private final ArrayList<UnicodeSet> sets = new ArrayList<>();
    private int[] program = new int[32];
    private int programLength;
    private int loopCount;
    private int depth;

    private RegexCompile(final String pattern, final int groupCount) {
        this.pattern = pattern;
        this.groupCount = groupCount;
    }

    /**
     * Parses and compiles {@code regex} into {@code target}.
     */
    static void compile(final RegexPattern target, final String regex) {
        RegexParser parser = new RegexParser(regex);
        RegexNode root = parser.parse();

        RegexCompile compiler = new RegexCompile(regex, parser.groupCount());
        root.accept(compiler);
        compiler.appendOp(END, 0);

        target.fRoot = root;
        target.fGroupCount = parser.groupCount();
        target.fCompiledPat = Arrays.copyOf(compiler.program, compiler.programLength);
        target.fSets = compiler.sets;
        target.fFrameSize = FRAME_HEADER_SIZE
                + SLOTS_PER_GROUP * parser.groupCount()
                + SLOTS_PER_LOOP * compiler.loopCount;
        compiler.computeStartInfo(target, root);

        LOGGER.fine(() -> String.format("Compiled '%s': %d program words, %d sets, frame size %d, start %s",
                regex, target.fCompiledPat.length, target.fSets.size(), target.fFrameSize, target.fStartType));
    }

    static int groupSlot(final int groupIndex) {
        return SLOTS_PER_GROUP * (groupIndex - 1);
    }

    private int loopSlot(final int loopIndex) {
        return SLOTS_PER_GROUP * groupCount + SLOTS_PER_LOOP * loopIndex;
    }

    private int appendOp(final RegexOp type, final int operand) {
        return appendWord(buildOp(type, operand));
    }

    private int appendWord(final int word) {
        if (programLength == program.length) {
            if (program.length > MAX_OPERAND) {
                throw new RegexParseException(RegexErrorCode.PATTERN_TOO_BIG, pattern, 0,
                        "Compiled pattern is too large");
            }
            program = Arrays.copyOf(program, program.length * 2);
        }
        program[programLength] = word;
        return programLength++;
    }

    /**
     * Points the jump or state save at {@code index} to the next instruction to be emitted.
     */
    private void fixupToHere(final int index) {
        program[index] = buildOp(typeOf(program[index]), programLength);
    }

    @Override
    public Void visitLiteral(final RegexNode.Literal node) {
        appendOp(ONECHAR, node.codePoint());
        return null;
    }

    @Override
    public Void visitAnyChar(final RegexNode.AnyChar node) {
        appendOp(DOTANY, 0);
        return null;
    }

    @Override
    public Void visitCharClass(final RegexNode.CharClass node) {
        UnicodeSet set = node.set();
        if (node.isNegated()) {
            set = new UnicodeSet(set).complement().freeze();
        }
        sets.add(set);
        appendOp(SETREF, sets.size() - 1);
        return null;
    }

    @Override
    public Void visitConcat(final RegexNode.Concat node) {
        for (RegexNode item : node.items()) {
            item.accept(this);
        }
        return null;
    }

    //  Alternation a|b|c compiles to
    //      STATE_SAVE L2
    //      a
    //      JMP END
    //  L2: STATE_SAVE L3
    //      b
    //      JMP END
    //  L3: c
    //  END:
    @Override
    public Void visitAlternation(final RegexNode.Alternation node) {
        List<RegexNode> branches = node.branches();
        List<Integer> jumpsToEnd = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            boolean last = i == branches.size() - 1;
            int saveIdx = last ? -1 : appendOp(STATE_SAVE, 0);
            nested(branches.get(i));
            if (!last) {
                jumpsToEnd.add(appendOp(JMP, 0));
                fixupToHere(saveIdx);
            }
        }
        for (int jmp : jumpsToEnd) {
            fixupToHere(jmp);
        }
        return null;
    }

    @Override
    public Void visitGroup(final RegexNode.Group node) {
        if (!node.isCapturing()) {
            nested(node.body());
            return null;
        }
        int slot = groupSlot(node.index());
        appendOp(START_CAPTURE, slot);
        nested(node.body());
        appendOp(END_CAPTURE, slot);
        return null;
    }

    @Override
    public Void visitRepeat(final RegexNode.Repeat node) {
        int min = node.min();
        int max = node.max();
        if (max == 0) {
            // x{0} matches the empty string, nothing to emit.
            return null;
        }
        if (min == 1 && max == 1) {
            nested(node.body());
            return null;
        }
        if (min == 0 && max == 1) {
            //      STATE_SAVE L
            //      body
            //  L:
            int saveIdx = appendOp(STATE_SAVE, 0);
            nested(node.body());
            fixupToHere(saveIdx);
            return null;
        }

        //      CTR_INIT slot, min, max, L
        //  T:  body
        //      CTR_LOOP slot, T
        //  L:
        int slot = loopSlot(loopCount++);
        appendOp(CTR_INIT, slot);
        appendWord(min);
        appendWord(max);
        int exitIdx = appendWord(0);
        int top = programLength;
        nested(node.body());
        appendOp(CTR_LOOP, slot);
        appendWord(top);
        program[exitIdx] = programLength;
        return null;
    }

    @Override
    public Void visitBackreference(final RegexNode.Backreference node) {
        appendOp(BACKREF, groupSlot(node.index()));
        return null;
    }

    @Override
    public Void visitAnchorStart(final RegexNode.AnchorStart node) {
        appendOp(CARET, 0);
        return null;
    }

    @Override
    public Void visitAnchorEnd(final RegexNode.AnchorEnd node) {
        appendOp(DOLLAR, 0);
        return null;
    }

    private void nested(final RegexNode node) {
        // Each group level adds at most three: group body, alternative, repeat body.
        if (++depth > MAX_COMPILE_DEPTH) {
            throw new RegexParseException(RegexErrorCode.PATTERN_TOO_BIG, pattern, 0,
                    "Pattern nested too deeply");
        }
        node.accept(this);
        depth--;
    }

    /**
     * Figures out what the first consumed thing of every match must be, so that
     * the search loop can skip start positions that cannot match.
     */
    private void computeStartInfo(final RegexPattern target, final RegexNode root) {
        target.fStartType = StartOfMatch.START_NO_INFO;
        RegexNode node = root;
        for (;;) {
            if (node instanceof RegexNode.Concat) {
                List<RegexNode> items = ((RegexNode.Concat) node).items();
                if (items.isEmpty()) {
                    return;
                }
                node = items.get(0);
            } else if (node instanceof RegexNode.Group) {
                node = ((RegexNode.Group) node).body();
            } else if (node instanceof RegexNode.Repeat && ((RegexNode.Repeat) node).min() > 0) {
                node = ((RegexNode.Repeat) node).body();
            } else if (node instanceof RegexNode.AnchorStart) {
                target.fStartType = StartOfMatch.START_START;
                return;
            } else if (node instanceof RegexNode.Literal) {
                target.fStartType = StartOfMatch.START_CHAR;
                target.fInitialChar = ((RegexNode.Literal) node).codePoint();
                return;
            } else {
                return;
            }
        }
    }
}
