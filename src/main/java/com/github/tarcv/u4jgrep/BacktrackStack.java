// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
package com.github.tarcv.u4jgrep;

import java.util.Arrays;

/**
 * Growable stack of fixed size frames of longs, the backtrack stack of {@link RegexMatcher}.
 * Frames are addressed by the index of their first slot. Every frame above the bottom one
 * is a choice point: a copy of the matcher state taken when an alternative was deferred.
 */
final class BacktrackStack {
    private long[] buffer = new long[64];
    private int length = 0;
    private int frameSize = 1;

    /**
     * Maximum number of slots, zero for unlimited.
     */
    private int maxCapacity = 0;

    /**
     * Drops all frames and pushes a single frame whose slots are all -1.
     *
     * @return the index of that frame
     */
    int reset(final int newFrameSize) {
        if (newFrameSize < 1) {
            throw new IllegalArgumentException();
        }
        frameSize = newFrameSize;
        length = 0;
        ensureCapacity(frameSize);
        Arrays.fill(buffer, 0, frameSize, -1);
        length = frameSize;
        return 0;
    }

    /**
     * Pushes a copy of the top frame.
     *
     * @return the index of the new frame
     * @throws RegexException with {@link RegexErrorCode#STACK_OVERFLOW} if the stack would exceed its limit
     */
    int pushCopy() {
        ensureCapacity(length + frameSize);
        System.arraycopy(buffer, length - frameSize, buffer, length, frameSize);
        length += frameSize;
        return length - frameSize;
    }

    /**
     * Discards the top frame.
     *
     * @return the index of the frame now on top, or -1 if the discarded frame was the last one
     */
    int popFrame() {
        if (length < frameSize) {
            throw new IllegalStateException();
        }
        length -= frameSize;
        return length == 0 ? -1 : length - frameSize;
    }

    int frameCount() {
        return length / frameSize;
    }

    long get(final int index) {
        return buffer[index];
    }

    void set(final int index, final long value) {
        buffer[index] = value;
    }

    /**
     * Copies the frame at {@code frameIndex} out of the stack.
     */
    long[] copyFrame(final int frameIndex) {
        return Arrays.copyOfRange(buffer, frameIndex, frameIndex + frameSize);
    }

    void setMaxCapacity(final int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException();
        }
        maxCapacity = limit;
    }

    int getMaxCapacity() {
        return maxCapacity;
    }

    private void ensureCapacity(final int minimumCapacity) {
        if (maxCapacity > 0 && minimumCapacity > maxCapacity) {
            throw new RegexException(RegexErrorCode.STACK_OVERFLOW,
                    "Backtrack stack limit of " + maxCapacity + " slots exceeded");
        }
        if (buffer.length >= minimumCapacity) {
            return;
        }
        int newCap = buffer.length <= 0xffff ? 4 * buffer.length : 2 * buffer.length;
        if (newCap < minimumCapacity) {
            newCap = minimumCapacity;
        }
        if (maxCapacity > 0 && newCap > maxCapacity) {
            newCap = maxCapacity;
        }
        buffer = Arrays.copyOf(buffer, newCap);
    }
}
