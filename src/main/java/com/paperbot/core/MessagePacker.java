package com.paperbot.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs ordered text blocks into units no longer than a transport limit.
 * Blocks are joined greedily with a blank line; a block that cannot fit is split by line,
 * then at word boundaries, and only as a last resort at the raw character limit.
 */
public final class MessagePacker {
    static final String SEPARATOR = "\n\n";

    public List<String> pack(List<String> blocks, int maxLen) {
        if (maxLen < 1) {
            throw new IllegalArgumentException("maxLen must be >= 1, got " + maxLen);
        }
        List<String> units = new ArrayList<>();
        if (blocks == null) {
            return units;
        }
        StringBuilder current = new StringBuilder();
        for (String block : blocks) {
            String clean = block == null ? "" : block.strip();
            if (clean.isEmpty()) {
                continue;
            }
            for (String piece : piecesOf(clean, maxLen)) {
                if (piece.length() == maxLen) {
                    flush(current, units);
                    units.add(piece);
                    continue;
                }
                if (current.length() == 0) {
                    current.append(piece);
                } else if (current.length() + SEPARATOR.length() + piece.length() <= maxLen) {
                    current.append(SEPARATOR).append(piece);
                } else {
                    flush(current, units);
                    current.append(piece);
                }
            }
        }
        flush(current, units);
        return units;
    }

    private static List<String> piecesOf(String block, int maxLen) {
        if (block.length() <= maxLen) {
            return List.of(block);
        }
        List<String> pieces = new ArrayList<>();
        for (String line : block.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            pieces.addAll(splitLongLine(line, maxLen));
        }
        return pieces;
    }

    static List<String> splitLongLine(String line, int maxLen) {
        List<String> chunks = new ArrayList<>();
        String remaining = line;
        while (remaining.length() > maxLen) {
            int splitAt = lastWhitespaceAtOrBefore(remaining, maxLen);
            String chunk = splitAt <= 0 ? "" : remaining.substring(0, splitAt).stripTrailing();
            if (chunk.isEmpty()) {
                splitAt = maxLen;
                // keep surrogate pairs whole
                if (maxLen > 1 && Character.isHighSurrogate(remaining.charAt(maxLen - 1))) {
                    splitAt--;
                }
                chunk = remaining.substring(0, splitAt);
            }
            chunks.add(chunk);
            remaining = remaining.substring(splitAt).stripLeading();
        }
        if (!remaining.isEmpty()) {
            chunks.add(remaining);
        }
        return chunks;
    }

    private static int lastWhitespaceAtOrBefore(String text, int index) {
        for (int i = Math.min(index, text.length() - 1); i > 0; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static void flush(StringBuilder current, List<String> units) {
        if (current.length() > 0) {
            units.add(current.toString());
            current.setLength(0);
        }
    }
}
