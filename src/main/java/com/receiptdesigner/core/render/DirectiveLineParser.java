package com.receiptdesigner.core.render;

import com.receiptdesigner.core.model.Alignment;
import com.receiptdesigner.core.render.LineInstruction.AlignInstruction;
import com.receiptdesigner.core.render.LineInstruction.FeedInstruction;
import com.receiptdesigner.core.render.LineInstruction.TextInstruction;
import com.receiptdesigner.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizes item-template lines. A line may start with one directive:
 * <ul>
 *     <li>{@code {{align:left}}}, {@code {{align:center}}}, {@code {{align:right}}}</li>
 *     <li>{@code {{feedLine:N}}} and {@code {{feedLine}}}</li>
 * </ul>
 * Only the first leading directive is recognised; anything after it is literal text, including a
 * second directive.
 */
public final class DirectiveLineParser {
    private static final Logger LOGGER = AppLogger.get();

    private static final String ALIGN_LEFT = "{{align:left}}";
    private static final String ALIGN_CENTER = "{{align:center}}";
    private static final String ALIGN_RIGHT = "{{align:right}}";
    private static final String FEED_WITH_COUNT = "{{feedLine:";
    private static final String FEED = "{{feedLine}}";
    private static final String CLOSE = "}}";

    private static final Pattern LINE_BREAK = Pattern.compile("\\n|\\\\n");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private DirectiveLineParser() {
    }

    /**
     * Splits a template on real newlines and on the two-character sequence backslash-n.
     */
    public static List<String> splitLines(String template) {
        if (template == null || template.isEmpty()) {
            return List.of();
        }
        return List.of(LINE_BREAK.split(template, -1));
    }

    public static List<LineInstruction> parseLine(String rawLine) {
        if (rawLine == null) {
            return List.of();
        }
        String line = rawLine.trim();
        if (line.isEmpty()) {
            return List.of();
        }

        List<LineInstruction> instructions = new ArrayList<>(2);
        if (line.startsWith(ALIGN_LEFT)) {
            instructions.add(new AlignInstruction(Alignment.LEFT));
            line = line.substring(ALIGN_LEFT.length());
        } else if (line.startsWith(ALIGN_CENTER)) {
            instructions.add(new AlignInstruction(Alignment.CENTER));
            line = line.substring(ALIGN_CENTER.length());
        } else if (line.startsWith(ALIGN_RIGHT)) {
            instructions.add(new AlignInstruction(Alignment.RIGHT));
            line = line.substring(ALIGN_RIGHT.length());
        } else if (line.startsWith(FEED_WITH_COUNT)) {
            int close = line.indexOf(CLOSE, FEED_WITH_COUNT.length());
            if (close >= 0) {
                String argument = line.substring(FEED_WITH_COUNT.length(), close);
                instructions.add(new FeedInstruction(parseFeedCount(argument)));
                line = line.substring(close + CLOSE.length());
            }
        } else if (line.startsWith(FEED)) {
            instructions.add(new FeedInstruction(1));
            line = line.substring(FEED.length());
        }

        if (!line.isEmpty()) {
            instructions.add(new TextInstruction(line));
        }
        return instructions;
    }

    /**
     * Longest digit run in the argument; no digits, overflow or zero all mean one line.
     */
    static int parseFeedCount(String argument) {
        Matcher matcher = DIGITS.matcher(argument);
        String longest = null;
        while (matcher.find()) {
            if (longest == null || matcher.group().length() > longest.length()) {
                longest = matcher.group();
            }
        }
        if (longest == null) {
            LOGGER.fine(() -> "Feed directive without a count ('" + argument + "'), feeding one line");
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(longest));
        } catch (NumberFormatException ex) {
            LOGGER.fine(() -> "Feed count '" + argument + "' out of range, feeding one line");
            return 1;
        }
    }
}
