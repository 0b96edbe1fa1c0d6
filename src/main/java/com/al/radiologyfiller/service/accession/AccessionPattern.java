package com.al.radiologyfiller.service.accession;

import com.al.radiologyfiller.exception.InvalidAccessionPatternException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled accession number template.
 * <p>
 * Recognized placeholders: {@code {facility_code}}, {@code {YYYY}}, {@code {YY}}, {@code {MM}},
 * {@code {DD}}, {@code {YYYYMMDD}} and exactly one {@code {seq:0Nd}} (sequence zero-padded to N
 * digits). Everything outside braces is literal.
 * <p>
 * The date key is made of the date parts the template prints, so a sequence restarts exactly when
 * the printed date changes. A template without any date part uses the constant key
 * {@value #UNDATED_KEY}, and its sequence never restarts.
 */
public final class AccessionPattern {

    public static final String UNDATED_KEY = "UNDATED";

    private static final Pattern SEQUENCE = Pattern.compile("seq:0?([1-9][0-9]?)d");
    private static final int MAX_SEQUENCE_WIDTH = 18;

    enum DateGranularity {
        NONE, YEAR, MONTH, DAY
    }

    private final String source;
    private final List<Token> tokens;
    private final int sequenceWidth;
    private final DateGranularity granularity;

    private AccessionPattern(String source, List<Token> tokens, int sequenceWidth, DateGranularity granularity) {
        this.source = source;
        this.tokens = Collections.unmodifiableList(tokens);
        this.sequenceWidth = sequenceWidth;
        this.granularity = granularity;
    }

    public static AccessionPattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new InvalidAccessionPatternException(String.valueOf(pattern), "pattern is empty");
        }

        List<Token> tokens = new ArrayList<>();
        int sequenceWidth = -1;
        boolean year = false;
        boolean month = false;
        boolean day = false;

        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '}') {
                throw new InvalidAccessionPatternException(pattern, "unbalanced '}' at position " + i);
            }
            if (c != '{') {
                literal.append(c);
                i++;
                continue;
            }
            int close = pattern.indexOf('}', i);
            int nextOpen = pattern.indexOf('{', i + 1);
            if (close < 0 || (nextOpen >= 0 && nextOpen < close)) {
                throw new InvalidAccessionPatternException(pattern, "unbalanced '{' at position " + i);
            }
            if (literal.length() > 0) {
                tokens.add(new Token(Kind.LITERAL, literal.toString(), 0));
                literal.setLength(0);
            }

            String name = pattern.substring(i + 1, close);
            switch (name) {
                case "facility_code":
                    tokens.add(new Token(Kind.FACILITY, name, 0));
                    break;
                case "YYYY":
                    tokens.add(new Token(Kind.YEAR4, name, 0));
                    year = true;
                    break;
                case "YY":
                    tokens.add(new Token(Kind.YEAR2, name, 0));
                    year = true;
                    break;
                case "MM":
                    tokens.add(new Token(Kind.MONTH, name, 0));
                    month = true;
                    break;
                case "DD":
                    tokens.add(new Token(Kind.DAY, name, 0));
                    day = true;
                    break;
                case "YYYYMMDD":
                    tokens.add(new Token(Kind.FULL_DATE, name, 0));
                    day = true;
                    break;
                default:
                    Matcher matcher = SEQUENCE.matcher(name);
                    if (!matcher.matches()) {
                        throw new InvalidAccessionPatternException(pattern, "unknown placeholder {" + name + "}");
                    }
                    if (sequenceWidth > 0) {
                        throw new InvalidAccessionPatternException(pattern, "more than one sequence placeholder");
                    }
                    sequenceWidth = Integer.parseInt(matcher.group(1));
                    if (sequenceWidth > MAX_SEQUENCE_WIDTH) {
                        throw new InvalidAccessionPatternException(pattern,
                                "sequence width " + sequenceWidth + " exceeds " + MAX_SEQUENCE_WIDTH);
                    }
                    tokens.add(new Token(Kind.SEQUENCE, name, sequenceWidth));
            }
            i = close + 1;
        }
        if (literal.length() > 0) {
            tokens.add(new Token(Kind.LITERAL, literal.toString(), 0));
        }
        if (sequenceWidth < 0) {
            throw new InvalidAccessionPatternException(pattern, "missing {seq:0Nd} placeholder");
        }

        DateGranularity granularity;
        if (day) {
            granularity = DateGranularity.DAY;
        } else if (month) {
            granularity = DateGranularity.MONTH;
        } else if (year) {
            granularity = DateGranularity.YEAR;
        } else {
            granularity = DateGranularity.NONE;
        }
        return new AccessionPattern(pattern, tokens, sequenceWidth, granularity);
    }

    /**
     * Key of the sequence counter used on the given day.
     */
    public String dateKey(LocalDate date) {
        switch (granularity) {
            case DAY:
                return String.format("%04d%02d%02d", date.getYear(), date.getMonthValue(), date.getDayOfMonth());
            case MONTH:
                return String.format("%04d%02d", date.getYear(), date.getMonthValue());
            case YEAR:
                return String.format("%04d", date.getYear());
            default:
                return UNDATED_KEY;
        }
    }

    /**
     * Substitutes every placeholder. A sequence longer than its padding is printed in full.
     */
    public String format(String facilityCode, LocalDate date, long sequence) {
        StringBuilder out = new StringBuilder(source.length() + 8);
        for (Token token : tokens) {
            switch (token.kind) {
                case LITERAL:
                    out.append(token.text);
                    break;
                case FACILITY:
                    out.append(facilityCode == null ? "" : facilityCode);
                    break;
                case YEAR4:
                    out.append(String.format("%04d", date.getYear()));
                    break;
                case YEAR2:
                    out.append(String.format("%02d", date.getYear() % 100));
                    break;
                case MONTH:
                    out.append(String.format("%02d", date.getMonthValue()));
                    break;
                case DAY:
                    out.append(String.format("%02d", date.getDayOfMonth()));
                    break;
                case FULL_DATE:
                    out.append(String.format("%04d%02d%02d", date.getYear(), date.getMonthValue(),
                            date.getDayOfMonth()));
                    break;
                case SEQUENCE:
                    out.append(String.format("%0" + token.width + "d", sequence));
                    break;
                default:
                    throw new IllegalStateException("Unhandled token " + token.kind);
            }
        }
        return out.toString();
    }

    public String getSource() {
        return source;
    }

    public int getSequenceWidth() {
        return sequenceWidth;
    }

    DateGranularity getGranularity() {
        return granularity;
    }

    private enum Kind {
        LITERAL, FACILITY, YEAR4, YEAR2, MONTH, DAY, FULL_DATE, SEQUENCE
    }

    private static final class Token {
        private final Kind kind;
        private final String text;
        private final int width;

        private Token(Kind kind, String text, int width) {
            this.kind = kind;
            this.text = text;
            this.width = width;
        }
    }
}
