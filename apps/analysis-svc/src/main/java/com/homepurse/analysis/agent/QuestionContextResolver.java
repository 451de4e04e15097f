package com.homepurse.analysis.agent;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns mentions in a question into concrete hints: the expense date range, a resolved relative
 * time window, household members, categories and subcategories matched by fuzzy alias, and a
 * description text filter. Deterministic; it never touches the database or the model.
 */
public class QuestionContextResolver {

    static final double PERSON_MIN_SCORE = 0.58;
    static final double CATEGORY_MIN_SCORE = 0.55;
    private static final double CLOSE_MARGIN = 0.03;
    private static final int MAX_AMBIGUOUS = 3;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<Pattern> PERSON_PATTERNS = List.of(
            Pattern.compile("\\bhow\\s+much\\s+(?:(?:did|does|do|has|have|had)\\s+)?([a-z][a-z\\s.'-]{1,40}?)\\s+(?:spend|spent|pay|paid|pays)\\b", FLAGS),
            Pattern.compile("\\b(?:spent|spend|paid|pay)\\s+by\\s+([a-z][a-z\\s.'-]{1,40})\\b", FLAGS),
            Pattern.compile("\\b([a-z][a-z.-]*)['\u2019]s\\s+(?:spend|spending|expenses?)\\b", FLAGS));
    private static final List<Pattern> CATEGORY_PATTERNS = List.of(
            Pattern.compile("\\b(?:on|for|in|under)\\s+([a-z][a-z0-9\\s&/_-]{1,40})\\s+category\\b", FLAGS),
            Pattern.compile("\\bcategory\\s+(?:is\\s+)?([a-z][a-z0-9\\s&/_-]{1,40})\\b", FLAGS));
    private static final List<Pattern> SUBCATEGORY_PATTERNS = List.of(
            Pattern.compile("\\b(?:on|for|in|under)\\s+([a-z][a-z0-9\\s&/_-]{1,40})\\s+subcategory\\b", FLAGS),
            Pattern.compile("\\bsubcategory\\s+(?:is\\s+)?([a-z][a-z0-9\\s&/_-]{1,40})\\b", FLAGS));
    private static final Pattern QUOTED_PHRASE = Pattern.compile("(?<![a-z0-9])[\"']([^\"']{2,80})[\"'](?![a-z0-9])", FLAGS);
    private static final Pattern DESCRIPTION_PHRASE = Pattern.compile(
            "\\b(?:description|merchant|item|memo|note)\\s+(?:contains|contain|like|with|matching)\\s+([a-z0-9][a-z0-9\\s&/_-]{1,80})",
            FLAGS);

    private static final Pattern ROLLING_WINDOW = Pattern.compile(
            "\\b(?:in\\s+the\\s+)?(?:last|past|previous)\\s+(\\d{1,3})\\s+(day|days|week|weeks|month|months)\\b", FLAGS);
    private static final Pattern TODAY = Pattern.compile("\\btoday\\b", FLAGS);
    private static final Pattern YESTERDAY = Pattern.compile("\\byesterday\\b", FLAGS);
    private static final Pattern THIS_WEEK = Pattern.compile("\\bthis\\s+week\\b", FLAGS);
    private static final Pattern LAST_WEEK = Pattern.compile("\\blast\\s+week\\b", FLAGS);
    private static final Pattern THIS_MONTH = Pattern.compile("\\bthis\\s+month\\b", FLAGS);
    private static final Pattern LAST_MONTH = Pattern.compile("\\blast\\s+month\\b", FLAGS);

    private static final Pattern TRAILING_KEYWORD = Pattern.compile("\\s*\\b(?:category|subcategory|description)$", FLAGS);
    private static final Pattern TRAILING_TIME_CLAUSE = Pattern.compile(
            "\\s+(?:last|past|previous|this|since|from|during|between|before|after|in|over|today|yesterday)\\b.*$", FLAGS);
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");

    public List<String> resolve(String question, SchemaContext context) {
        List<String> hints = new ArrayList<>();
        SchemaContext.HouseholdHints known = context.hints();
        if (known.hasExpenseDates()) {
            hints.add("Expense dates available in `date_incurred` run from '" + known.firstExpenseDate()
                    + "' to '" + known.lastExpenseDate() + "'.");
        }
        timeWindow(question, context.referenceDate()).ifPresent(window -> hints.add(
                "Relative-time request '" + window.phrase() + "' => date_incurred BETWEEN '" + window.start()
                        + "' AND '" + window.end() + "' (inclusive, " + window.interpretation()
                        + "). Use this unless the user gave an explicit date."));

        addAliasHint(hints, "Person", firstFragment(question, PERSON_PATTERNS), known.members(), PERSON_MIN_SCORE,
                "household member ");
        addAliasHint(hints, "Category", firstFragment(question, CATEGORY_PATTERNS), known.categories(),
                CATEGORY_MIN_SCORE, "");
        addAliasHint(hints, "Subcategory", firstFragment(question, SUBCATEGORY_PATTERNS), known.subcategories(),
                CATEGORY_MIN_SCORE, "");

        String phrase = descriptionPhrase(question);
        if (!phrase.isEmpty()) {
            hints.add("Description text filter detected: '" + phrase
                    + "'. Search across description and merchant_or_item.");
        }
        return List.copyOf(hints);
    }

    private static void addAliasHint(List<String> hints, String label, String fragment, List<String> candidates,
                                     double minScore, String targetPrefix) {
        if (fragment.isEmpty()) {
            return;
        }
        AliasMatch match = resolveAlias(fragment, candidates, minScore);
        if (match.resolved() != null) {
            hints.add(label + " mention '" + fragment + "' maps to " + targetPrefix + "'" + match.resolved() + "'.");
        } else if (!match.ambiguous().isEmpty()) {
            hints.add(label + " mention '" + fragment + "' is ambiguous across: "
                    + String.join(", ", match.ambiguous()) + ".");
        }
    }

    /**
     * A single candidate resolves only when no other candidate scores within a small margin of it.
     */
    static AliasMatch resolveAlias(String fragment, List<String> candidates, double minScore) {
        String cleaned = cleanFragment(fragment);
        if (cleaned.isEmpty()) {
            return AliasMatch.NONE;
        }
        record Scored(String candidate, double score) {
        }
        List<Scored> scored = new ArrayList<>();
        for (String candidate : new LinkedHashSet<>(candidates)) {
            double score = matchScore(cleaned, candidate);
            if (score >= minScore) {
                scored.add(new Scored(candidate, score));
            }
        }
        if (scored.isEmpty()) {
            return AliasMatch.NONE;
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        double floor = Math.max(scored.get(0).score() - CLOSE_MARGIN, minScore);
        List<String> close = scored.stream()
                .filter(s -> s.score() >= floor)
                .map(Scored::candidate)
                .toList();
        if (close.size() == 1) {
            return new AliasMatch(close.get(0), List.of());
        }
        return new AliasMatch(null, close.subList(0, Math.min(MAX_AMBIGUOUS, close.size())));
    }

    static double matchScore(String fragment, String candidate) {
        String f = normalize(fragment);
        String c = normalize(candidate);
        if (f.isEmpty() || c.isEmpty()) {
            return 0.0;
        }
        if (f.equals(c)) {
            return 1.0;
        }
        if (c.startsWith(f + " ")) {
            return 0.96;
        }
        if ((" " + c + " ").contains(" " + f + " ")) {
            return 0.92;
        }
        Set<String> fragmentTokens = new LinkedHashSet<>(Arrays.asList(f.split(" ")));
        Set<String> candidateTokens = new LinkedHashSet<>(Arrays.asList(c.split(" ")));
        long shared = fragmentTokens.stream().filter(candidateTokens::contains).count();
        double overlap = (double) shared / fragmentTokens.size();
        return Math.max(overlap * 0.92, similarity(f, c) * 0.78);
    }

    static String descriptionPhrase(String question) {
        Matcher quoted = QUOTED_PHRASE.matcher(question);
        if (quoted.find()) {
            String phrase = cleanFragment(quoted.group(1));
            if (!phrase.isEmpty()) {
                return phrase;
            }
        }
        Matcher described = DESCRIPTION_PHRASE.matcher(question);
        return described.find() ? cleanFragment(described.group(1)) : "";
    }

    static Optional<TimeWindow> timeWindow(String question, LocalDate today) {
        Matcher rolling = ROLLING_WINDOW.matcher(question);
        if (rolling.find()) {
            int amount = Integer.parseInt(rolling.group(1));
            String unit = rolling.group(2).toLowerCase(Locale.ROOT);
            String phrase = rolling.group().strip();
            if (amount > 0 && unit.startsWith("day")) {
                return Optional.of(new TimeWindow(phrase, today.minusDays(amount - 1L), today,
                        "rolling last " + amount + " day(s) including today"));
            }
            if (amount > 0 && unit.startsWith("week")) {
                return Optional.of(new TimeWindow(phrase, today.minusDays(amount * 7L - 1), today,
                        "rolling last " + amount + " week(s) including today"));
            }
            if (amount > 0) {
                return Optional.of(new TimeWindow(phrase, today.withDayOfMonth(1).minusMonths(amount - 1L), today,
                        "calendar window over last " + amount + " month(s) including the current month"));
            }
        }
        if (TODAY.matcher(question).find()) {
            return Optional.of(new TimeWindow("today", today, today, "today only"));
        }
        if (YESTERDAY.matcher(question).find()) {
            LocalDate yesterday = today.minusDays(1);
            return Optional.of(new TimeWindow("yesterday", yesterday, yesterday, "yesterday only"));
        }
        LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        if (THIS_WEEK.matcher(question).find()) {
            return Optional.of(new TimeWindow("this week", monday, today, "current week to date, Monday start"));
        }
        if (LAST_WEEK.matcher(question).find()) {
            return Optional.of(new TimeWindow("last week", monday.minusWeeks(1), monday.minusDays(1),
                    "previous full week, Monday to Sunday"));
        }
        if (THIS_MONTH.matcher(question).find()) {
            return Optional.of(new TimeWindow("this month", today.withDayOfMonth(1), today, "current month to date"));
        }
        if (LAST_MONTH.matcher(question).find()) {
            LocalDate start = today.withDayOfMonth(1).minusMonths(1);
            return Optional.of(new TimeWindow("last month", start, start.with(TemporalAdjusters.lastDayOfMonth()),
                    "previous full calendar month"));
        }
        return Optional.empty();
    }

    static String firstFragment(String question, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(question);
            if (matcher.find()) {
                String fragment = cleanFragment(matcher.group(1));
                if (!fragment.isEmpty()) {
                    return fragment;
                }
            }
        }
        return "";
    }

    static String cleanFragment(String raw) {
        if (raw == null) {
            return "";
        }
        String collapsed = String.join(" ", raw.strip().split("\\s+"));
        String trimmed = TRAILING_TIME_CLAUSE.matcher(collapsed).replaceFirst("");
        trimmed = TRAILING_KEYWORD.matcher(trimmed).replaceFirst("");
        return trimmed.strip();
    }

    private static String normalize(String value) {
        return NON_WORD.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ").strip().replaceAll("\\s+", " ");
    }

    // Ratcliff/Obershelp: twice the matched characters over the combined length.
    static double similarity(String a, String b) {
        int total = a.length() + b.length();
        return total == 0 ? 1.0 : 2.0 * matchingCharacters(a, b) / total;
    }

    private static int matchingCharacters(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        int bestLength = 0;
        int bestA = 0;
        int bestB = 0;
        int[] previous = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            int[] current = new int[b.length() + 1];
            for (int j = 1; j <= b.length(); j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                    if (current[j] > bestLength) {
                        bestLength = current[j];
                        bestA = i - bestLength;
                        bestB = j - bestLength;
                    }
                }
            }
            previous = current;
        }
        if (bestLength == 0) {
            return 0;
        }
        return bestLength
                + matchingCharacters(a.substring(0, bestA), b.substring(0, bestB))
                + matchingCharacters(a.substring(bestA + bestLength), b.substring(bestB + bestLength));
    }

    record AliasMatch(String resolved, List<String> ambiguous) {
        static final AliasMatch NONE = new AliasMatch(null, List.of());
    }

    record TimeWindow(String phrase, LocalDate start, LocalDate end, String interpretation) {
    }
}
