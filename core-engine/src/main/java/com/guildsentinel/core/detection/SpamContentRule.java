package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.SensitivityConfig;
import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.RuleDefinition;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.window.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-message spam heuristics.
 *
 * <table>
 * <caption>Score contributions (sum capped at 1.0)</caption>
 * <tr><td>each spam keyword (whole word)</td><td>0.15</td></tr>
 * <tr><td>uppercase letters &gt; 50% / &gt; 30%</td><td>0.25 / 0.15</td></tr>
 * <tr><td>exclamation marks &gt; 5 / &gt; 3</td><td>0.30 / 0.15</td></tr>
 * <tr><td>money/fire emoji runs</td><td>0.25</td></tr>
 * <tr><td>one character repeated 5+ times</td><td>0.20</td></tr>
 * <tr><td>more than 3 links</td><td>0.20</td></tr>
 * <tr><td>more than 2 invite links</td><td>0.25</td></tr>
 * </table>
 *
 * <p>
 * Uppercase scoring needs at least {@value #MIN_LETTERS_FOR_CASE} letters.
 * The rule fires when the score reaches {@code scoreThreshold}.
 * </p>
 *
 * @since 1.0.0
 */
public class SpamContentRule implements RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SpamContentRule.class);

    static final int MIN_LETTERS_FOR_CASE = 8;

    private static final Pattern REPEATED_CHAR = Pattern.compile("(.)\\1{4,}");
    private static final Pattern HTTP_LINK = Pattern.compile("(?i)https?://\\S+");
    private static final Pattern INVITE = Pattern.compile("(?i)(?:discord\\.gg|discord(?:app)?\\.com/invite)/\\w+");
    private static final Pattern EMOJI_RUN = Pattern.compile(
            "[\\x{1F4B0}\\x{1F525}\\x{1F4B8}\\x{1F48E}\\x{20BF}]{3,}");

    private final String ruleName;
    private final double weight;
    private final double scoreThreshold;
    private final List<Keyword> keywords;

    public SpamContentRule(RuleDefinition rule) {
        Objects.requireNonNull(rule, "RuleDefinition must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.weight = rule.getWeight();
        this.scoreThreshold = rule.getScoreThreshold();
        List<Keyword> compiled = new ArrayList<>();
        for (String keyword : rule.getSpamKeywords()) {
            if (keyword != null && !keyword.isBlank()) {
                String word = keyword.trim().toLowerCase(Locale.ROOT);
                compiled.add(new Keyword(word,
                        Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(word) + "(?![\\p{L}\\p{N}])")));
            }
        }
        this.keywords = List.copyOf(compiled);
    }

    @Override
    public Optional<RuleSignal> evaluate(WindowSnapshot snapshot, SensitivityConfig config) {
        MessageEvent event = snapshot.getLatestEvent();
        if (event == null || event.getContent().isBlank()) {
            return Optional.empty();
        }
        String content = event.getContent();
        String lower = content.toLowerCase(Locale.ROOT);
        double score = 0.0;
        List<String> evidence = new ArrayList<>();

        for (Keyword keyword : keywords) {
            if (keyword.pattern.matcher(lower).find()) {
                score += 0.15;
                evidence.add("spam keyword: " + keyword.word);
            }
        }

        int letters = 0;
        int upper = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        if (letters >= MIN_LETTERS_FOR_CASE) {
            double ratio = (double) upper / letters;
            if (ratio > 0.5) {
                score += 0.25;
                evidence.add(String.format("uppercase ratio %.0f%%", ratio * 100));
            } else if (ratio > 0.3) {
                score += 0.15;
                evidence.add(String.format("uppercase ratio %.0f%%", ratio * 100));
            }
        }

        long exclamations = content.chars().filter(c -> c == '!').count();
        if (exclamations > 5) {
            score += 0.3;
            evidence.add(exclamations + " exclamation marks");
        } else if (exclamations > 3) {
            score += 0.15;
            evidence.add(exclamations + " exclamation marks");
        }

        if (EMOJI_RUN.matcher(content).find()) {
            score += 0.25;
            evidence.add("money emoji run");
        }
        if (REPEATED_CHAR.matcher(content).find()) {
            score += 0.2;
            evidence.add("repeated characters");
        }
        int links = count(HTTP_LINK.matcher(content));
        if (links > 3) {
            score += 0.2;
            evidence.add(links + " links");
        }
        int invites = count(INVITE.matcher(content));
        if (invites > 2) {
            score += 0.25;
            evidence.add(invites + " invite links");
        }

        score = Math.min(1.0, score);
        if (score < scoreThreshold) {
            LOG.trace("Rule [{}] no signal for {}: score {}", ruleName, snapshot.getKey(), score);
            return Optional.empty();
        }
        LOG.debug("Rule [{}] fired for {}: score={} evidence={}", ruleName, snapshot.getKey(), score, evidence);
        return Optional.of(RuleSignal.detection(ruleName, score, evidence));
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public double getWeight() {
        return weight;
    }

    private static int count(Matcher matcher) {
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }

    private static final class Keyword {
        final String word;
        final Pattern pattern;

        Keyword(String word, Pattern pattern) {
            this.word = word;
            this.pattern = pattern;
        }
    }
}
