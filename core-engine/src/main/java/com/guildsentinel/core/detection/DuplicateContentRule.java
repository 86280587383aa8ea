package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.RuleThresholds;
import com.guildsentinel.core.config.SensitivityConfig;
import com.guildsentinel.core.model.RuleDefinition;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.window.ContentFingerprint;
import com.guildsentinel.core.window.WindowEntry;
import com.guildsentinel.core.window.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Repeated-content detection.
 *
 * <h3>Algorithm</h3>
 * <p>
 * The newest fingerprint is compared with the previous messages, newest
 * first, up to {@code lookback} of them, using {@link Similarity#ratio}. The
 * scan stops at the first message below the guild's similarity threshold.
 * The run length is the number of consecutive similar messages including
 * the newest one; the rule fires when it reaches the guild's minimum run.
 * </p>
 *
 * <p>
 * The reported pair is the most similar one inside the run, the most recent
 * pair winning ties. Confidence is that similarity scaled by
 * {@code min(1, 0.85 + 0.05 * (run - minRun))}.
 * </p>
 *
 * @since 1.0.0
 */
public class DuplicateContentRule implements RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(DuplicateContentRule.class);

    static final double RUN_BASE = 0.85;
    static final double RUN_STEP = 0.05;

    private final String ruleName;
    private final double weight;
    private final int lookback;

    /**
     * @param rule the rule definition
     * @throws IllegalArgumentException if {@code lookback} is invalid
     */
    public DuplicateContentRule(RuleDefinition rule) {
        Objects.requireNonNull(rule, "RuleDefinition must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.weight = rule.getWeight();
        this.lookback = rule.getLookback();
        if (lookback < 1) {
            throw new IllegalArgumentException(
                    "lookback must be >= 1 for rule '" + ruleName + "', got: " + lookback);
        }
    }

    @Override
    public Optional<RuleSignal> evaluate(WindowSnapshot snapshot, SensitivityConfig config) {
        List<WindowEntry> entries = snapshot.getEntries();
        if (entries.size() < 2) {
            return Optional.empty();
        }
        WindowEntry newest = entries.get(entries.size() - 1);
        ContentFingerprint fingerprint = newest.getFingerprint();
        if (fingerprint.isEmpty()) {
            return Optional.empty();
        }

        RuleThresholds thresholds = config.getThresholds();
        double minSimilarity = thresholds.getDuplicateSimilarity();
        int minRun = thresholds.getDuplicateRun();

        int run = 1;
        double best = -1.0;
        WindowEntry bestMatch = null;
        int oldestIndex = Math.max(0, entries.size() - 1 - lookback);
        for (int i = entries.size() - 2; i >= oldestIndex; i--) {
            WindowEntry candidate = entries.get(i);
            double similarity = Similarity.ratio(fingerprint.getText(), candidate.getFingerprint().getText());
            if (similarity < minSimilarity) {
                break;
            }
            run++;
            // strictly greater keeps the most recent pair on ties
            if (similarity > best) {
                best = similarity;
                bestMatch = candidate;
            }
        }

        if (run < minRun || bestMatch == null) {
            LOG.trace("Rule [{}] no signal for {}: run {} < {}", ruleName, snapshot.getKey(), run, minRun);
            return Optional.empty();
        }

        double confidence = best * Math.min(1.0, RUN_BASE + RUN_STEP * (run - minRun));
        LOG.debug("Rule [{}] fired for {}: run={} best={} ({} ~ {})",
                ruleName, snapshot.getKey(), run, best, newest.getMessageId(), bestMatch.getMessageId());
        return Optional.of(RuleSignal.detection(ruleName, confidence, List.of(
                String.format("messages %s and %s similarity %.2f",
                        bestMatch.getMessageId(), newest.getMessageId(), best),
                String.format("%d consecutive similar messages (minimum: %d)", run, minRun))));
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public double getWeight() {
        return weight;
    }
}
