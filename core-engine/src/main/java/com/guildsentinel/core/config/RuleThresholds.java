package com.guildsentinel.core.config;

import java.util.Objects;

/**
 * Threshold table applied by rules and by the decision bands.
 *
 * @since 1.0.0
 */
public final class RuleThresholds {

    private final int rateThreshold;
    private final double duplicateSimilarity;
    private final int duplicateRun;
    private final double warnBand;
    private final double muteBand;

    public RuleThresholds(int rateThreshold, double duplicateSimilarity, int duplicateRun,
            double warnBand, double muteBand) {
        if (rateThreshold < 1) {
            throw new IllegalArgumentException("rateThreshold must be >= 1, got: " + rateThreshold);
        }
        if (duplicateSimilarity <= 0 || duplicateSimilarity > 1) {
            throw new IllegalArgumentException(
                    "duplicateSimilarity must be in (0, 1], got: " + duplicateSimilarity);
        }
        if (duplicateRun < 2) {
            throw new IllegalArgumentException("duplicateRun must be >= 2, got: " + duplicateRun);
        }
        if (warnBand <= 0 || muteBand > 1 || warnBand > muteBand) {
            throw new IllegalArgumentException(
                    "bands must satisfy 0 < warnBand <= muteBand <= 1, got: " + warnBand + " / " + muteBand);
        }
        this.rateThreshold = rateThreshold;
        this.duplicateSimilarity = duplicateSimilarity;
        this.duplicateRun = duplicateRun;
        this.warnBand = warnBand;
        this.muteBand = muteBand;
    }

    /** Messages inside the rate window at which the rate rule fires. */
    public int getRateThreshold() {
        return rateThreshold;
    }

    /** Minimum normalized similarity for two messages to count as duplicates. */
    public double getDuplicateSimilarity() {
        return duplicateSimilarity;
    }

    /** Consecutive similar messages, newest included, needed to fire. */
    public int getDuplicateRun() {
        return duplicateRun;
    }

    public double getWarnBand() {
        return warnBand;
    }

    public double getMuteBand() {
        return muteBand;
    }

    /**
     * Apply per-guild overrides; {@code null} arguments keep the current value.
     *
     * @return new thresholds
     */
    public RuleThresholds override(Integer rate, Double similarity, Integer run, Double warn, Double mute) {
        return new RuleThresholds(
                rate != null ? rate : rateThreshold,
                similarity != null ? similarity : duplicateSimilarity,
                run != null ? run : duplicateRun,
                warn != null ? warn : warnBand,
                mute != null ? mute : muteBand);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RuleThresholds that)) {
            return false;
        }
        return rateThreshold == that.rateThreshold
                && Double.compare(duplicateSimilarity, that.duplicateSimilarity) == 0
                && duplicateRun == that.duplicateRun
                && Double.compare(warnBand, that.warnBand) == 0
                && Double.compare(muteBand, that.muteBand) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rateThreshold, duplicateSimilarity, duplicateRun, warnBand, muteBand);
    }

    @Override
    public String toString() {
        return "RuleThresholds{rate=" + rateThreshold +
                ", dupSimilarity=" + duplicateSimilarity +
                ", dupRun=" + duplicateRun +
                ", warn=" + warnBand +
                ", mute=" + muteBand + '}';
    }
}
