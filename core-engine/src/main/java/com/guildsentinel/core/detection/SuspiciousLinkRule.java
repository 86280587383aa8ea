package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.SensitivityConfig;
import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.RuleDefinition;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.window.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Malicious-link detection on the newest message.
 *
 * <p>
 * Links are found with or without a scheme. Each indicator adds a fixed
 * amount to the score, which is capped at 1.0:
 * </p>
 * <ul>
 * <li>denylisted domain or denylist pattern match: 0.8</li>
 * <li>mass mention ({@code @everyone} / {@code @here}) together with a scam
 * keyword and a link: 0.5</li>
 * <li>link to an executable file: 0.5</li>
 * <li>gift/nitro-style host name, i.e. one combining at least two lure words
 * such as a brand lookalike and "gift": 0.4</li>
 * <li>throwaway top-level domain: 0.4</li>
 * <li>raw IP host: 0.3</li>
 * <li>URL shortener: 0.3</li>
 * <li>plain {@code http://}: 0.1</li>
 * </ul>
 * <p>
 * Allowlisted hosts contribute nothing. The rule fires when the score
 * reaches {@value #MIN_SCORE}. Amplification by concurrent rate or duplicate
 * signals is left to the decision engine's weighted sum.
 * </p>
 *
 * @since 1.0.0
 */
public class SuspiciousLinkRule implements RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SuspiciousLinkRule.class);

    static final double MIN_SCORE = 0.25;

    private static final Pattern LINK = Pattern.compile(
            "(?i)\\b(https?://)?((?:[a-z0-9](?:[a-z0-9-]*[a-z0-9])?\\.)+[a-z]{2,}|\\d{1,3}(?:\\.\\d{1,3}){3})"
                    + "(?::\\d{1,5})?(/[^\\s<>]*)?");
    private static final Pattern IP_HOST = Pattern.compile("\\d{1,3}(?:\\.\\d{1,3}){3}");
    private static final Pattern MASS_MENTION = Pattern.compile("@(everyone|here)\\b");
    private static final Pattern EXECUTABLE = Pattern.compile(
            "(?i)\\.(exe|scr|bat|cmd|msi|apk|jar|ps1|vbs)(?:[?#].*)?$");
    private static final List<Pattern> LURE_HOST_WORDS = List.of(
            Pattern.compile("d[i1l]s[ck][o0]r[dcl]"),
            Pattern.compile("st[e3][a4]m"),
            Pattern.compile("n[i1]tr[o0]"),
            Pattern.compile("g[i1]ft"),
            Pattern.compile("free"),
            Pattern.compile("airdr[o0]p"),
            Pattern.compile("cl[a4][i1]m"));
    private static final List<String> THROWAWAY_TLDS = List.of(".tk", ".ml", ".ga", ".cf", ".gq");

    private final String ruleName;
    private final double weight;
    private final Set<String> denylistDomains;
    private final List<Pattern> denylistPatterns;
    private final List<String> scamKeywords;
    private final Set<String> shortenerDomains;
    private final Set<String> allowlistDomains;

    /**
     * @param rule the rule definition
     * @throws IllegalArgumentException if a denylist pattern is not a valid
     *                                  regular expression
     */
    public SuspiciousLinkRule(RuleDefinition rule) {
        Objects.requireNonNull(rule, "RuleDefinition must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.weight = rule.getWeight();
        this.denylistDomains = lowercase(rule.getDenylistDomains());
        this.scamKeywords = List.copyOf(lowercase(rule.getScamKeywords()));
        this.shortenerDomains = lowercase(rule.getShortenerDomains());
        this.allowlistDomains = lowercase(rule.getAllowlistDomains());
        List<Pattern> patterns = new ArrayList<>();
        for (String pattern : rule.getDenylistPatterns()) {
            try {
                patterns.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException(
                        "Invalid denylist pattern for rule '" + ruleName + "': " + pattern, e);
            }
        }
        this.denylistPatterns = List.copyOf(patterns);
    }

    @Override
    public Optional<RuleSignal> evaluate(WindowSnapshot snapshot, SensitivityConfig config) {
        MessageEvent event = snapshot.getLatestEvent();
        if (event == null || event.getContent().isEmpty()) {
            return Optional.empty();
        }
        String content = event.getContent();
        List<Link> links = extractLinks(content);
        if (links.isEmpty()) {
            return Optional.empty();
        }

        String lower = content.toLowerCase(Locale.ROOT);
        double score = 0.0;
        List<String> evidence = new ArrayList<>();

        boolean denylisted = false;
        boolean giftHost = false;
        boolean throwaway = false;
        boolean ipHost = false;
        boolean shortener = false;
        boolean executable = false;
        boolean plainHttp = false;
        for (Link link : links) {
            if (matchesDomain(link.host, allowlistDomains)) {
                continue;
            }
            if (!denylisted && matchesDomain(link.host, denylistDomains)) {
                denylisted = true;
                evidence.add("denylisted domain: " + link.host);
            }
            if (!giftHost && isLureHost(link.host)) {
                giftHost = true;
                evidence.add("gift-style host: " + link.host);
            }
            if (!throwaway && THROWAWAY_TLDS.stream().anyMatch(link.host::endsWith)) {
                throwaway = true;
                evidence.add("throwaway domain: " + link.host);
            }
            if (!ipHost && IP_HOST.matcher(link.host).matches()) {
                ipHost = true;
                evidence.add("IP address link: " + link.host);
            }
            if (!shortener && shortenerDomains.contains(link.host)) {
                shortener = true;
                evidence.add("URL shortener: " + link.host);
            }
            if (!executable && link.path != null && EXECUTABLE.matcher(link.path).find()) {
                executable = true;
                evidence.add("executable download: " + link.host + link.path);
            }
            if (!plainHttp && "http://".equalsIgnoreCase(link.scheme)) {
                plainHttp = true;
            }
        }
        if (!denylisted) {
            for (Pattern pattern : denylistPatterns) {
                if (pattern.matcher(content).find()) {
                    denylisted = true;
                    evidence.add("denylist pattern: " + pattern.pattern());
                    break;
                }
            }
        }

        if (denylisted) {
            score += 0.8;
        }
        if (MASS_MENTION.matcher(lower).find()) {
            Optional<String> keyword = scamKeywords.stream().filter(lower::contains).findFirst();
            if (keyword.isPresent()) {
                score += 0.5;
                evidence.add("mass mention with scam keyword '" + keyword.get() + "'");
            }
        }
        if (executable) {
            score += 0.5;
        }
        if (giftHost) {
            score += 0.4;
        }
        if (throwaway) {
            score += 0.4;
        }
        if (ipHost) {
            score += 0.3;
        }
        if (shortener) {
            score += 0.3;
        }
        if (plainHttp) {
            score += 0.1;
        }

        score = Math.min(1.0, score);
        if (score < MIN_SCORE) {
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

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static List<Link> extractLinks(String content) {
        List<Link> links = new ArrayList<>();
        Matcher matcher = LINK.matcher(content);
        while (matcher.find()) {
            links.add(new Link(matcher.group(1), matcher.group(2).toLowerCase(Locale.ROOT), matcher.group(3)));
        }
        return links;
    }

    static boolean isLureHost(String host) {
        int words = 0;
        for (Pattern word : LURE_HOST_WORDS) {
            if (word.matcher(host).find() && ++words >= 2) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesDomain(String host, Set<String> domains) {
        for (String domain : domains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> lowercase(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    static final class Link {
        final String scheme;
        final String host;
        final String path;

        Link(String scheme, String host, String path) {
            this.scheme = scheme;
            this.host = host;
            this.path = path;
        }
    }
}
