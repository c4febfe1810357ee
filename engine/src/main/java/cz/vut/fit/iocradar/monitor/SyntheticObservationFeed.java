package cz.vut.fit.iocradar.monitor;

import cz.vut.fit.iocradar.AggregatorConfig;
import cz.vut.fit.iocradar.models.IndicatorKind;
import cz.vut.fit.iocradar.models.Observation;
import cz.vut.fit.iocradar.models.scores.NumericScore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Random;
import java.util.Set;

/**
 * A feed that manufactures plausible observations for demonstrations and load testing. Every poll yields
 * one to four observations, each generated from a randomly chosen threat template.
 */
public class SyntheticObservationFeed implements ObservationFeed {
    public static final int MIN_PER_POLL = 1;
    public static final int MAX_PER_POLL = 4;

    /**
     * The probability that a template able to produce either an IP or a domain produces an IP.
     */
    private static final double IP_BIAS = 0.7;

    private static final String HEX = "0123456789abcdef";
    private static final String[] COUNTRIES = {"CN", "RU", "US", "DE", "FR", "GB", "KR"};

    enum Template {
        MALWARE("honeypot"),
        PHISHING("email_filter"),
        BOTNET("network_monitor"),
        C2("dns_sinkhole"),
        RANSOMWARE("endpoint_detection");

        final String source;

        Template(String source) {
            this.source = source;
        }
    }

    private final Random _random;

    public SyntheticObservationFeed(Random random) {
        _random = random;
    }

    public static SyntheticObservationFeed fromProperties(Properties properties) {
        var seed = properties.getProperty(AggregatorConfig.MONITOR_FEED_SEED_CONFIG,
                AggregatorConfig.MONITOR_FEED_SEED_DEFAULT).trim();
        return new SyntheticObservationFeed(seed.isEmpty() ? new Random() : new Random(Long.parseLong(seed)));
    }

    @Override
    public synchronized List<Observation> poll() {
        final int count = between(MIN_PER_POLL, MAX_PER_POLL);
        final var result = new ArrayList<Observation>(count);
        final var templates = Template.values();

        for (int i = 0; i < count; i++) {
            var template = templates[_random.nextInt(templates.length)];
            result.add(generate(template, _random.nextDouble() < IP_BIAS));
        }
        return result;
    }

    Observation generate(Template template, boolean preferIp) {
        final Map<String, Object> details = new HashMap<>();
        return switch (template) {
            case MALWARE -> {
                if (preferIp || _random.nextDouble() < 0.8) {
                    details.put("detection_method", "behavioral_analysis");
                    details.put("confidence", between(80, 95));
                    details.put("country", pick(COUNTRIES));
                    details.put("asn", "AS" + between(1000, 99999));
                    yield observation(publicIp(), IndicatorKind.IP, template, between(70, 95), details,
                            Set.of("malware", "suspicious_ip"), "Malicious IP detected by " + template.source);
                }
                details.put("detection_method", "dns_analysis");
                details.put("confidence", between(75, 90));
                var domain = pick("suspicious-site", "malware-host", "infected-domain", "trojan-server")
                        + between(1, 999) + pick(".com", ".net", ".org", ".info", ".biz");
                yield observation(domain, IndicatorKind.DOMAIN, template, between(65, 90), details,
                        Set.of("malware", "suspicious_domain"), "Malicious domain detected by " + template.source);
            }
            case PHISHING -> {
                details.put("detection_method", "content_analysis");
                details.put("target_brand", pick("PayPal", "Amazon", "Microsoft", "Bank"));
                details.put("confidence", between(85, 95));
                var domain = pick("secure-bank", "paypal-verify", "amazon-security", "microsoft-login")
                        + between(10, 999) + pick(".tk", ".ml", ".ga", ".cf", ".com");
                yield observation(domain, IndicatorKind.DOMAIN, template, between(80, 95), details,
                        Set.of("phishing", "credential_theft"), "Phishing domain detected by " + template.source);
            }
            case BOTNET -> {
                details.put("detection_method", "traffic_analysis");
                details.put("botnet_family", pick("Mirai", "Zeus", "Emotet", "TrickBot"));
                details.put("infected_hosts", between(100, 5000));
                details.put("confidence", between(90, 98));
                yield observation(anyIp(), IndicatorKind.IP, template, between(85, 98), details,
                        Set.of("botnet", "c2_communication"), "Botnet C2 server detected by " + template.source);
            }
            case C2 -> {
                if (_random.nextBoolean()) {
                    details.put("detection_method", "behavioral_analysis");
                    details.put("protocol", pick("HTTP", "HTTPS", "DNS", "IRC"));
                    details.put("confidence", between(92, 99));
                    yield observation(anyIp(), IndicatorKind.IP, template, between(90, 99), details,
                            Set.of("c2", "command_control"), "C2 server detected by " + template.source);
                }
                details.put("detection_method", "dns_analysis");
                details.put("confidence", between(90, 96));
                var domain = pick("control-server", "cmd-host", "bot-control", "remote-cmd")
                        + between(1, 99) + pick(".tk", ".ml", ".ga", ".cf");
                yield observation(domain, IndicatorKind.DOMAIN, template, between(88, 96), details,
                        Set.of("c2", "command_control"), "C2 domain detected by " + template.source);
            }
            case RANSOMWARE -> {
                details.put("detection_method", "signature_analysis");
                details.put("ransomware_family", pick("WannaCry", "Ryuk", "Maze", "Conti"));
                details.put("file_type", "PE32");
                details.put("confidence", between(96, 99));
                var hash = new StringBuilder(64);
                for (int i = 0; i < 64; i++) {
                    hash.append(HEX.charAt(_random.nextInt(HEX.length())));
                }
                yield observation(hash.toString(), IndicatorKind.HASH, template, between(95, 99), details,
                        Set.of("ransomware", "file_hash"), "Ransomware sample detected by " + template.source);
            }
        };
    }

    private static Observation observation(String value, IndicatorKind kind, Template template, int score,
                                           Map<String, Object> details, Set<String> tags, String description) {
        return new Observation(value, kind, template.source, new NumericScore(score), details, tags, description);
    }

    private String publicIp() {
        // Class A to C unicast, skipping the private, loopback and link-local ranges
        while (true) {
            int first = switch (_random.nextInt(3)) {
                case 0 -> between(1, 126);
                case 1 -> between(128, 191);
                default -> between(192, 223);
            };
            int second = between(1, 255);
            if (first == 10 || first == 127 || first == 172 || (first == 192 && second == 168)
                    || (first == 169 && second == 254))
                continue;
            return first + "." + second + "." + between(1, 255) + "." + between(1, 255);
        }
    }

    private String anyIp() {
        return between(1, 223) + "." + between(1, 255) + "." + between(1, 255) + "." + between(1, 255);
    }

    private int between(int min, int max) {
        return min + _random.nextInt(max - min + 1);
    }

    private String pick(String... values) {
        return values[_random.nextInt(values.length)];
    }
}
