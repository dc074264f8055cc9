package bigo.conductor.policy;

import bigo.conductor.model.Backend;
import bigo.conductor.model.Tier;
import bigo.conductor.model.TierConfig;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reads the tier routing table from an INI file.
 *
 * <pre>
 * [tier.standard]
 * primary = claude:sonnet
 * validator = claude:sonnet
 * validators = 2
 * approvals = 2
 * fallback = standard
 *
 * [fallback.standard]
 * chain = claude:sonnet, ollama:reasoning, claude:haiku
 * </pre>
 *
 * Any malformed or missing entry fails startup with {@link IllegalStateException}.
 */
public final class RoutingConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(RoutingConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/bigo/routing.ini";

    private static final String TIER_PREFIX = "tier.";
    private static final String FALLBACK_PREFIX = "fallback.";

    private RoutingConfigLoader() {
    }

    public static TierPolicy loadDefault() {
        try (InputStream in = RoutingConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Routing table not found on classpath: " + DEFAULT_RESOURCE);
            }
            Ini ini = new Ini();
            ini.load(in);
            return parse(ini, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read routing table " + DEFAULT_RESOURCE, e);
        }
    }

    public static TierPolicy load(File file) {
        try {
            return parse(new Ini(file), file.getPath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read routing table " + file, e);
        }
    }

    static TierPolicy parse(Ini ini, String source) {
        TierPolicy.Builder builder = TierPolicy.builder();
        for (String name : ini.keySet()) {
            if (!name.startsWith(TIER_PREFIX)) {
                continue;
            }
            Tier tier = parseOrFail(() -> Tier.parse(name.substring(TIER_PREFIX.length())), source, name);
            Profile.Section section = ini.get(name);

            Backend primary = backend(section, "primary", source);
            Backend validator = optionalBackend(section, "validator", source);
            int validators = intValue(section, "validators", source);
            int approvals = intValue(section, "approvals", source);
            TierConfig config = parseOrFail(
                    () -> new TierConfig(primary, validator, validators, approvals), source, name);

            List<Backend> chain = chain(ini, required(section, "fallback", source), source);
            builder.tier(tier, config, chain);
        }
        TierPolicy policy = builder.build();
        log.debug("Loaded routing table from {}", source);
        return policy;
    }

    private static List<Backend> chain(Ini ini, String group, String source) {
        Profile.Section section = ini.get(FALLBACK_PREFIX + group);
        if (section == null) {
            throw new IllegalStateException(source + ": unknown fallback group '" + group + "'");
        }
        List<Backend> chain = new ArrayList<>();
        for (String id : required(section, "chain", source).split(",")) {
            if (!id.isBlank()) {
                chain.add(parseOrFail(() -> Backend.fromId(id), source, section.getName()));
            }
        }
        return chain;
    }

    private static Backend backend(Profile.Section section, String key, String source) {
        String value = required(section, key, source);
        return parseOrFail(() -> Backend.fromId(value), source, section.getName());
    }

    private static Backend optionalBackend(Profile.Section section, String key, String source) {
        String value = section.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return parseOrFail(() -> Backend.fromId(value), source, section.getName());
    }

    private static int intValue(Profile.Section section, String key, String source) {
        String value = required(section, key, source);
        return parseOrFail(() -> Integer.parseInt(value.trim()), source, section.getName());
    }

    private static String required(Profile.Section section, String key, String source) {
        String value = section.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(source + ": [" + section.getName() + "] is missing '" + key + "'");
        }
        return value.trim();
    }

    private static <T> T parseOrFail(Supplier<T> parser, String source, String section) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(source + ": [" + section + "] " + e.getMessage(), e);
        }
    }
}
