package hol.resolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tunables of a resolution run.
 *
 * @param typeVarPrefix prefix of the fresh type variables made while resolving
 * @param memoEnabled   whether lookups are memoised; off only for diagnosis
 */
public record ResolverSettings(String typeVarPrefix, boolean memoEnabled) {
    private static final Logger LOGGER = Logger.getLogger(ResolverSettings.class.getName());

    public static final String RESOURCE = "hol-resolver.properties";
    public static final String PREFIX_KEY = "resolver.typevar.prefix";
    public static final String MEMO_KEY = "resolver.memo.enabled";

    public static final ResolverSettings DEFAULT = new ResolverSettings("_ty", true);

    public ResolverSettings {
        if (typeVarPrefix == null || typeVarPrefix.isBlank()) {
            throw new IllegalArgumentException("type variable prefix must not be blank");
        }
    }

    /**
     * Settings from {@value #RESOURCE} on the classpath. Missing keys take their default.
     */
    public static ResolverSettings load() {
        try (InputStream in = ResolverSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return DEFAULT;
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read " + RESOURCE + ", using default settings", e);
            return DEFAULT;
        }
    }

    public static ResolverSettings fromProperties(Properties props) {
        String prefix = props.getProperty(PREFIX_KEY, DEFAULT.typeVarPrefix()).trim();
        boolean memo = Boolean.parseBoolean(props.getProperty(MEMO_KEY, String.valueOf(DEFAULT.memoEnabled())).trim());
        return new ResolverSettings(prefix, memo);
    }
}
