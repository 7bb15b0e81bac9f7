package org.broadinstitute.msa.utils.config;

import com.google.common.annotations.VisibleForTesting;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.msa.utils.Utils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * This class wraps functionality in the {@link org.aeonbits.owner} configuration utilities so that path variables in
 * {@link Config.Sources} annotations resolve to a neutral value when the user did not set them.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    /**
     * A regex to use to look for variables in the Sources annotation
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set each variable for configuration file paths when the variable
     * has not been set in either Java System properties or environment properties.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    /**
     * Quick way to get the Stockholm configuration.
     */
    public StockholmConfig getStockholmConfig() {
        return getOrCreate(StockholmConfig.class);
    }

    /**
     * Creates a fresh {@link Config} instance, bypassing the cache.
     *
     * @param imports additional properties, used only for keys that none of the {@link Config.Sources} define.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Gets from the cache or creates an instance of the given configuration class.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if (alreadyResolvedPathVariables.add(clazz)) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
        }
    }

    /**
     * Any path variable not defined as an environment, system or owner property is set to
     * {@link #NO_PATH_VARIABLE_VALUE} so that loading falls through to the next source.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        for (final String property : filenameProperties) {
            if (System.getenv().containsKey(property) || System.getProperties().containsKey(property)
                    || org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property)) {
                logger.debug("Config path variable found: " + property + " - will search for config there.");
            } else {
                logger.debug("Config path variable not found: " + property + " - setting value to " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get a list of the config file variables from the given {@link Config} class.
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {
        final List<String> configPathVariableNames = new ArrayList<>();
        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);
        if (annotation != null) {
            for (final String val : annotation.value()) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }
}
