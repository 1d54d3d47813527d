package org.broadinstitute.hmmseg.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.hmmseg.exceptions.HmmSegException;
import org.broadinstitute.hmmseg.exceptions.UserException;
import org.broadinstitute.hmmseg.utils.LoggingUtils;
import org.broadinstitute.hmmseg.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point for loading hmmseg settings through {@link org.aeonbits.owner}.
 *
 * <p>
 *     Config interfaces may name their source files through {@code ${variable}} placeholders in their
 *     {@link Config.Sources}. Before an interface is first instantiated, every placeholder that nobody has defined
 *     (environment, system properties or the owner factory) is pointed at {@link #NO_PATH_VARIABLE_VALUE}, so owner
 *     skips that source and merges in the next one.
 * </p>
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory INSTANCE = new ConfigFactory();

    private static final Pattern PATH_VARIABLE = Pattern.compile("\\$\\{(.*)}");

    /**
     * Placeholder value for source path variables that were never defined.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> resolvedConfigClasses = new HashSet<>();

    private ConfigFactory() {}

    public static ConfigFactory getInstance() {
        return INSTANCE;
    }

    /**
     * @return the cached process-wide {@link HmmSegConfig}
     */
    public HmmSegConfig getHmmSegConfig() {
        return getOrCreate(HmmSegConfig.class);
    }

    /**
     * Builds a new, uncached instance of {@code clazz}, see {@link org.aeonbits.owner.ConfigFactory#create}.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Returns the cached instance of {@code clazz}, building it on first use, see {@link ConfigCache#getOrCreate}.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    private synchronized void resolvePathVariables(final Class<? extends Config> clazz) {
        if (resolvedConfigClasses.add(clazz)) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
        }
    }

    /**
     * Sets each of {@code pathVariables} that is not defined anywhere owner looks to {@link #NO_PATH_VARIABLE_VALUE}.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> pathVariables) {
        for (final String variable : pathVariables) {
            final String definedValue = findDefinedValue(variable);
            if (definedValue == null) {
                logger.debug("Config path variable " + variable + " is undefined, its source will be skipped");
                org.aeonbits.owner.ConfigFactory.setProperty(variable, NO_PATH_VARIABLE_VALUE);
            } else {
                logger.debug("Config path variable " + variable + " points to " + definedValue);
            }
        }
    }

    private static String findDefinedValue(final String variable) {
        if (System.getenv().containsKey(variable)) {
            return System.getenv(variable);
        }
        if (System.getProperties().containsKey(variable)) {
            return System.getProperty(variable);
        }
        return org.aeonbits.owner.ConfigFactory.getProperty(variable);
    }

    /**
     * @return the {@code ${...}} variable names of the {@link Config.Sources} of {@code configClass}, in declaration order
     */
    @VisibleForTesting
    List<String> getSourcesAnnotationPathVariables(final Class<? extends Config> configClass) {
        final Config.Sources sources = configClass.getAnnotation(Config.Sources.class);
        if (sources == null) {
            return Collections.emptyList();
        }
        final List<String> variables = new ArrayList<>();
        for (final String source : sources.value()) {
            final Matcher matcher = PATH_VARIABLE.matcher(source);
            if (matcher.find()) {
                variables.add(matcher.group(1));
            }
        }
        return variables;
    }

    /**
     * Finds the value that follows the first {@code configFileOption} in {@code args}. The file is not checked.
     *
     * @return the configuration file name, or {@code null} if the option is absent
     * @throws UserException.BadInput if the option is the last argument or is followed by another option
     */
    public static String getConfigFilenameFromArgs(final String[] args, final String configFileOption) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals(configFileOption)) {
                if (i + 1 == args.length || args[i + 1].startsWith("-")) {
                    throw new UserException.BadInput("No configuration file given after " + configFileOption);
                }
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Loads {@link HmmSegConfig}, from the file named after {@code configFileOption} if {@code args} has one,
     * and copies its {@link SystemProperty} values into the system properties.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] args, final String configFileOption) {
        final String configFileName = getConfigFilenameFromArgs(args, configFileOption);
        if (configFileName != null) {
            org.aeonbits.owner.ConfigFactory.setProperty(HmmSegConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName);
        }
        injectSystemPropertiesFromConfig(getOrCreate(HmmSegConfig.class));
    }

    /**
     * Copies the {@link SystemProperty} values of {@code config} into the system properties, keeping existing ones.
     */
    public synchronized void injectSystemPropertiesFromConfig(final Config config) {
        Utils.nonNull(config);
        final Map<String, String> properties = new LinkedHashMap<>();
        getConfigMap(config, true).forEach((key, value) -> properties.put(key, String.valueOf(value)));
        injectToSystemProperties(properties);
    }

    @VisibleForTesting
    void injectToSystemProperties(final Map<String, String> properties) {
        for (final Map.Entry<String, String> property : properties.entrySet()) {
            if (System.getProperties().containsKey(property.getKey())) {
                logger.debug("Keeping the existing system property " + property.getKey());
                continue;
            }
            System.setProperty(property.getKey(), property.getValue());
            if (!property.getValue().equals(System.getProperty(property.getKey()))) {
                throw new HmmSegException("Could not set the system property " + property.getKey() + "=" + property.getValue());
            }
        }
    }

    /**
     * Logs every key and value of {@code config} at {@code logLevel}.
     */
    public static void logConfigFields(final Config config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        Utils.nonNull(logLevel);
        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if (!logger.isEnabled(level)) {
            return;
        }
        logger.log(level, "Configuration values:");
        getConfigMap(config, false).forEach((key, value) -> logger.log(level, "\t" + key + " = " + value));
    }

    /**
     * Reads every getter of the owner interfaces that {@code config} implements, keyed by its {@link Config.Key}
     * when it has one and by its method name otherwise.
     */
    @VisibleForTesting
    static LinkedHashMap<String, Object> getConfigMap(final Config config, final boolean onlySystemProperties) {
        final LinkedHashMap<String, Object> values = new LinkedHashMap<>();
        for (final Class<?> configInterface : config.getClass().getInterfaces()) {
            if (!Config.class.isAssignableFrom(configInterface)) {
                continue;
            }
            for (final Method getter : configInterface.getDeclaredMethods()) {
                if (onlySystemProperties && !getter.isAnnotationPresent(SystemProperty.class)) {
                    continue;
                }
                final Config.Key key = getter.getAnnotation(Config.Key.class);
                values.put(key == null ? getter.getName() : key.value(), invokeGetter(config, getter));
            }
        }
        return values;
    }

    private static Object invokeGetter(final Config config, final Method getter) {
        try {
            return getter.invoke(config);
        } catch (final IllegalAccessException | InvocationTargetException ex) {
            throw new HmmSegException("Could not read the configuration value " + getter.getName(), ex);
        }
    }
}
