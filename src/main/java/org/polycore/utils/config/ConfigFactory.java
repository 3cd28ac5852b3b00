package org.polycore.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.PolyCoreException;
import org.polycore.exceptions.UserException;
import org.polycore.utils.LoggingUtils;
import org.polycore.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * This class wraps functionality in the {@link org.aeonbits.owner} configuration utilities to be a more
 * PolyCore-specific interface.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance;

    static {
        instance = new ConfigFactory();
    }

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
     * Sets every path variable that is not defined as a system, environment or owner property to an empty
     * path, so the owner factory skips that source instead of treating the variable text as a path.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        for (final String property : filenameProperties) {
            if ( System.getenv().containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + System.getenv(property));
            }
            else if ( System.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + System.getProperty(property));
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties: " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property));
            }
            else {
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
        if ( annotation != null ) {
            for (final String val : annotation.value()) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }

    /**
     * Quick way to get the PolyCore configuration.
     */
    public PolyCoreConfig getPolyCoreConfig() {
        return getOrCreate( PolyCoreConfig.class );
    }

    /**
     * Wrapper around {@link ConfigCache#getOrCreate(Class, Map[])} which resolves the path variables of the
     * configuration sources first. The class itself is used as the cache key.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if ( !alreadyResolvedPathVariables.contains(clazz) ) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
            alreadyResolvedPathVariables.add(clazz);
        }
    }

    /**
     * Get the configuration file name from the given arguments.
     *
     * NOTE: Does NOT validate that the resulting string is a valid configuration file.
     *
     * @param args Command-line arguments passed to this program.
     * @param configFileOption The command-line option indicating that the config file is next
     * @return The name of the configuration file for this program or {@code null}.
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        String configFileName = null;
        for ( int i = 0 ; i < args.length ; ++i ) {
            if (args[i].equals(configFileOption)) {
                if ( ((i+1) < args.length) && (!args[i+1].startsWith("-")) ) {
                    configFileName = args[i+1];
                    break;
                }
                else {
                    throw new UserException.BadInput("Configuration file not given after config file option specified: " + configFileOption);
                }
            }
        }
        return configFileName;
    }

    /**
     * Get the configuration filename from the command-line (if it exists) and create the {@link PolyCoreConfig}
     * for it. The configuration is cached, so later calls to {@link #getPolyCoreConfig()} see the same values.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] argList,
                                                                         final String configFileOption) {
        Utils.nonNull(argList);
        Utils.nonNull(configFileOption);

        final String configFileName = getConfigFilenameFromArgs( argList, configFileOption );
        if ( configFileName != null ) {
            org.aeonbits.owner.ConfigFactory.setProperty( PolyCoreConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
            // drop any instance loaded before the file was known
            ConfigCache.remove(PolyCoreConfig.class);
        }
        getPolyCoreConfig();
    }

    /**
     * Logs all the parameters in the given {@link Config} object at {@link Level#DEBUG}
     */
    public static <T extends Config> void logConfigFields(final T config) {
        logConfigFields(config, Log.LogLevel.DEBUG);
    }

    public static <T extends Config> void logConfigFields(final T config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final Map.Entry<String, Object> entry : getConfigMap(config).entrySet() ) {
            logger.log(level, "\t" + entry.getKey() + " = " + entry.getValue());
        }
    }

    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap( final T config ) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        // config is a proxy, so walk the owner interfaces it implements rather than its own methods
        for ( final Class<?> classInterface : config.getClass().getInterfaces() ) {
            if ( !Config.class.isAssignableFrom(classInterface) ) {
                continue;
            }
            for (final Method propertyMethod : classInterface.getDeclaredMethods()) {
                final Config.Key key = propertyMethod.getAnnotation(Config.Key.class);
                if (key == null) {
                    continue;
                }
                try {
                    configMap.put(key.value(), propertyMethod.invoke(config));
                } catch (final IllegalAccessException | InvocationTargetException ex) {
                    throw new PolyCoreException("Could not invoke the config getter: " +
                            config.getClass().getSimpleName() + "." + propertyMethod.getName(), ex);
                }
            }
        }
        return configMap;
    }
}
