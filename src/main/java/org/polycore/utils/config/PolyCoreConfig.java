package org.polycore.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Configuration file for PolyCore options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + PolyCoreConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + PolyCoreConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:PolyCoreConfig.properties",
 *        4)   "classpath:org/polycore/utils/config/PolyCoreConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + PolyCoreConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "classpath:${" + PolyCoreConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
        "file:PolyCoreConfig.properties",
        "classpath:org/polycore/utils/config/PolyCoreConfig.properties"
})
public interface PolyCoreConfig extends Mutable, Accessible {

    /**
     * Variable in the {@link Sources} annotation holding the path of an alternate configuration file.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "PolyCoreConfig.pathToPolyCoreConfig";

    /**
     * Variable in the {@link Sources} annotation holding a class path location of an alternate configuration file.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "PolyCoreConfig.classPathToPolyCoreConfig";

    // ----------------------------------------------------------
    // Miscellaneous Options:
    // ----------------------------------------------------------

    @Key("polycore_stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean polycore_stacktrace_on_user_exception();

    // ----------------------------------------------------------
    // Distance computation:
    // ----------------------------------------------------------

    /**
     * Chunk width, in alignment columns, used when no memory budget signal is available.
     */
    @Key("default_chunk_width")
    @DefaultValue("10000")
    int default_chunk_width();

    /**
     * Smallest chunk width worth running; narrower chunks fail with an insufficient memory error.
     */
    @Key("min_viable_chunk_width")
    @DefaultValue("1")
    int min_viable_chunk_width();

    /**
     * Fraction of the free JVM heap the distance computation may use.
     */
    @Key("memory_safety_fraction")
    @DefaultValue("0.8")
    double memory_safety_fraction();

    // ----------------------------------------------------------
    // Output:
    // ----------------------------------------------------------

    @Key("fasta_bases_per_line")
    @DefaultValue("60")
    int fasta_bases_per_line();
}
