package org.polycore.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String OUTPUT_LONG_NAME = "output";
    public static final String REFERENCE_LONG_NAME = "reference";
    public static final String SAMPLE_LONG_NAME = "sample";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";

    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String REFERENCE_SHORT_NAME = "R";
    public static final String SAMPLE_SHORT_NAME = "S";

    /**
     * The option specifying a main configuration file.
     * This is used in {@link org.polycore.Main} to control which config file is loaded.
     */
    public static final String POLYCORE_CONFIG_FILE_OPTION = "polycore-config-file";
}
