package org.polycore.utils.runtime;

import org.polycore.utils.Utils;

public final class RuntimeUtils {

    private RuntimeUtils() {}

    /**
     * @param clazz class to use when looking up the Implementation-Title
     * @return The name of this toolkit, uses "Implementation-Title" from the
     *         jar manifest of the given class, or (if that's not available) the package name.
     */
    public static String getToolkitName(Class<?> clazz) {
        Utils.nonNull(clazz);
        final String implementationTitle = clazz.getPackage().getImplementationTitle();
        return implementationTitle != null ? implementationTitle : clazz.getPackage().getName();
    }

    /**
     * @return get the implementation version of the given class
     */
    public static String getVersion(Class<?> clazz){
        Utils.nonNull(clazz);
        String versionString = clazz.getPackage().getImplementationVersion();
        return versionString != null ? versionString : "Unavailable";
    }

    /**
     * Bytes the JVM may still allocate: the maximum heap minus what is currently in use.
     */
    public static long getAvailableHeapBytes() {
        final Runtime runtime = Runtime.getRuntime();
        final long used = runtime.totalMemory() - runtime.freeMemory();
        return Math.max(0L, runtime.maxMemory() - used);
    }
}
