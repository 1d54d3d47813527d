package org.broadinstitute.hmmseg.utils.runtime;

import org.broadinstitute.hmmseg.utils.Utils;

/**
 * Tool names and versions as recorded in the jar manifest.
 */
public final class RuntimeUtils {

    private static final String UNKNOWN_VERSION = "Unavailable";

    private RuntimeUtils() {}

    /**
     * @return the name under which {@code toolClass} is listed and invoked
     */
    public static String toolDisplayName(final Class<?> toolClass) {
        Utils.nonNull(toolClass, "the tool class must not be null");
        return toolClass.getSimpleName();
    }

    /**
     * @return the Implementation-Title of the jar holding {@code clazz}, or its package name outside a jar
     */
    public static String getToolkitName(final Class<?> clazz) {
        final Package pkg = clazz.getPackage();
        return pkg.getImplementationTitle() == null ? pkg.getName() : pkg.getImplementationTitle();
    }

    /**
     * @return the Implementation-Version of the jar holding {@code clazz}, or {@value #UNKNOWN_VERSION} outside a jar
     */
    public static String getVersion(final Class<?> clazz) {
        final String version = clazz.getPackage().getImplementationVersion();
        return version == null ? UNKNOWN_VERSION : version;
    }
}
