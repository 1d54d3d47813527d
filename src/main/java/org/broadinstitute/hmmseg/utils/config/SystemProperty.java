package org.broadinstitute.hmmseg.utils.config;

import java.lang.annotation.*;

/**
 * Marks a getter of a {@link org.aeonbits.owner.Config} interface whose value is copied into the JVM system
 * properties at startup, see {@link ConfigFactory#injectSystemPropertiesFromConfig}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Documented
public @interface SystemProperty {
}
