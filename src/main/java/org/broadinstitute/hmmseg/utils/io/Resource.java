package org.broadinstitute.hmmseg.utils.io;

import java.io.InputStream;

/**
 * A class path resource, named relative to the package of a class (or absolutely with a leading {@code /}).
 */
public final class Resource {

    private final String path;
    private final Class<?> relativeClass;

    public Resource(final String path, final Class<?> relativeClass) {
        this.path = path;
        this.relativeClass = relativeClass;
    }

    public String getPath() {
        return path;
    }

    public Class<?> getRelativeClass() {
        return relativeClass;
    }

    /**
     * @return the path of the resource from the class path root
     */
    public String getFullPath() {
        if (path.startsWith("/")) {
            return path.substring(1);
        }
        return relativeClass.getPackage().getName().replace('.', '/') + "/" + path;
    }

    /**
     * Opens the resource. The caller closes the stream.
     *
     * @throws IllegalArgumentException if there is no such resource
     */
    public InputStream getResourceContentsAsStream() {
        final InputStream stream = relativeClass.getResourceAsStream(path);
        if (stream == null) {
            throw new IllegalArgumentException("Resource not found: " + getFullPath());
        }
        return stream;
    }

    @Override
    public String toString() {
        return "resource:" + getFullPath();
    }
}
