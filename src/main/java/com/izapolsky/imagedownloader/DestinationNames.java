package com.izapolsky.imagedownloader;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Maps image urls onto files in the output folder
 */
public final class DestinationNames {

    public static final String DEFAULT_EXTENSION = "png";

    private DestinationNames() {
    }

    /**
     * Destination of given url inside output folder
     *
     * @param outputFolder
     * @param url
     * @return
     */
    public static File destinationFor(File outputFolder, String url) {
        return new File(outputFolder, fileNameFor(url));
    }

    /**
     * Basename of the url path, query and fragment excluded.
     * Urls without a basename get a sha-256 hex name instead.
     * Names without an extension {@link ImageSinkImpl} can write get {@link #DEFAULT_EXTENSION} appended.
     *
     * @param url
     * @return
     */
    public static String fileNameFor(String url) {
        String path;
        String withoutQuery;
        try {
            URI uri = new URI(url);
            path = uri.getPath();
            if (path == null) {
                //opaque uri, e.g. mailto:
                path = uri.getSchemeSpecificPart();
            }
            withoutQuery = new URI(uri.getScheme(), uri.getAuthority(), uri.getPath(), null, null).toString();
        } catch (URISyntaxException e) {
            path = stripQuery(url);
            withoutQuery = path;
        }

        String name = FilenameUtils.getName(path);
        if (name.isEmpty() || ".".equals(name) || "..".equals(name)) {
            name = mangle(withoutQuery);
        }
        if (ImageSinkImpl.formatFor(new File(name)) == null) {
            name = name + "." + DEFAULT_EXTENSION;
        }
        return name;
    }

    /**
     * Transforms url into sha-256 hex hash
     *
     * @param url
     * @return
     */
    static String mangle(String url) {
        return DigestUtils.sha256Hex(url);
    }

    private static String stripQuery(String url) {
        int end = url.length();
        int query = url.indexOf('?');
        if (query >= 0) {
            end = query;
        }
        int fragment = url.indexOf('#');
        if (fragment >= 0 && fragment < end) {
            end = fragment;
        }
        return url.substring(0, end);
    }
}
