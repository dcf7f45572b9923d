package com.izapolsky.imagedownloader;

import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URISyntaxException;
import java.net.URL;

/**
 * Fetcher implementation, http(s) through commons-http, file urls read directly
 */
public class ImageFetcherImpl implements ImageFetcher, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ImageFetcherImpl.class);

    public static final String USER_AGENT = "Mozilla/5.0 (Linux; Android 6.0; Nexus 5 Build/MRA58N) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/91.0.4472.124 Mobile Safari/537.36";

    private final CloseableHttpClient chc;

    public ImageFetcherImpl(CloseableHttpClient chc) {
        this.chc = chc;
    }

    /**
     * Size pooled connections to the number of workers, defaults allow only 2 per route
     *
     * @param maxWorkers
     * @param httpTimeoutMillis
     * @return
     */
    public static ImageFetcherImpl forWorkers(int maxWorkers, int httpTimeoutMillis) {
        return new ImageFetcherImpl(HttpClients.custom()
                .setUserAgent(USER_AGENT)
                .setMaxConnTotal(Math.max(maxWorkers, 2))
                .setMaxConnPerRoute(Math.max(maxWorkers, 2))
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectTimeout(httpTimeoutMillis)
                        .setConnectionRequestTimeout(httpTimeoutMillis)
                        .setSocketTimeout(httpTimeoutMillis)
                        .build())
                .build());
    }

    @Override
    public FetchResult fetch(String url) {
        URL imageUrl;
        try {
            imageUrl = new URL(url);
        } catch (MalformedURLException e) {
            return FetchResult.failure(String.format("Malformed url %1$s", url), e);
        }

        try {
            if (isLocal(imageUrl)) {
                try (InputStream is = imageUrl.openStream()) {
                    return decode(is, url);
                }
            }

            HttpGet imageGet = new HttpGet(imageUrl.toURI());
            try (CloseableHttpResponse response = chc.execute(imageGet)) {
                int status = response.getStatusLine().getStatusCode();
                HttpEntity entity = response.getEntity();
                if (status != HttpStatus.SC_OK) {
                    EntityUtils.consumeQuietly(entity);
                    return FetchResult.failure(String.format("Status %1$s for %2$s", status, url));
                }
                if (entity == null) {
                    return FetchResult.failure(String.format("Empty response for %1$s", url));
                }
                return decode(new ByteArrayInputStream(EntityUtils.toByteArray(entity)), url);
            }
        } catch (IOException e) {
            LOG.debug("I/O error fetching {}", url, e);
            return FetchResult.failure(String.format("I/O error fetching %1$s: %2$s", url, e.getMessage()), e);
        } catch (URISyntaxException e) {
            return FetchResult.failure(String.format("Failed to parse URI %1$s", url), e);
        }
    }

    /**
     * Turns raw content into image
     *
     * @param is
     * @param url
     * @return
     * @throws IOException
     */
    protected FetchResult decode(InputStream is, String url) throws IOException {
        BufferedImage image = ImageIO.read(is);
        if (image == null) {
            return FetchResult.failure(String.format("Content of %1$s is not a supported image", url));
        }
        return FetchResult.success(image);
    }

    /**
     * Checks if given url is from "local" filesystem
     *
     * @param url
     * @return
     */
    protected boolean isLocal(URL url) {
        return "file".equals(url.getProtocol());
    }

    @Override
    public void close() throws IOException {
        chc.close();
    }
}
