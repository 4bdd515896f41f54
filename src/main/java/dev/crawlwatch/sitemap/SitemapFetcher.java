package dev.crawlwatch.sitemap;

import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapParser;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;
import dev.crawlwatch.extraction.Crawl4AiProperties;

/**
 * Downloads a sitemap and lists its page URLs using crawler-commons.
 * Handles both single sitemaps and sitemap index files (followed one level deep).
 */
@Component
public class SitemapFetcher {

    private static final Logger log = LoggerFactory.getLogger(SitemapFetcher.class);

    private final RestClient httpClient;
    private final long maxSitemapSizeBytes;

    public SitemapFetcher(RestClient.Builder restClientBuilder, Crawl4AiProperties props) {
        this.httpClient = restClientBuilder
                .defaultHeader(HttpHeaders.ACCEPT, "*/*")
                .build();
        this.maxSitemapSizeBytes = props.maxSitemapSizeBytes();
    }

    /**
     * Fetch the sitemap at the given URL and return every page URL it lists, in document order.
     * Broken sub-sitemaps of an index are skipped.
     *
     * @throws SitemapFetchException if the sitemap itself cannot be fetched or parsed
     */
    public List<String> fetch(String sitemapUrl) {
        byte[] content;
        try {
            content = fetchSitemap(sitemapUrl);
        } catch (RestClientException e) {
            throw new SitemapFetchException("Could not download sitemap " + sitemapUrl + ": " + e.getMessage(), e);
        }
        if (content == null) {
            throw new SitemapFetchException("Sitemap " + sitemapUrl + " is empty or too large");
        }

        AbstractSiteMap result;
        try {
            result = parse(content, sitemapUrl);
        } catch (UnknownFormatException | IOException | IllegalArgumentException e) {
            throw new SitemapFetchException("Could not parse sitemap " + sitemapUrl + ": " + e.getMessage(), e);
        }

        if (result instanceof SiteMapIndex index) {
            List<String> urls = new ArrayList<>();
            for (AbstractSiteMap child : index.getSitemaps()) {
                urls.addAll(parseSingleSitemap(child.getUrl().toString()));
            }
            log.info("Sitemap index {} listed {} pages in {} sitemaps",
                    sitemapUrl, urls.size(), index.getSitemaps().size());
            return urls;
        } else if (result instanceof SiteMap siteMap) {
            List<String> urls = extractUrls(siteMap);
            log.info("Sitemap {} listed {} pages", sitemapUrl, urls.size());
            return urls;
        }
        throw new SitemapFetchException("Unsupported sitemap type at " + sitemapUrl);
    }

    /**
     * Fetch sitemap content with size limit to prevent OOM on giant sitemaps.
     */
    private byte[] fetchSitemap(String sitemapUrl) {
        byte[] content = httpClient.get()
                .uri(sitemapUrl)
                .retrieve()
                .body(byte[].class);
        if (content == null || content.length == 0) {
            return null;
        }
        if (content.length > maxSitemapSizeBytes) {
            log.warn("Sitemap at {} exceeds size limit ({} bytes > {} bytes), skipping",
                    sitemapUrl, content.length, maxSitemapSizeBytes);
            return null;
        }
        return content;
    }

    private List<String> parseSingleSitemap(String sitemapUrl) {
        try {
            byte[] content = fetchSitemap(sitemapUrl);
            if (content == null) {
                return List.of();
            }
            if (parse(content, sitemapUrl) instanceof SiteMap siteMap) {
                return extractUrls(siteMap);
            }
        } catch (Exception e) {
            log.warn("Could not parse sub-sitemap {}: {}", sitemapUrl, e.getMessage());
        }
        return List.of();
    }

    private static AbstractSiteMap parse(byte[] content, String sitemapUrl)
            throws UnknownFormatException, IOException {
        return new SiteMapParser(false).parseSiteMap(content, URI.create(sitemapUrl).toURL());
    }

    private List<String> extractUrls(SiteMap siteMap) {
        return siteMap.getSiteMapUrls().stream()
                .map(SiteMapURL::getUrl)
                .map(URL::toString)
                .toList();
    }
}
