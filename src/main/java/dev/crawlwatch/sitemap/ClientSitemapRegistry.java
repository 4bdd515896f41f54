package dev.crawlwatch.sitemap;

import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Remembers the last sitemap URL used for each client, so a rescan can be requested without
 * repeating it. Stored in {@code client_sitemaps}, so it survives restarts.
 */
@Component
public class ClientSitemapRegistry {

  private static final Logger log = LoggerFactory.getLogger(ClientSitemapRegistry.class);

  private final ClientSitemapRepository repository;

  public ClientSitemapRegistry(ClientSitemapRepository repository) {
    this.repository = repository;
  }

  @Transactional
  public void remember(UUID clientId, String sitemapUrl) {
    ClientSitemap sitemap =
        repository
            .findById(clientId)
            .orElseGet(() -> new ClientSitemap(clientId, sitemapUrl));
    if (!sitemapUrl.equals(sitemap.getSitemapUrl())) {
      log.info("Sitemap of client {} changed to {}", clientId, sitemapUrl);
      sitemap.setSitemapUrl(sitemapUrl);
    }
    repository.save(sitemap);
  }

  @Transactional(readOnly = true)
  public Optional<String> lookup(UUID clientId) {
    return repository.findById(clientId).map(ClientSitemap::getSitemapUrl);
  }
}
