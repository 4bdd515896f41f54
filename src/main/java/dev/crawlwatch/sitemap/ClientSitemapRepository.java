package dev.crawlwatch.sitemap;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ClientSitemap}, keyed by client id. */
public interface ClientSitemapRepository extends JpaRepository<ClientSitemap, UUID> {}
