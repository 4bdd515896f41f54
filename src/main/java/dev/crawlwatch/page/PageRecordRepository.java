package dev.crawlwatch.page;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data repository for {@link PageRecord} entities.
 *
 * <p>Lookups are always scoped to a client: the same URL may be tracked by several clients.
 */
public interface PageRecordRepository extends JpaRepository<PageRecord, UUID> {

  Optional<PageRecord> findByClientIdAndUrl(UUID clientId, String url);

  /** All pages of a client, used for sitemap reconciliation and crawl discovery. */
  List<PageRecord> findAllByClientId(UUID clientId);

  List<PageRecord> findAllByClientIdAndUrlIn(UUID clientId, Collection<String> urls);

  long countByClientId(UUID clientId);

  boolean existsByClientIdAndUrl(UUID clientId, String url);
}
