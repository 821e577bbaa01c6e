/*
 * どこで: Directory サービス層
 * 何を: アイデンティティ一覧ページの描画とページ送りトークンの発行/検証
 * なぜ: ページ状態をトークンに載せ、一覧セッションをサーバーに持たないため
 */
package com.example.directory.service;

import com.example.directory.config.PaginationProperties;
import com.example.directory.model.IdentityPageView;
import com.example.directory.model.IdentityRecord;
import com.example.directory.model.PageAction;
import com.example.directory.model.PageToken;
import com.example.directory.repository.IdentityStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdentityListingService {

  private static final Logger logger = LoggerFactory.getLogger(IdentityListingService.class);

  private final IdentityStore identityStore;
  private final PageTokenCodec codec;
  private final PaginationProperties properties;
  private final DirectoryMetrics metrics;
  private final Clock clock;

  public IdentityPageView openListing(String actorId) {
    return render(1, actorId, Instant.now(clock));
  }

  /** Validates {@code token} for {@code redeemerId} and renders the page it points to. */
  public IdentityPageView redeem(String token, String redeemerId) {
    final Instant now = Instant.now(clock);
    final PageToken validated;
    try {
      validated = codec.redeem(token, redeemerId, now);
    } catch (PageTokenException ex) {
      metrics.recordPageTokenRejected(ex.reason().name().toLowerCase(Locale.ROOT));
      logger.info("page token rejected reason={} redeemerId={}", ex.reason(), redeemerId);
      throw ex;
    }
    return render(validated.targetPage(), validated.actorId(), now);
  }

  private IdentityPageView render(int requestedPage, String actorId, Instant issuedAt) {
    final List<IdentityRecord> all = List.copyOf(identityStore.load().values());
    final int pageSize = properties.pageSize();
    final int pageCount = IdentityPages.pageCount(all.size(), pageSize);
    final int page = IdentityPages.clamp(requestedPage, pageCount);
    final int from = Math.min((page - 1) * pageSize, all.size());
    final int to = Math.min(from + pageSize, all.size());
    final String previousToken =
        page > 1 ? codec.encode(new PageToken(PageAction.PREVIOUS, page - 1, actorId, issuedAt)) : null;
    final String nextToken =
        page < pageCount
            ? codec.encode(new PageToken(PageAction.NEXT, page + 1, actorId, issuedAt))
            : null;
    return new IdentityPageView(
        page, pageCount, all.size(), all.subList(from, to), previousToken, nextToken);
  }
}
