package ca.siteguard.application.analysis;

import ca.siteguard.domain.tag.TagRecommendation;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Output of one recommendation pass.
 *
 * @param recommendations ordered recommendations, auto-selected first
 * @param autoSelectTags ids of auto-selected tags in recommendation order
 * @since SiteGuard 0.1
 */
public record TagRecommendations(List<TagRecommendation> recommendations, Set<String> autoSelectTags) {
  public static final TagRecommendations EMPTY = new TagRecommendations(List.of(), Set.of());

  public TagRecommendations {
    recommendations = List.copyOf(Objects.requireNonNull(recommendations, "recommendations"));
    autoSelectTags = Collections.unmodifiableSet(
        new LinkedHashSet<>(Objects.requireNonNull(autoSelectTags, "autoSelectTags")));
  }
}
