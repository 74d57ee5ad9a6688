package com.flamingo.ai.reindexer.service.revision;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.domain.model.RevisionId;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RevisionNamesTest {

  private static final IndexId WWW_DE = IndexId.of("www-de");

  @Nested
  @DisplayName("RevisionId.generate")
  class GenerateTests {

    @Test
    @DisplayName("should format the clock's instant in UTC at minute granularity")
    void shouldFormatInUtc() {
      Clock clock =
          Clock.fixed(Instant.parse("2025-03-01T04:30:59Z"), ZoneId.of("Europe/Berlin"));

      RevisionId revisionId = RevisionId.generate(clock);

      assertThat(revisionId.value()).isEqualTo("2025-03-01-04-30");
      assertThat(revisionId.value()).hasSize(RevisionId.LENGTH);
    }

    @Test
    @DisplayName("should order chronologically when compared lexicographically")
    void shouldOrderChronologically() {
      RevisionId earlier =
          RevisionId.generate(Clock.fixed(Instant.parse("2025-09-30T23:59:00Z"), ZoneOffset.UTC));
      RevisionId later =
          RevisionId.generate(Clock.fixed(Instant.parse("2025-10-01T00:00:00Z"), ZoneOffset.UTC));

      assertThat(earlier).isLessThan(later);
    }
  }

  @Nested
  @DisplayName("formatName / extractRevisionId")
  class NamingTests {

    @Test
    @DisplayName("should join index and revision with a dash")
    void shouldFormatName() {
      assertThat(RevisionNames.formatName(WWW_DE, new RevisionId("2025-03-01-04-30")))
          .isEqualTo("www-de-2025-03-01-04-30");
    }

    @Test
    @DisplayName("should recover the revision from a formatted name")
    void shouldExtractRevision() {
      RevisionId revisionId = new RevisionId("2025-03-01-04-30");

      assertThat(
              RevisionNames.extractRevisionId(
                  RevisionNames.formatName(WWW_DE, revisionId), WWW_DE))
          .contains(revisionId);
    }

    @Test
    @DisplayName("should yield nothing for the bare alias name")
    void shouldNotExtractFromAlias() {
      assertThat(RevisionNames.extractRevisionId("www-de", WWW_DE)).isEmpty();
    }

    @Test
    @DisplayName("should yield nothing for another index sharing the prefix")
    void shouldNotExtractFromOtherIndex() {
      assertThat(RevisionNames.extractRevisionId("www-de-at-2025-03-01-04-30", WWW_DE)).isEmpty();
    }

    @Test
    @DisplayName("should yield nothing for a different index")
    void shouldNotExtractFromUnrelatedName() {
      assertThat(RevisionNames.extractRevisionId("www-fr-2025-03-01-04-30", WWW_DE)).isEmpty();
      assertThat(RevisionNames.extractRevisionId(null, WWW_DE)).isEmpty();
    }
  }
}
