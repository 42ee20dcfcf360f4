package de.mirkosertic.mcp.newsserver.news;

import de.mirkosertic.mcp.newsserver.provider.SearchResult;
import de.mirkosertic.mcp.newsserver.store.Article;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ArticleFactory Tests")
class ArticleFactoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ArticleFactory factory = new ArticleFactory(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Should carry provider fields through and derive source and timestamp")
    void shouldCreateArticleFromFullResult() {
        final SearchResult result = new SearchResult("ETH Upgrade Live", "https://www.coindesk.com/markets/eth",
                "Full article text", "Short snippet", "2024-04-30T08:00:00Z", 0.87);

        final Article article = factory.create(result);

        assertThat(article.id()).isNotBlank();
        assertThat(article.title()).isEqualTo("ETH Upgrade Live");
        assertThat(article.url()).isEqualTo("https://www.coindesk.com/markets/eth");
        assertThat(article.content()).isEqualTo("Full article text");
        assertThat(article.summary()).isEqualTo("Short snippet");
        assertThat(article.publishedDate()).isEqualTo("2024-04-30T08:00:00Z");
        assertThat(article.source()).isEqualTo("www.coindesk.com");
        assertThat(article.score()).isEqualTo(0.87);
        assertThat(article.timestamp()).isEqualTo(NOW.getEpochSecond());
    }

    @Test
    @DisplayName("Should fill defaults for missing snippet, date and score")
    void shouldApplyDefaults() {
        final String longContent = "x".repeat(500);
        final SearchResult result = new SearchResult("Title", "https://decrypt.co/a", longContent, null, null, null);

        final Article article = factory.create(result);

        assertThat(article.summary()).isEqualTo("x".repeat(300) + "...");
        assertThat(article.publishedDate()).isEqualTo(NOW.toString());
        assertThat(article.score()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should append ellipsis to short content without snippet")
    void shouldSummarizeShortContent() {
        assertThat(ArticleFactory.summarize(null, "short")).isEqualTo("short...");
        assertThat(ArticleFactory.summarize("  ", "short")).isEqualTo("short...");
    }

    @Test
    @DisplayName("Should keep an explicit zero score")
    void shouldKeepZeroScore() {
        final SearchResult result = new SearchResult("T", "https://a.io/x", "c", "s", null, 0.0);

        assertThat(factory.create(result).score()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should assign distinct ids")
    void shouldAssignUniqueIds() {
        final SearchResult result = new SearchResult("T", "https://a.io/x", "c", "s", null, null);

        assertThat(factory.create(result).id()).isNotEqualTo(factory.create(result).id());
    }

    @Test
    @DisplayName("Should fall back to unknown source for unparsable URLs")
    void shouldHandleBadUrls() {
        assertThat(ArticleFactory.hostOf("not a url")).isEqualTo("unknown");
        assertThat(ArticleFactory.hostOf(null)).isEqualTo("unknown");
        assertThat(ArticleFactory.hostOf("https://theblock.co/post/1")).isEqualTo("theblock.co");
    }
}
