package de.mirkosertic.mcp.newsserver.news;

import de.mirkosertic.mcp.newsserver.provider.ExtractResult;
import de.mirkosertic.mcp.newsserver.provider.ExtractionProvider;
import de.mirkosertic.mcp.newsserver.provider.ProviderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ContentExtractionService Tests")
class ContentExtractionServiceTest {

    private final ExtractionProvider provider = mock(ExtractionProvider.class);
    private final ContentExtractionService service = new ContentExtractionService(provider);

    @Test
    @DisplayName("Should return the first extraction result")
    void shouldExtractContent() throws Exception {
        when(provider.extract(List.of("https://decrypt.co/a"))).thenReturn(List.of(
                new ExtractResult("https://decrypt.co/a", "Title", "Full page text", "2024-05-01")));

        final ExtractedContent content = service.extract("https://decrypt.co/a");

        assertThat(content.url()).isEqualTo("https://decrypt.co/a");
        assertThat(content.title()).isEqualTo("Title");
        assertThat(content.content()).isEqualTo("Full page text");
        assertThat(content.publishedDate()).isEqualTo("2024-05-01");
    }

    @Test
    @DisplayName("Should fail when the provider finds nothing")
    void shouldFailOnEmptyResult() throws Exception {
        when(provider.extract(any())).thenReturn(List.of());

        assertThatThrownBy(() -> service.extract("https://decrypt.co/a"))
                .isInstanceOf(ProviderException.class)
                .hasMessage("No content found for the provided URL");
    }

    @Test
    @DisplayName("Should reject a blank URL without calling the provider")
    void shouldRejectBlankUrl() throws Exception {
        assertThatThrownBy(() -> service.extract(" "))
                .isInstanceOf(ValidationException.class);
        verify(provider, never()).extract(any());
    }
}
