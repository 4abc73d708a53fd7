package dev.eureka.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.eureka.store.IndexStore;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PageIndexerTest {

  private static final String URL = "http://example.com/docs/";

  @Mock private IndexStore indexStore;

  private PageIndexer pageIndexer;

  @BeforeEach
  void setUp() {
    pageIndexer = new PageIndexer(indexStore);
  }

  @Test
  void writesTitlePostingsAndLinks() {
    when(indexStore.upsertTerm("search")).thenReturn(10L);
    when(indexStore.upsertTerm("engine")).thenReturn(11L);
    when(indexStore.upsertTerm("guide")).thenReturn(12L);
    when(indexStore.upsertDocument("http://example.com/docs/guide")).thenReturn(2L);

    IndexedPage page =
        pageIndexer.index(
            1L,
            URL,
            "<html><head><title>Search</title></head>"
                + "<body><p>engine</p><a href='guide'>guide</a></body></html>");

    verify(indexStore).setTitleIfAbsent(1L, "Search");
    verify(indexStore).addLink(1L, 2L);
    verify(indexStore).putPostings(1L, Map.of(10L, 7, 11L, 0, 12L, 0));
    assertThat(page.documentId()).isEqualTo(1L);
    assertThat(page.title()).isEqualTo("Search");
    assertThat(page.links()).containsExactly("http://example.com/docs/guide");
    assertThat(page.termCount()).isEqualTo(3);
  }

  @Test
  void duplicateAndUnresolvableLinksAreRecordedOnce() {
    when(indexStore.upsertDocument("http://other.org/")).thenReturn(5L);

    IndexedPage page =
        pageIndexer.index(
            1L,
            URL,
            "<a href='http://other.org'></a><a href='HTTP://OTHER.ORG/#x'></a>"
                + "<a href='mailto:me@example.com'></a><a href=''></a>");

    assertThat(page.links()).containsExactly("http://other.org/");
    verify(indexStore).addLink(1L, 5L);
    verify(indexStore).upsertDocument(anyString());
  }

  @Test
  void pageWithoutTitleLeavesTitleUntouched() {
    pageIndexer.index(1L, URL, "<p></p>");

    verify(indexStore, never()).setTitleIfAbsent(anyLong(), anyString());
    verify(indexStore, never()).addLink(anyLong(), anyLong());
    verify(indexStore).putPostings(1L, Map.of());
  }
}
