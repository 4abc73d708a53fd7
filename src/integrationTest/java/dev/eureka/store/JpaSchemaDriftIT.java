package dev.eureka.store;

import static org.assertj.core.api.Assertions.assertThat;

import dev.eureka.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=validate only checking shapes by verifying each JPA entity can be
 * persisted and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Autowired private TermRepository termRepository;

  @Autowired private DocumentRepository documentRepository;

  @Autowired private PostingRepository postingRepository;

  @Autowired private LinkEdgeRepository linkEdgeRepository;

  @Test
  void termEntityRoundtripsAgainstFlywaySchema() {
    Term saved = termRepository.saveAndFlush(new Term("roundtrip"));

    Term found = termRepository.findById(saved.getId()).orElseThrow();
    assertThat(found.getText()).isEqualTo("roundtrip");
  }

  @Test
  void documentEntityDefaultsImportanceAndKeepsTitle() {
    Document document = new Document("http://example.com/drift");
    document.setTitle("Drift");
    Document saved = documentRepository.saveAndFlush(document);

    Document found = documentRepository.findById(saved.getId()).orElseThrow();
    assertThat(found.getUrl()).isEqualTo("http://example.com/drift");
    assertThat(found.getTitle()).isEqualTo("Drift");
    assertThat(found.getImportanceScore()).isEqualTo(Document.DEFAULT_IMPORTANCE);
  }

  @Test
  void postingAndLinkEntitiesRoundtripAgainstFlywaySchema() {
    Term term = termRepository.saveAndFlush(new Term("posting"));
    Document from = documentRepository.saveAndFlush(new Document("http://example.com/from"));
    Document to = documentRepository.saveAndFlush(new Document("http://example.com/to"));

    PostingId postingId = new PostingId(term.getId(), from.getId());
    postingRepository.saveAndFlush(new Posting(postingId, 5));
    LinkEdgeId edgeId = new LinkEdgeId(from.getId(), to.getId());
    linkEdgeRepository.saveAndFlush(new LinkEdge(edgeId));

    assertThat(postingRepository.findById(postingId).orElseThrow().getWeight()).isEqualTo(5);
    assertThat(linkEdgeRepository.findById(edgeId)).isPresent();
  }
}
