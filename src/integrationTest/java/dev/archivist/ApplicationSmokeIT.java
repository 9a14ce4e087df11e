package dev.archivist;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.mcp.McpToolService;
import dev.archivist.retrieval.RetrievalOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

class ApplicationSmokeIT extends BaseIntegrationTest {

  @Autowired RetrievalOrchestrator orchestrator;

  @Autowired McpToolService mcpToolService;

  @Autowired JdbcTemplate jdbcTemplate;

  @Test
  void contextLoadsWithMigratedSchema() {
    assertThat(orchestrator).isNotNull();
    assertThat(mcpToolService).isNotNull();

    Integer indexes =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM pg_indexes WHERE tablename = 'document_chunks'", Integer.class);
    assertThat(indexes).isGreaterThanOrEqualTo(4);
  }
}
