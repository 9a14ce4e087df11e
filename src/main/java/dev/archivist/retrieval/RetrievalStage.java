package dev.archivist.retrieval;

/** States of one retrieval, in pipeline order. */
public enum RetrievalStage {
  PARSED,
  RETRIEVED,
  COMBINED,
  RERANKED,
  DEDUPLICATED,
  FILTERED,
  AGGREGATED,
  DONE,
  ERRORED
}
