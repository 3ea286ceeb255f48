package com.flamingo.ai.corpusindex.agent;

import com.flamingo.ai.corpusindex.agent.dto.ClusterLabelResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent naming a topical cluster from a sample of its most representative documents.
 *
 * <p>Returns structured JSON; the caller validates it and falls back to a placeholder label.
 */
public interface ClusterLabelingAgent {

  @SystemMessage(
      """
        You are a research librarian organizing a corpus of scientific papers and interview
        transcripts into topical groups. You are given the titles and abstracts of the most
        representative documents of one group. Return a JSON object with three fields:

        1. "label": a concise topic name of 2-5 words. No numbering, no quotes.
        2. "description": one or two sentences (at most 300 characters) describing what the
           documents in this group have in common.
        3. "keywords": an array of 3 to 5 short keywords.

        Return ONLY valid JSON matching this structure:
        {"label": "...", "description": "...", "keywords": ["...", "...", "..."]}
        """)
  @UserMessage("""
        Representative documents:

        {{documents}}
        """)
  ClusterLabelResult label(@V("documents") String documents);
}
