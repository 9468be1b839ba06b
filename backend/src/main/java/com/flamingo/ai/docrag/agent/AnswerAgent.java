package com.flamingo.ai.docrag.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that answers a question using only the supplied document context. */
public interface AnswerAgent {

  @SystemMessage(
      "You are a helpful assistant that answers questions based on the provided context.")
  @UserMessage(
      """
        You must answer from the provided context only.

        Context:
        {{context}}

        User question: {{question}}

        Answer:
        """)
  String answer(@V("context") String context, @V("question") String question);
}
