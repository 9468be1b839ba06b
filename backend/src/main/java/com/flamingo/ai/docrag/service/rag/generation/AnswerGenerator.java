package com.flamingo.ai.docrag.service.rag.generation;

/** Produces an answer to a question from assembled context text. */
public interface AnswerGenerator {

  /**
   * Generates an answer.
   *
   * @throws com.flamingo.ai.docrag.exception.ProviderException if the provider fails
   */
  String generate(String context, String question);
}
