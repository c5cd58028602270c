package com.flamingo.ai.webmarkdown.service.filter;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Okapi BM25 over a small in-memory corpus (the blocks of one page).
 *
 * <p>{@code idf(t) = ln((N - df + 0.5) / (df + 0.5) + 1)}, which stays positive even for terms
 * present in every document. Each distinct query term contributes {@code idf · tf·(k1+1) / (tf +
 * k1·(1 - b + b·|d|/avgdl))}.
 */
public final class Bm25Scorer {

  private final List<List<String>> corpus;
  private final List<Map<String, Integer>> termFrequencies;
  private final Map<String, Double> idf;
  private final double averageLength;
  private final double k1;
  private final double b;

  public Bm25Scorer(List<List<String>> corpus, double k1, double b) {
    this.corpus = List.copyOf(corpus);
    this.k1 = k1;
    this.b = b;
    this.termFrequencies = this.corpus.stream().map(Bm25Scorer::countTerms).toList();
    this.averageLength = this.corpus.stream().mapToInt(List::size).average().orElse(0.0);
    this.idf = computeIdf(this.corpus);
  }

  /**
   * Scores every document of the corpus against the query.
   *
   * @param query tokenized query
   * @return one score per document, in corpus order
   */
  public double[] scores(List<String> query) {
    Set<String> terms = new LinkedHashSet<>(query);
    double[] scores = new double[corpus.size()];
    for (int i = 0; i < corpus.size(); i++) {
      scores[i] = score(i, terms);
    }
    return scores;
  }

  private double score(int document, Set<String> terms) {
    Map<String, Integer> frequencies = termFrequencies.get(document);
    double length = corpus.get(document).size();
    double lengthRatio = averageLength > 0 ? length / averageLength : 0.0;
    double score = 0.0;
    for (String term : terms) {
      int tf = frequencies.getOrDefault(term, 0);
      if (tf == 0) {
        continue;
      }
      double numerator = tf * (k1 + 1);
      double denominator = tf + k1 * (1 - b + b * lengthRatio);
      score += idf.get(term) * (numerator / denominator);
    }
    return score;
  }

  private static Map<String, Integer> countTerms(List<String> document) {
    Map<String, Integer> counts = new HashMap<>();
    for (String term : document) {
      counts.merge(term, 1, Integer::sum);
    }
    return counts;
  }

  private static Map<String, Double> computeIdf(List<List<String>> corpus) {
    Map<String, Integer> documentFrequency = new HashMap<>();
    for (List<String> document : corpus) {
      for (String term : new HashSet<>(document)) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
    }
    int n = corpus.size();
    Map<String, Double> idf = new HashMap<>();
    documentFrequency.forEach(
        (term, df) -> idf.put(term, Math.log((n - df + 0.5) / (df + 0.5) + 1)));
    return idf;
  }
}
